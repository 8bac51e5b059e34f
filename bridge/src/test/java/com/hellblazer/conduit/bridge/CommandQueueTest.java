package com.hellblazer.conduit.bridge;

import com.hellblazer.conduit.bridge.protocol.Command;
import com.hellblazer.conduit.bridge.protocol.CommandType;
import com.hellblazer.conduit.bridge.protocol.DrawEntry;
import com.hellblazer.conduit.bridge.subscription.PropertyUpdate;
import com.hellblazer.conduit.engine.*;
import com.hellblazer.conduit.engine.stub.StubSceneEngine;
import com.hellblazer.conduit.resource.Handle;
import com.hellblazer.conduit.resource.HandleKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandQueue, the client facade, running against the stub scene engine
 */
public class CommandQueueTest {

    private static final long TIMEOUT_MS = 5_000;

    private final List<StubSceneEngine> engines = new CopyOnWriteArrayList<>();
    private CommandQueue                queue;

    @BeforeEach
    void setUp() {
        queue = new CommandQueue(this::newEngine, BridgeConfiguration.defaultConfig());
        queue.acquire(this);
    }

    @AfterEach
    void tearDown() {
        if (queue.refCount() > 0) {
            queue.release(this);
        }
    }

    private StubSceneEngine newEngine() {
        var engine = new StubSceneEngine();
        engines.add(engine);
        return engine;
    }

    private <T> T await(CompletableFuture<T> future) throws Exception {
        return await(queue, future);
    }

    private static <T> T await(CommandQueue queue, CompletableFuture<T> future) throws Exception {
        var deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!future.isDone() && System.currentTimeMillis() < deadline) {
            queue.pollMessages();
            Thread.sleep(1);
        }
        assertTrue(future.isDone(), "Timed out waiting for an answer");
        return future.get();
    }

    private Throwable awaitFailure(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> await(future));
        return e.getCause();
    }

    private void pollUntil(BooleanSupplier condition) throws InterruptedException {
        var deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            queue.pollMessages();
            Thread.sleep(1);
        }
        assertTrue(condition.getAsBoolean(), "Timed out waiting for condition");
    }

    private Handle loadDemo() throws Exception {
        return loadDemo(queue);
    }

    private static Handle loadDemo(CommandQueue queue) throws Exception {
        return await(queue, queue.loadFile(TestScenes.demoScene()).completion());
    }

    @Test
    @DisplayName("A handle returned by a creation call is usable before the creation completes")
    void testHandleUsableImmediately() throws Exception {
        var file = queue.loadFile(TestScenes.demoScene());
        assertNotNull(file.handle());
        assertEquals(HandleKind.FILE, file.handle().kind());

        var artboard = queue.createArtboard(file.handle());
        var stateMachines = queue.getStateMachineNames(artboard.handle());
        var names = queue.getArtboardNames(file.handle());

        assertEquals(List.of("Idle", "Walk"), await(stateMachines));
        assertEquals(List.of("Main", "Badge"), await(names));
        assertEquals(file.handle(), await(file.completion()));
        assertTrue(file.isDone());
        assertTrue(artboard.isDone());
    }

    @Test
    void testIntrospection() throws Exception {
        var file = loadDemo();
        assertEquals(List.of("Player", "Stats", "Item"), await(queue.getViewModelNames(file)));
        assertEquals(List.of("Alice", "Bob"), await(queue.getViewModelInstanceNames(file, "Player")));
        assertEquals(List.of(new PropertyDescriptor("label", PropertyType.STRING)),
                     await(queue.getViewModelProperties(file, "Item")));
        assertEquals(List.of(new EnumDefinition("Mood", List.of("happy", "sad", "angry"))),
                     await(queue.getEnums(file)));

        var badge = queue.createArtboard(file, "Badge");
        assertEquals(List.of(), await(queue.getStateMachineNames(badge.handle())));
        var byIndex = queue.createArtboard(file, 1);
        assertEquals(List.of(), await(queue.getStateMachineNames(byIndex.handle())));
    }

    @Test
    void testStateMachineInputs() throws Exception {
        var file = loadDemo();
        var artboard = queue.createArtboard(file).handle();
        var idle = queue.createStateMachine(artboard).handle();

        var inputs = await(queue.getInputs(idle));
        assertEquals(List.of("speed", "running", "jump"), inputs.stream().map(PropertyDescriptor::name).toList());
        assertEquals(PropertyValue.number(1), await(queue.getInput(idle, "speed")));

        queue.setNumberInput(idle, "speed", 2.5f);
        queue.setBooleanInput(idle, "running", true);
        queue.fireInputTrigger(idle, "jump");
        assertEquals(PropertyValue.number(2.5f), await(queue.getInput(idle, "speed")));
        assertEquals(PropertyValue.bool(true), await(queue.getInput(idle, "running")));
    }

    @Test
    void testPropertyRoundTrips() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();

        assertEquals(100f, await(queue.getNumber(player, "health")));
        assertEquals("hero", await(queue.getString(player, "name")));

        queue.setNumber(player, "health", 42);
        queue.setString(player, "name", "zed");
        queue.setBoolean(player, "alive", false);
        queue.setEnum(player, "mood", "angry");
        queue.setColor(player, "tint", 0xFF00FF00);
        await(queue.setPropertyAsync(player, "stats.level", PropertyValue.number(5)));

        assertEquals(42f, await(queue.getNumber(player, "health")));
        assertEquals("zed", await(queue.getString(player, "name")));
        assertFalse(await(queue.getBoolean(player, "alive")));
        assertEquals("angry", await(queue.getEnum(player, "mood")));
        assertEquals(0xFF00FF00, await(queue.getColor(player, "tint")));
        assertEquals(5f, await(queue.getNumber(player, "stats.level")));
    }

    @Test
    void testNamedAndDefaultInstances() throws Exception {
        var file = loadDemo();
        var bob = queue.createNamedInstance(file, "Player", "Bob").handle();
        assertEquals(75f, await(queue.getNumber(bob, "health")));

        var artboard = queue.createArtboard(file, "Main").handle();
        var defaults = queue.createDefaultInstance(file, artboard).handle();
        assertEquals("alice", await(queue.getString(defaults, "name")));

        var stateMachine = queue.createStateMachine(artboard, "Idle").handle();
        queue.bindInstance(stateMachine, bob);
        var missing = queue.createNamedInstance(file, "Player", "Carol");
        assertInstanceOf(NativeOperationException.class, awaitFailure(missing.completion()));
    }

    @Test
    void testNestedInstancesShareState() throws Exception {
        var file = loadDemo();
        var alice = queue.createNamedInstance(file, "Player", "Alice").handle();
        var stats = queue.getInstanceProperty(alice, "stats").handle();

        assertEquals(3f, await(queue.getNumber(stats, "level")));
        queue.setNumber(stats, "level", 7);
        assertEquals(7f, await(queue.getNumber(alice, "stats.level")));

        var replacement = queue.createBlankInstance(file, "Stats").handle();
        queue.setNumber(replacement, "level", 11);
        queue.setInstanceProperty(alice, "stats", replacement);
        assertEquals(11f, await(queue.getNumber(alice, "stats.level")));
    }

    @Test
    void testListProperties() throws Exception {
        var file = loadDemo();
        var bob = queue.createNamedInstance(file, "Player", "Bob").handle();
        assertEquals(2, await(queue.getListSize(bob, "items")));

        var sword = queue.getListItem(bob, "items", 0).handle();
        assertEquals("sword", await(queue.getString(sword, "label")));

        var potion = queue.createBlankInstance(file, "Item").handle();
        queue.setString(potion, "label", "potion");
        queue.addListItem(bob, "items", potion);
        queue.addListItemAt(bob, "items", 0, queue.createBlankInstance(file, "Item").handle());
        assertEquals(4, await(queue.getListSize(bob, "items")));

        queue.removeListItemAt(bob, "items", 0);
        queue.removeListItem(bob, "items", sword);
        queue.swapListItems(bob, "items", 0, 1);
        assertEquals(2, await(queue.getListSize(bob, "items")));
        assertEquals("potion", await(queue.getString(queue.getListItem(bob, "items", 0).handle(), "label")));

        var outOfRange = queue.getListItem(bob, "items", 9);
        assertInstanceOf(NativeOperationException.class, awaitFailure(outOfRange.completion()));
    }

    @Test
    void testTypedFailures() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();

        var invalid = (InvalidHandleException) awaitFailure(queue.getArtboardNames(Handle.of(HandleKind.FILE, 9999)));
        assertEquals(CommandType.LIST_ARTBOARDS, invalid.getOrigin());
        assertEquals(Handle.of(HandleKind.FILE, 9999), invalid.getSubject());

        assertInstanceOf(PropertyPathException.class, awaitFailure(queue.getNumber(player, "nope")));
        assertInstanceOf(PropertyPathException.class, awaitFailure(queue.getNumber(player, "name")));
        assertInstanceOf(InvalidHandleException.class, awaitFailure(queue.getNumber(file, "health")));
    }

    @Test
    @DisplayName("A failed creation leaves a handle that later calls report as invalid")
    void testFailedCreation() throws Exception {
        var broken = queue.loadFile("not a scene".getBytes(StandardCharsets.UTF_8));
        var names = queue.getArtboardNames(broken.handle());

        assertInstanceOf(NativeOperationException.class, awaitFailure(broken.completion()));
        assertInstanceOf(InvalidHandleException.class, awaitFailure(names));
    }

    @Test
    void testFireAndForgetFailurePublishedOnErrors() throws Exception {
        var errors = queue.errors().subscribe();
        var missing = Handle.of(HandleKind.ARTBOARD, 777);
        queue.resizeArtboard(missing, 10, 10, 1);

        pollUntil(() -> errors.size() > 0);
        var error = assertInstanceOf(InvalidHandleException.class, errors.poll());
        assertEquals(0, error.getRequestId());
        assertEquals(CommandType.RESIZE_ARTBOARD, error.getOrigin());
        assertEquals(missing, error.getSubject());
    }

    @Test
    @DisplayName("N mutations of a subscribed property produce N updates in order")
    void testSubscriptionSeesEveryChange() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var subscription = queue.subscribe(player, "health", PropertyType.NUMBER);

        for (int i = 1; i <= 10; i++) {
            queue.setNumber(player, "health", i);
        }
        await(queue.getNumber(player, "health"));

        var updates = subscription.drain();
        assertEquals(10, updates.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(new PropertyUpdate(player, "health", PropertyValue.number(i + 1)), updates.get(i));
        }
        assertEquals(0, subscription.getDroppedCount());
    }

    @Test
    void testSlowSubscriberDropsOldest() throws Exception {
        var small = new CommandQueue(this::newEngine, new BridgeConfiguration.Builder().withBroadcastCapacity(4)
                                                                                       .build());
        small.acquire("small");
        try {
            var file = loadDemo(small);
            var player = await(small, small.createBlankInstance(file, "Player").completion());
            var subscription = small.subscribe(player, "health", PropertyType.NUMBER);
            for (int i = 1; i <= 10; i++) {
                small.setNumber(player, "health", i);
            }
            await(small, small.getNumber(player, "health"));

            assertEquals(6, subscription.getDroppedCount());
            var values = subscription.drain().stream().map(PropertyUpdate::value).toList();
            assertEquals(List.of(PropertyValue.number(7), PropertyValue.number(8), PropertyValue.number(9),
                                 PropertyValue.number(10)), values);
        } finally {
            small.release("small");
        }
    }

    @Test
    void testSubscriptionListenerRunsOnPollingThread() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var threads = new ArrayList<Thread>();
        var values = new ArrayList<PropertyValue>();
        var subscription = queue.subscribe(player, "mood", PropertyType.ENUM, update -> {
            threads.add(Thread.currentThread());
            values.add(update.value());
        });

        queue.setEnum(player, "mood", "sad");
        queue.setEnum(player, "mood", "bored");
        await(queue.getEnum(player, "mood"));

        assertEquals(List.of(PropertyValue.enumOption("sad")), values, "Failed mutations publish nothing");
        assertEquals(List.of(Thread.currentThread()), threads);

        subscription.close();
        queue.setEnum(player, "mood", "happy");
        await(queue.getEnum(player, "mood"));
        assertEquals(1, values.size());
    }

    @Test
    @DisplayName("Mutations queued before subscribing are never reported")
    void testSubscriptionIgnoresEarlierMutations() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        for (int i = 0; i < 2_000; i++) {
            queue.setNumber(player, "health", i);
        }
        var subscription = queue.subscribe(player, "health", PropertyType.NUMBER);
        assertFalse(subscription.isActive());
        for (int i = 1; i <= 3; i++) {
            queue.setNumber(player, "health", 5_000 + i);
        }
        assertEquals(5_003f, await(queue.getNumber(player, "health")));

        assertTrue(subscription.isActive());
        assertEquals(List.of(PropertyValue.number(5_001), PropertyValue.number(5_002), PropertyValue.number(5_003)),
                     subscription.drain().stream().map(PropertyUpdate::value).toList());
    }

    @Test
    void testLateSubscriberSeesOnlyLaterMutations() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var early = queue.subscribe(player, "health", PropertyType.NUMBER);
        queue.setNumber(player, "health", 1);
        queue.setNumber(player, "health", 2);
        var late = queue.subscribe(player, "health", PropertyType.NUMBER);
        queue.setNumber(player, "health", 3);
        await(queue.getNumber(player, "health"));

        assertEquals(3, early.drain().size());
        assertEquals(List.of(new PropertyUpdate(player, "health", PropertyValue.number(3))), late.drain());
    }

    @Test
    void testSubscribeToInvalidHandle() throws Exception {
        var errors = queue.errors().subscribe();
        var missing = Handle.of(HandleKind.BINDABLE_INSTANCE, 4242);
        var subscription = queue.subscribe(missing, "health", PropertyType.NUMBER);

        pollUntil(subscription::isClosed);
        assertFalse(subscription.isActive());
        var error = assertInstanceOf(InvalidHandleException.class, errors.poll());
        assertEquals(CommandType.SUBSCRIBE_PROPERTY, error.getOrigin());
    }

    @Test
    @DisplayName("Deleting an instance closes its subscriptions after delivering buffered updates")
    void testDeleteClosesSubscriptions() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var delivered = new ArrayList<PropertyValue>();
        var pulled = queue.subscribe(player, "health", PropertyType.NUMBER);
        var pushed = queue.subscribe(player, "name", PropertyType.STRING, update -> delivered.add(update.value()));

        queue.setNumber(player, "health", 12);
        queue.setString(player, "name", "gone");
        queue.delete(player);
        pollUntil(() -> pulled.isClosed() && pushed.isClosed());

        assertEquals(List.of(PropertyValue.text("gone")), delivered);
        assertEquals(List.of(new PropertyUpdate(player, "health", PropertyValue.number(12))), pulled.drain());
    }

    @Test
    @DisplayName("Cancelling a typed getter removes its pending request")
    void testCancelTypedGetter() throws Exception {
        var file = loadDemo();
        var player = await(queue.createBlankInstance(file, "Player").completion());
        var pendingBefore = queue.pendingRequests();

        var health = queue.getNumber(player, "health");
        assertEquals(pendingBefore + 1, queue.pendingRequests());
        assertTrue(health.cancel(false));
        assertEquals(pendingBefore, queue.pendingRequests());

        assertEquals("hero", await(queue.getString(player, "name")));
        assertTrue(health.isCancelled());
    }

    @Test
    void testArtboardProperty() throws Exception {
        var file = loadDemo();
        var other = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var badge = queue.createArtboard(file, "Badge").handle();
        var foreign = queue.createArtboard(other, "Badge").handle();
        var errors = queue.errors().subscribe();

        queue.setArtboardProperty(player, "badge", file, badge);
        queue.setArtboardProperty(player, "badge", null, null);
        queue.setArtboardProperty(player, "badge", file, foreign);
        queue.setArtboardProperty(player, "avatar", file, badge);
        queue.setArtboardProperty(player, "badge", file, Handle.of(HandleKind.ARTBOARD, 999));
        await(queue.getListSize(player, "items"));

        pollUntil(() -> errors.size() == 3);
        var mismatched = assertInstanceOf(NativeOperationException.class, errors.poll());
        assertEquals(CommandType.SET_ARTBOARD_PROPERTY, mismatched.getOrigin());
        assertInstanceOf(PropertyPathException.class, errors.poll());
        assertInstanceOf(InvalidHandleException.class, errors.poll());
    }

    @Test
    void testSettledEvents() throws Exception {
        var file = loadDemo();
        var artboard = queue.createArtboard(file).handle();
        var walk = queue.createStateMachine(artboard, "Walk").handle();
        var idle = queue.createStateMachine(artboard, "Idle").handle();
        var settled = new ArrayList<Handle>();
        queue.settledEvents().subscribe(settled::add);

        queue.advanceStateMachine(idle, 0.1f);
        queue.advanceStateMachine(walk, 0.016f);
        pollUntil(() -> !settled.isEmpty());
        assertEquals(List.of(walk), settled);

        queue.advanceStateMachine(idle, 0.5f);
        pollUntil(() -> settled.size() == 2);
        assertEquals(idle, settled.get(1));
    }

    @Test
    void testPointerEventsAccepted() throws Exception {
        var file = loadDemo();
        var artboard = queue.createArtboard(file).handle();
        var idle = queue.createStateMachine(artboard).handle();
        var errors = queue.errors().subscribe();

        queue.pointerDown(idle, 100, 50, 200, 100, Fit.CONTAIN, Alignment.CENTER);
        queue.pointerMove(idle, 110, 50, 200, 100, Fit.CONTAIN, Alignment.CENTER);
        queue.pointerUp(idle, 110, 50, 200, 100, Fit.CONTAIN, Alignment.CENTER);
        queue.pointerExit(idle, 300, 50, 200, 100, Fit.CONTAIN, Alignment.CENTER);
        queue.pointerDown(Handle.of(HandleKind.STATE_MACHINE, 31337), 0, 0, 1, 1, Fit.FILL, Alignment.TOP_LEFT);

        pollUntil(() -> errors.size() > 0);
        await(queue.getInputs(idle));
        assertEquals(1, errors.size());
        assertEquals(CommandType.POINTER_EVENT, errors.poll().getOrigin());
    }

    @Test
    void testDrawAndReadPixels() throws Exception {
        var file = loadDemo();
        var artboard = queue.createArtboard(file, "Main").handle();
        var surface = queue.createSurface(200, 100).handle();
        var target = queue.createRenderTarget(surface, 1).handle();
        var key = queue.createDrawKey();
        assertEquals(HandleKind.DRAW_KEY, key.kind());

        assertEquals(1, await(queue.draw(key, surface, target, artboard, null, Fit.CONTAIN, Alignment.CENTER, 0)));
        var pixels = await(queue.readPixels(surface));
        assertEquals(200 * 100 * 4, pixels.length);
        var center = (50 * 200 + 100) * 4;
        assertEquals((byte) 0x33, pixels[center]);
        assertEquals((byte) 0x66, pixels[center + 1]);
        assertEquals((byte) 0xCC, pixels[center + 2]);
        assertEquals((byte) 0xFF, pixels[center + 3]);
    }

    @Test
    @DisplayName("A batch of 100 draws is one command and one answer")
    void testBatchDraw() throws Exception {
        var file = loadDemo();
        var artboard = queue.createArtboard(file, "Main").handle();
        var stateMachine = queue.createStateMachine(artboard).handle();
        var surface = queue.createSurface(64, 64).handle();
        var target = queue.createRenderTarget(surface, 4).handle();
        await(queue.getInputs(stateMachine));

        var entries = IntStream.range(0, 100).mapToObj(i -> DrawEntry.of(artboard, stateMachine)).toList();
        var pendingBefore = queue.pendingRequests();
        var drawn = queue.drawBatch(queue.createDrawKey(), surface, target, entries, DrawConfig.defaults());
        assertEquals(pendingBefore + 1, queue.pendingRequests());
        assertEquals(100, await(drawn));
        assertEquals(1, engines.get(0).getFrameCount());
        assertEquals(100, engines.get(0).getDrawnOperationCount());
    }

    @Test
    void testDeleteThenUse() throws Exception {
        var surface = queue.createSurface(4, 4).handle();
        await(queue.readPixels(surface));

        queue.delete(surface);
        assertInstanceOf(InvalidHandleException.class, awaitFailure(queue.readPixels(surface)));

        var errors = queue.errors().subscribe();
        queue.delete(surface);
        pollUntil(() -> errors.size() > 0);
        assertEquals(CommandType.DELETE, errors.poll().getOrigin());

        queue.delete(queue.createDrawKey());
    }

    @Test
    void testAssets() throws Exception {
        var file = loadDemo();
        var player = queue.createBlankInstance(file, "Player").handle();
        var image = queue.decodeImage(new byte[] { 1, 2, 3, 4 });
        var font = queue.decodeFont(new byte[] { 5 });
        var audio = queue.decodeAudio(new byte[] { 6, 7 });
        assertEquals(HandleKind.IMAGE, await(image.completion()).kind());
        assertEquals(HandleKind.FONT, await(font.completion()).kind());
        assertEquals(HandleKind.AUDIO, await(audio.completion()).kind());

        var errors = queue.errors().subscribe();
        queue.registerAsset("logo.png", image.handle());
        queue.setImageProperty(player, "avatar", image.handle());
        queue.setImageProperty(player, "avatar", null);
        queue.unregisterAsset(AssetType.IMAGE, "logo.png");
        queue.unregisterAsset(AssetType.IMAGE, "logo.png");
        queue.setImageProperty(player, "avatar", font.handle());

        pollUntil(() -> errors.size() == 2);
        assertInstanceOf(NativeOperationException.class, errors.poll());
        assertInstanceOf(InvalidHandleException.class, errors.poll());

        assertInstanceOf(NativeOperationException.class, awaitFailure(queue.decodeImage(new byte[0]).completion()));
    }

    @Test
    void testCancelledRequestIgnoresLateAnswer() throws Exception {
        var file = loadDemo();
        var names = queue.getArtboardNames(file);
        assertTrue(names.cancel(false));
        assertEquals(0, queue.pendingRequests());
        assertEquals(List.of("Player", "Stats", "Item"), await(queue.getViewModelNames(file)));
        assertTrue(names.isCancelled());
    }

    @Test
    @DisplayName("Releasing the last reference fails pending requests and refuses further calls")
    void testTeardown() throws Exception {
        var file = loadDemo();
        var engine = engines.get(0);
        var pending = queue.getArtboardNames(file);

        queue.release(this);
        assertFalse(queue.isRunning());
        assertEquals(0, queue.refCount());
        assertInstanceOf(LifecycleException.class,
                         assertThrows(ExecutionException.class, () -> pending.get(1, TimeUnit.SECONDS)).getCause());
        assertEquals(0, queue.pendingRequests());
        assertFalse(engine.hasContext());
        assertEquals(0, engine.getLiveObjectCount());

        assertThrows(LifecycleException.class, () -> queue.getArtboardNames(file));
        assertThrows(LifecycleException.class, () -> queue.loadFile(TestScenes.demoScene()));
        assertThrows(LifecycleException.class, () -> queue.setNumber(file, "x", 1));
        assertThrows(LifecycleException.class, () -> queue.pollMessages());
    }

    @Test
    @DisplayName("Re-acquiring starts a fresh session where old handles are invalid")
    void testReacquire() throws Exception {
        var old = loadDemo();
        queue.release(this);
        queue.acquire(this);

        assertEquals(2, queue.startCount());
        assertEquals(1, queue.stopCount());
        assertEquals(2, engines.size());
        assertInstanceOf(InvalidHandleException.class, awaitFailure(queue.getArtboardNames(old)));

        var fresh = loadDemo();
        assertTrue(fresh.id() > old.id(), "Handle ids are never reused");
        assertEquals(List.of("Main", "Badge"), await(queue.getArtboardNames(fresh)));
    }

    @Test
    void testReferenceCounting() {
        assertEquals(1, queue.refCount());
        queue.acquire(this);
        queue.acquire("other");
        assertEquals(3, queue.refCount());
        assertEquals(1, queue.startCount());

        queue.release(this);
        queue.release("other");
        assertTrue(queue.isRunning());
        assertEquals(0, queue.stopCount());

        assertThrows(LifecycleException.class, () -> queue.release("stranger"));
        assertEquals(1, queue.refCount());
    }

    @Test
    void testCallsWithoutSessionThrow() {
        var idle = new CommandQueue(this::newEngine);
        assertFalse(idle.isRunning());
        assertThrows(LifecycleException.class, () -> idle.loadFile(new byte[] { 1 }));
        assertThrows(LifecycleException.class, idle::pollMessages);
        assertThrows(LifecycleException.class, () -> idle.release("nobody"));
        assertEquals(0, idle.startCount());
        assertEquals(1, engines.size(), "No engine is created without an acquire");
    }

    @Test
    @DisplayName("Concurrent acquire and release start and stop exactly one session")
    void testConcurrentAcquireRelease() throws Exception {
        var shared = new CommandQueue(this::newEngine, BridgeConfiguration.minimalConfig());
        int threads = 8;
        var barrier = new CyclicBarrier(threads);
        var failures = new CopyOnWriteArrayList<Throwable>();
        var workers = new ArrayList<Thread>();
        for (int i = 0; i < threads; i++) {
            var tag = "client-" + i;
            workers.add(new Thread(() -> {
                try {
                    shared.acquire(tag);
                    barrier.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
                    assertTrue(shared.isRunning());
                    barrier.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
                    shared.release(tag);
                } catch (Throwable t) {
                    failures.add(t);
                }
            }));
        }
        workers.forEach(Thread::start);
        for (var worker : workers) {
            worker.join(TIMEOUT_MS);
        }

        assertTrue(failures.isEmpty(), () -> "Failures: " + failures);
        assertEquals(1, shared.startCount());
        assertEquals(1, shared.stopCount());
        assertEquals(0, shared.refCount());
        assertFalse(shared.isRunning());
    }

    @Test
    void testProtocolViolationIsFatal() throws Exception {
        var file = loadDemo();
        var rogue = queue.request(id -> new Command() {
            @Override
            public CommandType type() {
                return CommandType.DRAW;
            }

            @Override
            public long requestId() {
                return id;
            }
        }, message -> message);

        var violation = assertInstanceOf(ProtocolViolationException.class, awaitFailure(rogue));
        assertEquals(ErrorKind.PROTOCOL, violation.getKind());
        assertThrows(ProtocolViolationException.class, () -> queue.getArtboardNames(file));

        queue.release(this);
        assertEquals(1, queue.stopCount());
        queue.acquire(this);
        assertEquals(List.of("Main", "Badge"), await(queue.getArtboardNames(loadDemo())));
    }
}
