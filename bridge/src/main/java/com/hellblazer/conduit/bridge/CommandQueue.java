/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Conduit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.conduit.bridge;

import com.hellblazer.conduit.bridge.channel.MessageChannel;
import com.hellblazer.conduit.bridge.protocol.Command;
import com.hellblazer.conduit.bridge.protocol.DrawEntry;
import com.hellblazer.conduit.bridge.protocol.Message;
import com.hellblazer.conduit.bridge.server.CommandServer;
import com.hellblazer.conduit.bridge.subscription.Broadcast;
import com.hellblazer.conduit.bridge.subscription.BroadcastListener;
import com.hellblazer.conduit.bridge.subscription.PropertySubscription;
import com.hellblazer.conduit.bridge.subscription.PropertyUpdate;
import com.hellblazer.conduit.bridge.subscription.SubscriptionRegistry;
import com.hellblazer.conduit.engine.*;
import com.hellblazer.conduit.resource.Handle;
import com.hellblazer.conduit.resource.HandleAllocator;
import com.hellblazer.conduit.resource.HandleKind;
import com.hellblazer.conduit.resource.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * Client facade of the command bridge. Safe to call from any thread; every call is turned into a {@link Command}
 * executed in submission order by a dedicated command server thread that owns the scene engine.
 * <p>
 * Three call shapes:
 * <ul>
 * <li>Creation calls return a {@link PendingHandle}. The handle is usable immediately: a command referencing it
 * always executes after the command that creates it.</li>
 * <li>Queries and {@code ...Async} mutations return a {@link CompletableFuture} completed during a later
 * {@link #pollMessages()}, exceptionally with a {@link BridgeException} subclass on failure.</li>
 * <li>Fire-and-forget mutations return nothing. <b>Their failures are only visible on {@link #errors()}</b> (or
 * through a later query); nothing is thrown to the caller once the command has been queued.</li>
 * </ul>
 * The queue is reference counted: the first {@link #acquire} starts a session (worker thread, engine context,
 * resource registry) and the last {@link #release} tears it down, failing every pending future with
 * {@link LifecycleException}. Calls made without a running session throw {@link LifecycleException}. Handle ids are
 * never reused, even across sessions, so a stale handle from an earlier session is always reported as invalid.
 * <p>
 * Futures complete, and broadcasts and subscriptions deliver, only inside {@link #pollMessages()}, on the polling
 * thread; nothing is ever invoked from within an enqueueing call.
 *
 * @author hal.hildebrand
 */
public class CommandQueue implements RefCounted {
    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    private final Supplier<SceneEngine>        engineFactory;
    private final BridgeConfiguration          config;
    private final HandleAllocator              allocator     = new HandleAllocator();
    private final AtomicLong                   nextRequestId = new AtomicLong(1);
    private final Correlator                   correlator    = new Correlator();
    private final SubscriptionRegistry         subscriptions;
    private final Broadcast<Handle>            settled;
    private final Broadcast<BridgeException>   errors;
    private final ReentrantLock                lifecycle     = new ReentrantLock();
    private final ReentrantLock                polling       = new ReentrantLock();
    private final Map<Object, Integer>         references    = new HashMap<>();
    private final AtomicInteger                starts        = new AtomicInteger(0);
    private final AtomicInteger                stops         = new AtomicInteger(0);
    private int                                refCount;
    private volatile Session                   session;

    private record Session(CommandServer server, ResourceRegistry registry, MessageChannel messages) {
    }

    @FunctionalInterface
    private interface CreationCommand {
        Command create(long requestId, Handle handle);
    }

    public CommandQueue(Supplier<SceneEngine> engineFactory) {
        this(engineFactory, BridgeConfiguration.defaultConfig());
    }

    /**
     * @param engineFactory supplies a fresh engine for every session
     */
    public CommandQueue(Supplier<SceneEngine> engineFactory, BridgeConfiguration config) {
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.config = Objects.requireNonNull(config, "config");
        this.subscriptions = new SubscriptionRegistry(config.getBroadcastCapacity(), this::unsubscribed);
        this.settled = new Broadcast<>("settled", config.getBroadcastCapacity());
        this.errors = new Broadcast<>("errors", config.getBroadcastCapacity());
    }

    // Lifecycle

    @Override
    public void acquire(Object tag) {
        Objects.requireNonNull(tag, "tag");
        lifecycle.lock();
        try {
            if (refCount == 0) {
                session = startSession();
            }
            references.merge(tag, 1, Integer::sum);
            refCount++;
            log.debug("Acquired by {} (count {})", tag, refCount);
        } finally {
            lifecycle.unlock();
        }
    }

    @Override
    public void release(Object tag) {
        Objects.requireNonNull(tag, "tag");
        lifecycle.lock();
        try {
            var count = references.get(tag);
            if (count == null) {
                throw new LifecycleException(refCount == 0 ? "Released " + tag + " but the queue holds no references"
                                                           : "Released " + tag + " without a matching acquire");
            }
            if (count == 1) {
                references.remove(tag);
            } else {
                references.put(tag, count - 1);
            }
            refCount--;
            log.debug("Released by {} (count {})", tag, refCount);
            if (refCount == 0) {
                stopSession();
            }
        } finally {
            lifecycle.unlock();
        }
    }

    @Override
    public int refCount() {
        lifecycle.lock();
        try {
            return refCount;
        } finally {
            lifecycle.unlock();
        }
    }

    public boolean isRunning() {
        var current = session;
        return current != null && current.server().isRunning();
    }

    /**
     * Number of sessions started over the queue's lifetime
     */
    public int startCount() {
        return starts.get();
    }

    /**
     * Number of sessions torn down over the queue's lifetime
     */
    public int stopCount() {
        return stops.get();
    }

    public int pendingRequests() {
        return correlator.pending();
    }

    public BridgeConfiguration getConfiguration() {
        return config;
    }

    // Polling and broadcasts

    /**
     * Process queued messages: complete the futures they answer, then deliver settle events, errors and property
     * updates to listeners. Intended to be called once per frame.
     *
     * @return the number of messages processed
     */
    public int pollMessages() {
        var current = session;
        if (current == null) {
            throw new LifecycleException("Command queue has no running session");
        }
        polling.lock();
        try {
            var processed = current.messages().drain(config.getMaxMessagesPerPoll(), this::dispatch);
            subscriptions.deliver();
            settled.deliver();
            errors.deliver();
            return processed;
        } finally {
            polling.unlock();
        }
    }

    /**
     * State machines that settled after being advanced
     */
    public Broadcast<Handle> settledEvents() {
        return settled;
    }

    /**
     * Failures of fire-and-forget commands, and commands refused because the server was shutting down
     */
    public Broadcast<BridgeException> errors() {
        return errors;
    }

    public PropertySubscription subscribe(Handle instance, String path, PropertyType type) {
        return subscribe(instance, path, type, null);
    }

    /**
     * Subscribe to changes of a value property of a bindable instance. Every mutation queued after this call
     * produces one update carrying the value read back after the mutation; mutations queued before it produce none.
     * <p>
     * The subscription is registered with the command server in queue order and becomes active during the poll
     * that processes the registration. If the registration fails, the subscription is closed and the failure is
     * published on {@link #errors()}. Deleting the instance closes its subscriptions.
     *
     * @param listener invoked with each update during {@link #pollMessages()}, or null to consume by pulling
     */
    public PropertySubscription subscribe(Handle instance, String path, PropertyType type,
                                          BroadcastListener<PropertyUpdate> listener) {
        requireSession();
        var subscription = subscriptions.subscribePending(instance, path, type, listener);
        CompletableFuture<Void> registered;
        try {
            registered = request(id -> new Command.SubscribeProperty(id, instance, path, type),
                                 CommandQueue::completed);
        } catch (BridgeException e) {
            subscription.close();
            throw e;
        }
        registered.whenComplete((ignored, error) -> {
            if (error == null) {
                subscriptions.activate(subscription);
                return;
            }
            log.debug("Subscription to {} {} not registered: {}", instance, path, error.toString());
            subscription.close();
            if (error instanceof BridgeException failure && !(error instanceof LifecycleException)) {
                errors.emit(failure);
            }
        });
        return subscription;
    }

    // Files

    public PendingHandle loadFile(byte[] bytes) {
        return create(HandleKind.FILE, (id, file) -> new Command.LoadFile(id, file, bytes));
    }

    public CompletableFuture<List<String>> getArtboardNames(Handle file) {
        return request(id -> new Command.ListArtboards(id, file), CommandQueue::names);
    }

    public CompletableFuture<List<String>> getStateMachineNames(Handle artboard) {
        return request(id -> new Command.ListStateMachines(id, artboard), CommandQueue::names);
    }

    public CompletableFuture<List<String>> getViewModelNames(Handle file) {
        return request(id -> new Command.ListViewModels(id, file), CommandQueue::names);
    }

    public CompletableFuture<List<String>> getViewModelInstanceNames(Handle file, String viewModel) {
        return request(id -> new Command.ListViewModelInstances(id, file, viewModel), CommandQueue::names);
    }

    public CompletableFuture<List<PropertyDescriptor>> getViewModelProperties(Handle file, String viewModel) {
        return request(id -> new Command.ListViewModelProperties(id, file, viewModel), CommandQueue::descriptors);
    }

    public CompletableFuture<List<EnumDefinition>> getEnums(Handle file) {
        return request(id -> new Command.ListEnums(id, file), m -> ((Message.Enums) m).enums());
    }

    // Artboards

    public PendingHandle createArtboard(Handle file) {
        return createArtboard(file, Selector.byDefault());
    }

    public PendingHandle createArtboard(Handle file, String name) {
        return createArtboard(file, Selector.byName(name));
    }

    public PendingHandle createArtboard(Handle file, int index) {
        return createArtboard(file, Selector.byIndex(index));
    }

    public PendingHandle createArtboard(Handle file, Selector selector) {
        return create(HandleKind.ARTBOARD, (id, artboard) -> new Command.CreateArtboard(id, file, selector, artboard));
    }

    /**
     * Resize an artboard for the layout fit. Fire-and-forget.
     */
    public void resizeArtboard(Handle artboard, float width, float height, float scale) {
        send(new Command.ResizeArtboard(0, artboard, width, height, scale));
    }

    public void resetArtboardSize(Handle artboard) {
        send(new Command.ResetArtboardSize(0, artboard));
    }

    // State machines

    public PendingHandle createStateMachine(Handle artboard) {
        return createStateMachine(artboard, Selector.byDefault());
    }

    public PendingHandle createStateMachine(Handle artboard, String name) {
        return createStateMachine(artboard, Selector.byName(name));
    }

    public PendingHandle createStateMachine(Handle artboard, int index) {
        return createStateMachine(artboard, Selector.byIndex(index));
    }

    public PendingHandle createStateMachine(Handle artboard, Selector selector) {
        return create(HandleKind.STATE_MACHINE,
                      (id, stateMachine) -> new Command.CreateStateMachine(id, artboard, selector, stateMachine));
    }

    /**
     * Advance a state machine. Fire-and-forget; if it settles, its handle is published on {@link #settledEvents()}.
     */
    public void advanceStateMachine(Handle stateMachine, float seconds) {
        send(new Command.AdvanceStateMachine(0, stateMachine, seconds));
    }

    public CompletableFuture<List<PropertyDescriptor>> getInputs(Handle stateMachine) {
        return request(id -> new Command.ListInputs(id, stateMachine), CommandQueue::descriptors);
    }

    public CompletableFuture<PropertyValue> getInput(Handle stateMachine, String name) {
        return request(id -> new Command.GetInput(id, stateMachine, name), CommandQueue::value);
    }

    public void setNumberInput(Handle stateMachine, String name, float value) {
        send(new Command.SetInput(0, stateMachine, name, PropertyValue.number(value)));
    }

    public void setBooleanInput(Handle stateMachine, String name, boolean value) {
        send(new Command.SetInput(0, stateMachine, name, PropertyValue.bool(value)));
    }

    public void fireInputTrigger(Handle stateMachine, String name) {
        send(new Command.SetInput(0, stateMachine, name, PropertyValue.trigger()));
    }

    public void pointer(Handle stateMachine, PointerEvent event) {
        send(new Command.Pointer(0, stateMachine, event));
    }

    public void pointerDown(Handle stateMachine, float x, float y, float surfaceWidth, float surfaceHeight, Fit fit,
                            Alignment alignment) {
        pointer(stateMachine,
                new PointerEvent(PointerEvent.Phase.DOWN, 0, x, y, surfaceWidth, surfaceHeight, fit, alignment));
    }

    public void pointerMove(Handle stateMachine, float x, float y, float surfaceWidth, float surfaceHeight, Fit fit,
                            Alignment alignment) {
        pointer(stateMachine,
                new PointerEvent(PointerEvent.Phase.MOVE, 0, x, y, surfaceWidth, surfaceHeight, fit, alignment));
    }

    public void pointerUp(Handle stateMachine, float x, float y, float surfaceWidth, float surfaceHeight, Fit fit,
                          Alignment alignment) {
        pointer(stateMachine,
                new PointerEvent(PointerEvent.Phase.UP, 0, x, y, surfaceWidth, surfaceHeight, fit, alignment));
    }

    public void pointerExit(Handle stateMachine, float x, float y, float surfaceWidth, float surfaceHeight, Fit fit,
                            Alignment alignment) {
        pointer(stateMachine,
                new PointerEvent(PointerEvent.Phase.EXIT, 0, x, y, surfaceWidth, surfaceHeight, fit, alignment));
    }

    // Data binding

    public PendingHandle createInstance(Handle file, String viewModel, InstanceSource source, String instanceName) {
        return create(HandleKind.BINDABLE_INSTANCE,
                      (id, instance) -> new Command.CreateInstance(id, file, viewModel, source, instanceName,
                                                                   instance));
    }

    public PendingHandle createBlankInstance(Handle file, String viewModel) {
        return createInstance(file, viewModel, InstanceSource.BLANK, null);
    }

    public PendingHandle createNamedInstance(Handle file, String viewModel, String instanceName) {
        return createInstance(file, viewModel, InstanceSource.NAMED, instanceName);
    }

    /**
     * Create the default instance of the view model an artboard is authored against
     */
    public PendingHandle createDefaultInstance(Handle file, Handle artboard) {
        return create(HandleKind.BINDABLE_INSTANCE,
                      (id, instance) -> new Command.CreateDefaultInstance(id, file, artboard, instance));
    }

    public void bindInstance(Handle stateMachine, Handle instance) {
        send(new Command.BindInstance(0, stateMachine, instance));
    }

    public CompletableFuture<PropertyValue> getProperty(Handle instance, String path, PropertyType type) {
        return request(id -> new Command.GetProperty(id, instance, path, type), CommandQueue::value);
    }

    public CompletableFuture<Float> getNumber(Handle instance, String path) {
        return getTyped(instance, path, PropertyType.NUMBER, v -> ((PropertyValue.NumberValue) v).value());
    }

    public CompletableFuture<String> getString(Handle instance, String path) {
        return getTyped(instance, path, PropertyType.STRING, v -> ((PropertyValue.TextValue) v).value());
    }

    public CompletableFuture<Boolean> getBoolean(Handle instance, String path) {
        return getTyped(instance, path, PropertyType.BOOLEAN, v -> ((PropertyValue.BooleanValue) v).value());
    }

    public CompletableFuture<String> getEnum(Handle instance, String path) {
        return getTyped(instance, path, PropertyType.ENUM, v -> ((PropertyValue.EnumValue) v).value());
    }

    public CompletableFuture<Integer> getColor(Handle instance, String path) {
        return getTyped(instance, path, PropertyType.COLOR, v -> ((PropertyValue.ColorValue) v).argb());
    }

    /**
     * Set a value property. Fire-and-forget.
     */
    public void setProperty(Handle instance, String path, PropertyValue value) {
        send(new Command.SetProperty(0, instance, path, value));
    }

    /**
     * Set a value property and observe the outcome
     */
    public CompletableFuture<Void> setPropertyAsync(Handle instance, String path, PropertyValue value) {
        return request(id -> new Command.SetProperty(id, instance, path, value), CommandQueue::completed);
    }

    public void setNumber(Handle instance, String path, float value) {
        setProperty(instance, path, PropertyValue.number(value));
    }

    public void setString(Handle instance, String path, String value) {
        setProperty(instance, path, PropertyValue.text(value));
    }

    public void setBoolean(Handle instance, String path, boolean value) {
        setProperty(instance, path, PropertyValue.bool(value));
    }

    public void setEnum(Handle instance, String path, String option) {
        setProperty(instance, path, PropertyValue.enumOption(option));
    }

    public void setColor(Handle instance, String path, int argb) {
        setProperty(instance, path, PropertyValue.color(argb));
    }

    public void fireTrigger(Handle instance, String path) {
        setProperty(instance, path, PropertyValue.trigger());
    }

    /**
     * Reference a nested view model instance under a new handle; it shares state with the parent's property
     */
    public PendingHandle getInstanceProperty(Handle instance, String path) {
        return create(HandleKind.BINDABLE_INSTANCE,
                      (id, nested) -> new Command.GetInstanceProperty(id, instance, path, nested));
    }

    public void setInstanceProperty(Handle instance, String path, Handle nested) {
        send(new Command.SetInstanceProperty(0, instance, path, nested));
    }

    /**
     * Assign a decoded image to an image property; a null or absent image clears it
     */
    public void setImageProperty(Handle instance, String path, Handle image) {
        send(new Command.SetImageProperty(0, instance, path, image == null ? Handle.absent(HandleKind.IMAGE) : image));
    }

    /**
     * Assign an artboard instantiated from {@code file} to an artboard property. A null artboard clears the
     * property and the file is then ignored.
     */
    public void setArtboardProperty(Handle instance, String path, Handle file, Handle artboard) {
        send(new Command.SetArtboardProperty(0, instance, path, file == null ? Handle.absent(HandleKind.FILE) : file,
                                             artboard == null ? Handle.absent(HandleKind.ARTBOARD) : artboard));
    }

    public CompletableFuture<Integer> getListSize(Handle instance, String path) {
        return request(id -> new Command.GetListSize(id, instance, path), m -> ((Message.Count) m).count());
    }

    public PendingHandle getListItem(Handle instance, String path, int index) {
        return create(HandleKind.BINDABLE_INSTANCE,
                      (id, item) -> new Command.GetListItem(id, instance, path, index, item));
    }

    public void addListItem(Handle instance, String path, Handle item) {
        addListItemAt(instance, path, -1, item);
    }

    public void addListItemAt(Handle instance, String path, int index, Handle item) {
        send(new Command.AddListItem(0, instance, path, index, item));
    }

    public void removeListItem(Handle instance, String path, Handle item) {
        send(new Command.RemoveListItem(0, instance, path, -1, item));
    }

    public void removeListItemAt(Handle instance, String path, int index) {
        send(new Command.RemoveListItem(0, instance, path, index, Handle.absent(HandleKind.BINDABLE_INSTANCE)));
    }

    public void swapListItems(Handle instance, String path, int indexA, int indexB) {
        send(new Command.SwapListItems(0, instance, path, indexA, indexB));
    }

    // Assets

    public PendingHandle decodeImage(byte[] bytes) {
        return decodeAsset(AssetType.IMAGE, HandleKind.IMAGE, bytes);
    }

    public PendingHandle decodeAudio(byte[] bytes) {
        return decodeAsset(AssetType.AUDIO, HandleKind.AUDIO, bytes);
    }

    public PendingHandle decodeFont(byte[] bytes) {
        return decodeAsset(AssetType.FONT, HandleKind.FONT, bytes);
    }

    /**
     * Register a decoded asset under the name scene files reference it by. Files loaded afterwards resolve the
     * name to this asset.
     */
    public void registerAsset(String name, Handle asset) {
        send(new Command.RegisterAsset(0, name, asset));
    }

    public void unregisterAsset(AssetType type, String name) {
        send(new Command.UnregisterAsset(0, type, name));
    }

    // Drawing

    public PendingHandle createSurface(int width, int height) {
        return create(HandleKind.SURFACE, (id, surface) -> new Command.CreateSurface(id, width, height, surface));
    }

    public PendingHandle createRenderTarget(Handle surface, int sampleCount) {
        return create(HandleKind.RENDER_TARGET,
                      (id, target) -> new Command.CreateRenderTarget(id, surface, sampleCount, target));
    }

    /**
     * Mint a key identifying draw calls; no command is sent
     */
    public Handle createDrawKey() {
        return allocator.next(HandleKind.DRAW_KEY);
    }

    /**
     * Draw one artboard into a surface, placed by fit and alignment
     *
     * @param stateMachine the state machine driving the artboard, or null
     * @return the number of operations drawn
     */
    public CompletableFuture<Integer> draw(Handle drawKey, Handle surface, Handle renderTarget, Handle artboard,
                                           Handle stateMachine, Fit fit, Alignment alignment, int clearColor) {
        var entry = DrawEntry.of(artboard, stateMachine == null ? Handle.absent(HandleKind.STATE_MACHINE)
                                                                : stateMachine);
        return drawBatch(drawKey, surface, renderTarget, List.of(entry),
                         new DrawConfig(fit, alignment, clearColor, 1.0f));
    }

    /**
     * Draw an ordered batch of artboards into a surface as one frame, in a single command
     *
     * @return the number of operations drawn
     */
    public CompletableFuture<Integer> drawBatch(Handle drawKey, Handle surface, Handle renderTarget,
                                                List<DrawEntry> entries, DrawConfig config) {
        var key = drawKey == null ? Handle.absent(HandleKind.DRAW_KEY) : drawKey;
        return request(id -> new Command.Draw(id, key, surface, renderTarget, entries, config),
                       m -> ((Message.Drawn) m).operationCount());
    }

    /**
     * @return a copy of the surface's RGBA contents
     */
    public CompletableFuture<byte[]> readPixels(Handle surface) {
        return request(id -> new Command.ReadPixels(id, surface), m -> ((Message.Pixels) m).rgba());
    }

    /**
     * Release the native object behind a handle. Fire-and-forget; commands already queued against the handle still
     * see it, later ones fail with {@link InvalidHandleException}.
     */
    public void delete(Handle handle) {
        Objects.requireNonNull(handle, "handle");
        if (handle.kind().isClientOnly()) {
            return;
        }
        send(new Command.Delete(0, handle));
    }

    // Plumbing

    <T> CompletableFuture<T> request(LongFunction<Command> factory, Function<Message, T> extractor) {
        var current = requireSession();
        var requestId = nextRequestId.getAndIncrement();
        var command = factory.apply(requestId);
        var future = correlator.register(requestId, command.type(), extractor);
        if (!current.server().enqueue(command)) {
            correlator.discard(requestId);
            throw new LifecycleException("Command queue is shutting down, " + command.type() + " was not queued",
                                         command.type(), null, requestId);
        }
        return future;
    }

    void send(Command command) {
        var current = requireSession();
        if (!current.server().enqueue(command)) {
            throw new LifecycleException("Command queue is shutting down, " + command.type() + " was not queued",
                                         command.type(), null, 0);
        }
    }

    private PendingHandle create(HandleKind kind, CreationCommand factory) {
        requireSession();
        var handle = allocator.next(kind);
        var completion = request(id -> factory.create(id, handle), m -> ((Message.Created) m).handle());
        return new PendingHandle(handle, completion);
    }

    private <T> CompletableFuture<T> getTyped(Handle instance, String path, PropertyType type,
                                              Function<PropertyValue, T> unwrap) {
        return request(id -> new Command.GetProperty(id, instance, path, type), m -> unwrap.apply(value(m)));
    }

    private void unsubscribed(PropertySubscription subscription) {
        var current = session;
        if (current == null || !current.server().isRunning()) {
            return;
        }
        var command = new Command.UnsubscribeProperty(0, subscription.getHandle(), subscription.getPath(),
                                                      subscription.getPropertyType());
        if (!current.server().enqueue(command)) {
            log.debug("Server shutting down, {} not unregistered", subscription);
        }
    }

    private PendingHandle decodeAsset(AssetType type, HandleKind kind, byte[] bytes) {
        return create(kind, (id, asset) -> new Command.DecodeAsset(id, type, bytes, asset));
    }

    private Session requireSession() {
        var current = session;
        if (current == null) {
            throw new LifecycleException("Command queue has no running session");
        }
        var violation = current.server().getViolation();
        if (violation != null) {
            throw new ProtocolViolationException(
            "Connection closed after a protocol violation: " + violation.getMessage());
        }
        return current;
    }

    private Session startSession() {
        var registry = new ResourceRegistry(allocator);
        var messages = new MessageChannel();
        var server = new CommandServer(engineFactory.get(), registry, messages, config);
        server.start();
        var count = starts.incrementAndGet();
        log.info("Command queue session {} started", count);
        return new Session(server, registry, messages);
    }

    private void stopSession() {
        var current = session;
        session = null;
        if (current == null) {
            return;
        }
        try {
            current.server().shutdown();
        } finally {
            var failed = correlator.cancelAll(new LifecycleException("Command queue was released"));
            subscriptions.clear();
            var count = stops.incrementAndGet();
            log.info("Command queue session {} stopped, {} pending requests failed", count, failed);
        }
    }

    private void dispatch(Message message) {
        switch (message.type()) {
            case SETTLED -> settled.emit(((Message.Settled) message).stateMachine());
            case PROPERTY_CHANGED -> {
                var changed = (Message.PropertyChanged) message;
                subscriptions.publish(new PropertyUpdate(changed.instance(), changed.path(), changed.value()));
            }
            case SUBSCRIPTIONS_DROPPED -> subscriptions.dropInstance(
            ((Message.SubscriptionsDropped) message).instance());
            default -> {
                if (message.requestId() != 0) {
                    correlator.resolve(message);
                } else if (message instanceof Message.Failure failure) {
                    errors.emit(BridgeException.from(failure));
                } else {
                    log.debug("Dropped unsolicited {}", message.type());
                }
            }
        }
    }

    private static List<String> names(Message message) {
        return ((Message.Names) message).names();
    }

    private static List<PropertyDescriptor> descriptors(Message message) {
        return ((Message.Descriptors) message).descriptors();
    }

    private static PropertyValue value(Message message) {
        return ((Message.Value) message).value();
    }

    private static Void completed(Message message) {
        if (!(message instanceof Message.Completed)) {
            throw new ClassCastException("Expected COMPLETED but received " + message.type());
        }
        return null;
    }
}
