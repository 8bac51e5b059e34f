package com.hellblazer.conduit.engine.stub;

import com.hellblazer.conduit.engine.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StubSceneEngine
 */
public class StubSceneEngineTest {

    private StubSceneEngine engine;
    private SceneFile       file;

    static byte[] demoScene() throws IOException {
        try (var in = StubSceneEngineTest.class.getResourceAsStream("/scenes/demo.json")) {
            assertNotNull(in, "demo scene fixture missing");
            return in.readAllBytes();
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        engine = new StubSceneEngine();
        engine.createContext();
        file = engine.importFile(demoScene());
    }

    @AfterEach
    void tearDown() {
        if (engine.hasContext()) {
            engine.destroyContext();
        }
    }

    @Test
    void testIntrospection() {
        assertEquals(List.of("Main", "Badge"), engine.artboardNames(file));
        assertEquals(List.of("Player", "Stats", "Item"), engine.viewModelNames(file));
        assertEquals(List.of("Alice", "Bob"), engine.instanceNames(file, "Player"));
        assertEquals(List.of(new EnumDefinition("Mood", List.of("happy", "sad", "angry"))), engine.enums(file));

        var properties = engine.viewModelProperties(file, "Stats");
        assertEquals(List.of(new PropertyDescriptor("level", PropertyType.NUMBER),
                             new PropertyDescriptor("owner", PropertyType.VIEW_MODEL)), properties);
    }

    @Test
    void testMalformedFileRejected() {
        assertThrows(EngineException.class, () -> engine.importFile("not a scene".getBytes(StandardCharsets.UTF_8)));
        assertThrows(EngineException.class, () -> engine.importFile(new byte[0]));
        assertThrows(EngineException.class, () -> engine.importFile("[1, 2]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testArtboardSelection() {
        assertEquals("Main", engine.instantiateArtboard(file, Selector.byDefault()).getName());
        assertEquals("Badge", engine.instantiateArtboard(file, Selector.byName("Badge")).getName());
        assertEquals("Badge", engine.instantiateArtboard(file, Selector.byIndex(1)).getName());

        assertThrows(EngineException.class, () -> engine.instantiateArtboard(file, Selector.byName("Nope")));
        assertThrows(EngineException.class, () -> engine.instantiateArtboard(file, Selector.byIndex(2)));

        var badge = engine.instantiateArtboard(file, Selector.byName("Badge"));
        assertThrows(EngineException.class, () -> engine.instantiateStateMachine(badge, Selector.byDefault()));
    }

    @Test
    void testStateMachineSettles() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        assertEquals(List.of("Idle", "Walk"), engine.stateMachineNames(artboard));
        var sm = engine.instantiateStateMachine(artboard, Selector.byName("Idle"));

        assertFalse(engine.advance(sm, 0.25f));
        assertTrue(engine.advance(sm, 0.25f));

        engine.setInput(sm, "speed", PropertyValue.number(3));
        assertFalse(engine.advance(sm, 0.1f), "setting an input wakes the state machine");
        assertEquals(PropertyValue.number(3), engine.getInput(sm, "speed"));

        var walk = engine.instantiateStateMachine(artboard, Selector.byIndex(1));
        assertTrue(engine.advance(walk, 0));
    }

    @Test
    void testInputs() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var sm = engine.instantiateStateMachine(artboard, Selector.byDefault());

        assertEquals(List.of(new PropertyDescriptor("speed", PropertyType.NUMBER),
                             new PropertyDescriptor("running", PropertyType.BOOLEAN),
                             new PropertyDescriptor("jump", PropertyType.TRIGGER)), engine.inputs(sm));
        assertEquals(PropertyValue.bool(false), engine.getInput(sm, "running"));

        engine.setInput(sm, "jump", PropertyValue.trigger());
        engine.setInput(sm, "jump", PropertyValue.trigger());
        assertEquals(2, engine.triggerCount(sm, "jump"));

        assertThrows(EngineException.class, () -> engine.setInput(sm, "speed", PropertyValue.bool(true)));
        assertThrows(EngineException.class, () -> engine.getInput(sm, "missing"));
    }

    @Test
    void testPropertiesByPath() {
        var instance = engine.instantiateViewModel(file, "Player", InstanceSource.NAMED, "Alice");

        assertEquals(PropertyValue.number(50), engine.getProperty(instance, "health", PropertyType.NUMBER));
        assertEquals(PropertyValue.text("alice"), engine.getProperty(instance, "name", PropertyType.STRING));
        assertEquals(PropertyValue.number(3), engine.getProperty(instance, "stats.level", PropertyType.NUMBER));
        assertEquals(PropertyValue.enumOption("happy"), engine.getProperty(instance, "mood", PropertyType.ENUM));
        assertEquals(PropertyValue.color(0xFFFF0000), engine.getProperty(instance, "tint", PropertyType.COLOR));

        engine.setProperty(instance, "stats.level", PropertyValue.number(4));
        assertEquals(PropertyValue.number(4), engine.getProperty(instance, "stats.level", PropertyType.NUMBER));

        engine.setProperty(instance, "mood", PropertyValue.enumOption("sad"));
        assertThrows(EngineException.class, () -> engine.setProperty(instance, "mood", PropertyValue.enumOption("x")));

        engine.setProperty(instance, "hit", PropertyValue.trigger());
        assertEquals(1, engine.triggerCount(instance, "hit"));
    }

    @Test
    void testUnresolvedPaths() {
        var instance = engine.instantiateViewModel(file, "Player", InstanceSource.BLANK, null);

        var missing = assertThrows(PropertyPathNotFoundException.class,
                                   () -> engine.getProperty(instance, "stats.mana", PropertyType.NUMBER));
        assertEquals("stats.mana", missing.getPath());
        assertThrows(PropertyPathNotFoundException.class,
                     () -> engine.getProperty(instance, "health.value", PropertyType.NUMBER));
        assertThrows(PropertyPathNotFoundException.class,
                     () -> engine.getProperty(instance, "health", PropertyType.STRING));
        assertThrows(PropertyPathNotFoundException.class,
                     () -> engine.setProperty(instance, "", PropertyValue.number(1)));
    }

    @Test
    void testInstanceSources() {
        var blank = engine.instantiateViewModel(file, "Player", InstanceSource.BLANK, null);
        assertEquals(PropertyValue.number(100), engine.getProperty(blank, "health", PropertyType.NUMBER));
        assertEquals("", blank.getInstanceName());

        var byDefault = engine.instantiateViewModel(file, "Player", InstanceSource.DEFAULT, null);
        assertEquals("Alice", byDefault.getInstanceName());

        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var fromArtboard = engine.defaultInstance(file, artboard);
        assertEquals("Player", fromArtboard.getViewModelName());

        var badge = engine.instantiateArtboard(file, Selector.byName("Badge"));
        assertThrows(EngineException.class, () -> engine.defaultInstance(file, badge));
        assertThrows(EngineException.class,
                     () -> engine.instantiateViewModel(file, "Player", InstanceSource.NAMED, "Carol"));
        assertThrows(EngineException.class,
                     () -> engine.instantiateViewModel(file, "Ghost", InstanceSource.BLANK, null));
    }

    @Test
    @DisplayName("Nested instances share state with their parent and may form cycles")
    void testNestedInstances() {
        var player = engine.instantiateViewModel(file, "Player", InstanceSource.BLANK, null);
        var stats = engine.getInstanceProperty(player, "stats");
        engine.setProperty(stats, "level", PropertyValue.number(9));
        assertEquals(PropertyValue.number(9), engine.getProperty(player, "stats.level", PropertyType.NUMBER));

        engine.setInstanceProperty(stats, "owner", player);
        engine.setProperty(player, "health", PropertyValue.number(12));
        assertEquals(PropertyValue.number(12),
                     engine.getProperty(player, "stats.owner.stats.owner.health", PropertyType.NUMBER));

        var item = engine.instantiateViewModel(file, "Item", InstanceSource.BLANK, null);
        assertThrows(EngineException.class, () -> engine.setInstanceProperty(player, "stats", item));

        stats.close();
        assertEquals(PropertyValue.number(9), engine.getProperty(player, "stats.level", PropertyType.NUMBER));
    }

    @Test
    void testLists() {
        var bob = engine.instantiateViewModel(file, "Player", InstanceSource.NAMED, "Bob");
        assertEquals(2, engine.listSize(bob, "items"));

        var first = engine.listItem(bob, "items", 0);
        assertEquals(PropertyValue.text("sword"), engine.getProperty(first, "label", PropertyType.STRING));

        var bow = engine.instantiateViewModel(file, "Item", InstanceSource.BLANK, null);
        engine.setProperty(bow, "label", PropertyValue.text("bow"));
        engine.addListItem(bob, "items", 0, bow);
        engine.addListItem(bob, "items", -1, engine.instantiateViewModel(file, "Item", InstanceSource.BLANK, null));
        assertEquals(4, engine.listSize(bob, "items"));

        engine.swapListItems(bob, "items", 0, 1);
        assertEquals(PropertyValue.text("sword"),
                     engine.getProperty(engine.listItem(bob, "items", 0), "label", PropertyType.STRING));

        engine.removeListItem(bob, "items", bow);
        engine.removeListItem(bob, "items", 0);
        assertEquals(2, engine.listSize(bob, "items"));

        assertThrows(EngineException.class, () -> engine.listItem(bob, "items", 5));
        assertThrows(EngineException.class, () -> engine.removeListItem(bob, "items", bow));
        assertThrows(EngineException.class, () -> engine.addListItem(bob, "items", 0, bob));
        assertThrows(PropertyPathNotFoundException.class, () -> engine.listSize(bob, "health"));
    }

    @Test
    void testAssets() {
        var image = engine.decodeAsset(AssetType.IMAGE, new byte[] { 1, 2, 3 });
        var font = engine.decodeAsset(AssetType.FONT, new byte[] { 4 });
        assertThrows(EngineException.class, () -> engine.decodeAsset(AssetType.AUDIO, new byte[0]));

        engine.registerAsset("avatar.png", image);
        assertTrue(engine.isAssetRegistered(AssetType.IMAGE, "avatar.png"));
        engine.unregisterAsset(AssetType.IMAGE, "avatar.png");
        assertFalse(engine.isAssetRegistered(AssetType.IMAGE, "avatar.png"));
        assertThrows(EngineException.class, () -> engine.unregisterAsset(AssetType.IMAGE, "avatar.png"));

        var player = engine.instantiateViewModel(file, "Player", InstanceSource.BLANK, null);
        engine.setImageProperty(player, "avatar", image);
        engine.setImageProperty(player, "avatar", null);
        assertThrows(EngineException.class, () -> engine.setImageProperty(player, "avatar", font));
        assertThrows(PropertyPathNotFoundException.class, () -> engine.setImageProperty(player, "name", image));
    }

    @Test
    void testArtboardProperty() throws IOException {
        var badge = engine.instantiateArtboard(file, Selector.byName("Badge"));
        var player = engine.instantiateViewModel(file, "Player", InstanceSource.BLANK, null);
        assertNull(engine.artboardProperty(player, "badge"));

        engine.setArtboardProperty(player, "badge", file, badge);
        assertEquals("Badge", engine.artboardProperty(player, "badge"));

        var other = engine.importFile(demoScene());
        assertThrows(EngineException.class, () -> engine.setArtboardProperty(player, "badge", other, badge));
        assertThrows(PropertyPathNotFoundException.class,
                     () -> engine.setArtboardProperty(player, "avatar", file, badge));

        engine.setArtboardProperty(player, "badge", null, null);
        assertNull(engine.artboardProperty(player, "badge"));
    }

    @Test
    void testDrawFillsArtboardBounds() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var surface = engine.createSurface(200, 100);
        var target = engine.createRenderTarget(surface, 1);

        engine.draw(surface, target, List.of(new DrawOperation(artboard, null, null)), DrawConfig.defaults());

        var pixels = engine.readPixels(surface);
        assertEquals(200 * 100 * 4, pixels.length);
        assertPixel(pixels, 200, 0, 0, 0xFF3366CC);
        assertPixel(pixels, 200, 199, 99, 0xFF3366CC);
        assertEquals(1, engine.getFrameCount());
    }

    @Test
    void testDrawWithExplicitTransform() {
        var artboard = engine.instantiateArtboard(file, Selector.byName("Badge"));
        var surface = engine.createSurface(100, 100);
        var target = engine.createRenderTarget(surface, 4);
        var config = new DrawConfig(Fit.NONE, Alignment.TOP_LEFT, 0xFF000000, 1.0f);

        engine.draw(surface, target,
                    List.of(new DrawOperation(artboard, null, new float[] { 1, 0, 0, 1, 50, 50 })), config);

        var pixels = engine.readPixels(surface);
        assertPixel(pixels, 100, 10, 10, 0xFF000000);
        assertPixel(pixels, 100, 75, 75, 0xFF00FF00);
    }

    @Test
    void testDrawRejectsForeignRenderTarget() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var surface = engine.createSurface(10, 10);
        var other = engine.createSurface(10, 10);
        var target = engine.createRenderTarget(other, 1);

        assertThrows(EngineException.class,
                     () -> engine.draw(surface, target, List.of(new DrawOperation(artboard, null, null)),
                                       DrawConfig.defaults()));
        assertThrows(EngineException.class, () -> engine.createSurface(0, 10));
        assertThrows(EngineException.class, () -> engine.createRenderTarget(surface, 0));
    }

    @Test
    void testResizeArtboard() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        engine.resizeArtboard(artboard, 400, 300, 2);
        assertEquals(200, artboard.getWidth());
        assertEquals(150, artboard.getHeight());
        engine.resetArtboardSize(artboard);
        assertEquals(200, artboard.getWidth());
        assertEquals(100, artboard.getHeight());
        assertThrows(EngineException.class, () -> engine.resizeArtboard(artboard, 0, 10, 1));
    }

    @Test
    void testPointerMapsIntoArtboardSpace() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var sm = engine.instantiateStateMachine(artboard, Selector.byDefault());
        assertNull(engine.lastPointerPosition(sm));

        // 200x100 artboard contained in a 400x200 surface is scaled by 2
        engine.pointer(sm, new PointerEvent(PointerEvent.Phase.DOWN, 0, 100, 50, 400, 200, Fit.CONTAIN,
                                            Alignment.CENTER));
        var local = engine.lastPointerPosition(sm);
        assertEquals(50, local[0], 0.001);
        assertEquals(25, local[1], 0.001);
    }

    @Test
    void testBindInstance() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var sm = engine.instantiateStateMachine(artboard, Selector.byDefault());
        var instance = engine.defaultInstance(file, artboard);
        engine.bind(sm, instance);
        assertEquals("Player/Alice", engine.boundInstance(sm));
    }

    @Test
    void testConfinedToContextThread() throws InterruptedException {
        var failure = new AtomicReference<Throwable>();
        var thread = new Thread(() -> {
            try {
                engine.artboardNames(file);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        thread.start();
        thread.join();

        assertInstanceOf(EngineException.class, failure.get());
    }

    @Test
    void testClosedObjectsRejected() {
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        artboard.close();
        assertTrue(artboard.isClosed());
        assertThrows(EngineException.class, () -> engine.stateMachineNames(artboard));
    }

    @Test
    void testLiveObjectAccounting() {
        assertEquals(1, engine.getLiveObjectCount());
        var artboard = engine.instantiateArtboard(file, Selector.byDefault());
        var sm = engine.instantiateStateMachine(artboard, Selector.byDefault());
        assertEquals(3, engine.getLiveObjectCount());

        sm.close();
        sm.close();
        artboard.close();
        file.close();
        assertEquals(0, engine.getLiveObjectCount());
    }

    @Test
    void testNoContext() {
        engine.destroyContext();
        assertFalse(engine.hasContext());
        assertThrows(EngineException.class, () -> engine.createSurface(1, 1));
    }

    private static void assertPixel(byte[] pixels, int width, int x, int y, int argb) {
        var offset = (y * width + x) * 4;
        var actual = ((pixels[offset + 3] & 0xFF) << 24) | ((pixels[offset] & 0xFF) << 16) | (
        (pixels[offset + 1] & 0xFF) << 8) | (pixels[offset + 2] & 0xFF);
        assertEquals(argb, actual, String.format("pixel (%d,%d) expected #%08X but was #%08X", x, y, argb, actual));
    }
}
