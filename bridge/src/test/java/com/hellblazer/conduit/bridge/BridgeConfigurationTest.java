package com.hellblazer.conduit.bridge;

import com.hellblazer.conduit.bridge.BridgeConfiguration.ShutdownPolicy;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BridgeConfiguration
 */
public class BridgeConfigurationTest {

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testDefaultConfig() {
        var config = BridgeConfiguration.defaultConfig();
        assertEquals("conduit-command-server", config.getWorkerThreadName());
        assertEquals(64, config.getBroadcastCapacity());
        assertEquals(ShutdownPolicy.DRAIN, config.getShutdownPolicy());
        assertEquals(Duration.ofSeconds(5), config.getStartTimeout());
        assertEquals(0, config.getMaxMessagesPerPoll());
    }

    @Test
    void testMinimalConfig() {
        var config = BridgeConfiguration.minimalConfig();
        assertEquals(8, config.getBroadcastCapacity());
        assertEquals(ShutdownPolicy.ABORT, config.getShutdownPolicy());
        assertEquals(Duration.ofSeconds(1), config.getStartTimeout());
    }

    @Test
    void testBuilder() {
        var config = new BridgeConfiguration.Builder().withWorkerThreadName("render")
                                                      .withBroadcastCapacity(3)
                                                      .withShutdownPolicy(ShutdownPolicy.ABORT)
                                                      .withStartTimeout(Duration.ofMillis(250))
                                                      .withMaxMessagesPerPoll(10)
                                                      .build();
        assertEquals("render", config.getWorkerThreadName());
        assertEquals(3, config.getBroadcastCapacity());
        assertEquals(ShutdownPolicy.ABORT, config.getShutdownPolicy());
        assertEquals(Duration.ofMillis(250), config.getStartTimeout());
        assertEquals(10, config.getMaxMessagesPerPoll());
        assertTrue(config.toString().contains("render"));
    }

    @Test
    void testBuilderValidation() {
        var builder = new BridgeConfiguration.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withWorkerThreadName(" "));
        assertThrows(IllegalArgumentException.class, () -> builder.withBroadcastCapacity(0));
        assertThrows(NullPointerException.class, () -> builder.withShutdownPolicy(null));
        assertThrows(IllegalArgumentException.class, () -> builder.withStartTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxMessagesPerPoll(-1));
    }

    @Test
    void testFromJsonFixture() throws IOException {
        try (var in = getClass().getResourceAsStream("/config/bridge.json")) {
            assertNotNull(in);
            var config = BridgeConfiguration.fromJson(in);
            assertEquals("scene-worker", config.getWorkerThreadName());
            assertEquals(16, config.getBroadcastCapacity());
            assertEquals(ShutdownPolicy.ABORT, config.getShutdownPolicy());
            assertEquals(Duration.ofMillis(2500), config.getStartTimeout());
            assertEquals(32, config.getMaxMessagesPerPoll());
        }
    }

    @Test
    void testFromJsonKeepsDefaultsForMissingFields() throws IOException {
        var config = BridgeConfiguration.fromJson(json("{\"broadcastCapacity\": 5}"));
        assertEquals(5, config.getBroadcastCapacity());
        assertEquals("conduit-command-server", config.getWorkerThreadName());
        assertEquals(ShutdownPolicy.DRAIN, config.getShutdownPolicy());
    }

    @Test
    void testFromJsonRejectsInvalidInput() {
        assertThrows(IOException.class, () -> BridgeConfiguration.fromJson(json("[1, 2]")));
        assertThrows(IOException.class, () -> BridgeConfiguration.fromJson(json("{not json")));
        assertThrows(IllegalArgumentException.class,
                     () -> BridgeConfiguration.fromJson(json("{\"broadcastCapacity\": -4}")));
        assertThrows(IllegalArgumentException.class,
                     () -> BridgeConfiguration.fromJson(json("{\"shutdownPolicy\": \"later\"}")));
    }
}
