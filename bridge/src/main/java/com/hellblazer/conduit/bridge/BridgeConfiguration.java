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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of a {@link CommandQueue} and the command server sessions it starts.
 *
 * @author hal.hildebrand
 */
public final class BridgeConfiguration {

    /**
     * What the command server does with commands still queued when it is shut down
     */
    public enum ShutdownPolicy {
        /** Execute them before stopping */
        DRAIN,
        /** Answer each with a lifecycle error without executing it */
        ABORT
    }

    private final String         workerThreadName;
    private final int            broadcastCapacity;
    private final ShutdownPolicy shutdownPolicy;
    private final Duration       startTimeout;
    private final int            maxMessagesPerPoll;

    private BridgeConfiguration(Builder builder) {
        this.workerThreadName = builder.workerThreadName;
        this.broadcastCapacity = builder.broadcastCapacity;
        this.shutdownPolicy = builder.shutdownPolicy;
        this.startTimeout = builder.startTimeout;
        this.maxMessagesPerPoll = builder.maxMessagesPerPoll;
    }

    public static BridgeConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Small buffers and a short start timeout, for tests and tools
     */
    public static BridgeConfiguration minimalConfig() {
        return new Builder().withBroadcastCapacity(8)
                            .withStartTimeout(Duration.ofSeconds(1))
                            .withShutdownPolicy(ShutdownPolicy.ABORT)
                            .build();
    }

    /**
     * Load a configuration from JSON, starting from the defaults. Recognized fields: {@code workerThreadName},
     * {@code broadcastCapacity}, {@code shutdownPolicy}, {@code startTimeoutMillis}, {@code maxMessagesPerPoll}.
     */
    public static BridgeConfiguration fromJson(InputStream in) throws IOException {
        var root = new ObjectMapper().readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Bridge configuration must be a JSON object");
        }
        var builder = new Builder();
        text(root, "workerThreadName", builder::withWorkerThreadName);
        if (root.hasNonNull("broadcastCapacity")) {
            builder.withBroadcastCapacity(root.get("broadcastCapacity").asInt());
        }
        text(root, "shutdownPolicy",
             policy -> builder.withShutdownPolicy(ShutdownPolicy.valueOf(policy.toUpperCase(Locale.ROOT))));
        if (root.hasNonNull("startTimeoutMillis")) {
            builder.withStartTimeout(Duration.ofMillis(root.get("startTimeoutMillis").asLong()));
        }
        if (root.hasNonNull("maxMessagesPerPoll")) {
            builder.withMaxMessagesPerPoll(root.get("maxMessagesPerPoll").asInt());
        }
        return builder.build();
    }

    private static void text(JsonNode root, String field, java.util.function.Consumer<String> setter) {
        if (root.hasNonNull(field)) {
            setter.accept(root.get(field).asText());
        }
    }

    public String getWorkerThreadName() {
        return workerThreadName;
    }

    /**
     * Buffer size of every broadcast receiver and property subscription
     */
    public int getBroadcastCapacity() {
        return broadcastCapacity;
    }

    public ShutdownPolicy getShutdownPolicy() {
        return shutdownPolicy;
    }

    /**
     * How long an acquire waits for the command server to start
     */
    public Duration getStartTimeout() {
        return startTimeout;
    }

    /**
     * Upper bound on messages processed by one poll, 0 for everything queued when the poll starts
     */
    public int getMaxMessagesPerPoll() {
        return maxMessagesPerPoll;
    }

    @Override
    public String toString() {
        return String.format("BridgeConfiguration[thread=%s, capacity=%d, shutdown=%s, startTimeout=%s, maxPoll=%d]",
                             workerThreadName, broadcastCapacity, shutdownPolicy, startTimeout, maxMessagesPerPoll);
    }

    public static class Builder {
        private String         workerThreadName   = "conduit-command-server";
        private int            broadcastCapacity  = 64;
        private ShutdownPolicy shutdownPolicy     = ShutdownPolicy.DRAIN;
        private Duration       startTimeout       = Duration.ofSeconds(5);
        private int            maxMessagesPerPoll = 0;

        public Builder withWorkerThreadName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Worker thread name must not be blank");
            }
            this.workerThreadName = name;
            return this;
        }

        public Builder withBroadcastCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Broadcast capacity must be positive: " + capacity);
            }
            this.broadcastCapacity = capacity;
            return this;
        }

        public Builder withShutdownPolicy(ShutdownPolicy policy) {
            this.shutdownPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withStartTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Start timeout must be positive: " + timeout);
            }
            this.startTimeout = timeout;
            return this;
        }

        public Builder withMaxMessagesPerPoll(int max) {
            if (max < 0) {
                throw new IllegalArgumentException("Max messages per poll must not be negative: " + max);
            }
            this.maxMessagesPerPoll = max;
            return this;
        }

        public BridgeConfiguration build() {
            return new BridgeConfiguration(this);
        }
    }
}
