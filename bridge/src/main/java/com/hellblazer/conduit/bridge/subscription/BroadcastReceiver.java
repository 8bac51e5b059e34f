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
package com.hellblazer.conduit.bridge.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * One listener's view of a {@link Broadcast}: a bounded buffer that drops its oldest entry when a new one arrives
 * while full, so a slow listener never holds back the producer. Events are consumed by pulling ({@link #poll()},
 * {@link #drain()}) or, when the receiver has a listener, pushed to it at the end of every poll.
 *
 * @author hal.hildebrand
 */
public class BroadcastReceiver<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BroadcastReceiver.class);

    private final Broadcast<T>         broadcast;
    private final int                  capacity;
    private final BroadcastListener<T> listener;
    private final ArrayDeque<T>        buffer;
    private long                       dropped;
    private long                       received;
    private volatile boolean           active;
    private volatile boolean           closed;

    BroadcastReceiver(Broadcast<T> broadcast, int capacity, BroadcastListener<T> listener, boolean active) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.broadcast = broadcast;
        this.capacity = capacity;
        this.listener = listener;
        this.active = active;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 16));
    }

    synchronized void offer(T event) {
        if (closed || !active) {
            return;
        }
        if (buffer.size() == capacity) {
            buffer.pollFirst();
            dropped++;
            log.warn("Broadcast '{}' receiver full ({}), dropped oldest event", broadcast.getName(), capacity);
        }
        buffer.addLast(event);
        received++;
    }

    /**
     * Hand buffered events to the listener, if there is one
     */
    void deliver() {
        if (listener == null) {
            return;
        }
        for (var event : drain()) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener on broadcast '{}' failed", broadcast.getName(), e);
            }
        }
    }

    /**
     * @return the oldest buffered event, or null if none
     */
    public synchronized T poll() {
        return buffer.pollFirst();
    }

    /**
     * Remove and return every buffered event, oldest first
     */
    public synchronized List<T> drain() {
        var events = new ArrayList<>(buffer);
        buffer.clear();
        return events;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Number of events discarded because the buffer was full
     */
    public synchronized long getDroppedCount() {
        return dropped;
    }

    /**
     * Number of events ever offered to this receiver, including dropped ones
     */
    public synchronized long getReceivedCount() {
        return received;
    }

    /**
     * Whether events are accepted. An inactive receiver ignores events until it is activated.
     */
    public boolean isActive() {
        return active;
    }

    void activate() {
        active = true;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        broadcast.remove(this);
        synchronized (this) {
            buffer.clear();
        }
    }

    void detach() {
        closed = true;
    }
}
