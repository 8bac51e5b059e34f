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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A stream of events fanned out to any number of independent {@link BroadcastReceiver}s, each with its own bounded
 * drop-oldest buffer.
 *
 * @author hal.hildebrand
 */
public class Broadcast<T> {
    private final String                                  name;
    private final int                                     capacity;
    private final List<BroadcastReceiver<T>>              receivers = new CopyOnWriteArrayList<>();

    /**
     * @param capacity per-receiver buffer size
     */
    public Broadcast(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    /**
     * Register a receiver that is drained by pulling
     */
    public BroadcastReceiver<T> subscribe() {
        return subscribe(null);
    }

    /**
     * Register a receiver whose buffered events are handed to {@code listener} at the end of every poll
     */
    public BroadcastReceiver<T> subscribe(BroadcastListener<T> listener) {
        return subscribe(listener, true);
    }

    BroadcastReceiver<T> subscribe(BroadcastListener<T> listener, boolean active) {
        var receiver = new BroadcastReceiver<>(this, capacity, listener, active);
        receivers.add(receiver);
        return receiver;
    }

    /**
     * Offer an event to every receiver
     */
    public void emit(T event) {
        for (var receiver : receivers) {
            receiver.offer(event);
        }
    }

    /**
     * Invoke the listeners of callback receivers with their buffered events
     */
    public void deliver() {
        for (var receiver : receivers) {
            receiver.deliver();
        }
    }

    public int getReceiverCount() {
        return receivers.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Detach every receiver; they stop receiving events
     */
    public void closeAll() {
        for (var receiver : receivers) {
            receiver.detach();
        }
        receivers.clear();
    }

    boolean remove(BroadcastReceiver<T> receiver) {
        return receivers.remove(receiver);
    }
}
