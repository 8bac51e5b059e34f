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
package com.hellblazer.conduit.bridge.channel;

import com.hellblazer.conduit.bridge.protocol.Message;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Lock-free FIFO of {@link Message}s from the command server to the client, drained only by an explicit poll.
 *
 * @author hal.hildebrand
 */
public class MessageChannel {
    private final ConcurrentLinkedQueue<Message> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger                  size  = new AtomicInteger(0);
    private final AtomicInteger                  total = new AtomicInteger(0);

    public void push(Message message) {
        queue.add(message);
        size.incrementAndGet();
        total.incrementAndGet();
    }

    /**
     * Hand queued messages to the consumer in the order they were pushed. Messages pushed while draining are left
     * for the next call.
     *
     * @param limit maximum number of messages to drain, 0 for all present when the drain started
     * @return the number of messages drained
     */
    public int drain(int limit, Consumer<Message> consumer) {
        var available = size.get();
        var budget = limit > 0 ? Math.min(limit, available) : available;
        int drained = 0;
        while (drained < budget) {
            var message = queue.poll();
            if (message == null) {
                break;
            }
            size.decrementAndGet();
            drained++;
            consumer.accept(message);
        }
        return drained;
    }

    public int size() {
        return size.get();
    }

    /**
     * Number of messages ever pushed
     */
    public int getTotalPushed() {
        return total.get();
    }
}
