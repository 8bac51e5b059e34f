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

import com.hellblazer.conduit.bridge.protocol.Command;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered, blocking, multi-producer single-consumer queue of {@link Command}s. Producers are arbitrary client
 * threads; the single consumer is the command server. Once closed the channel refuses new commands but still hands
 * out the ones already queued.
 *
 * @author hal.hildebrand
 */
public class CommandChannel {
    private final ReentrantLock      lock     = new ReentrantLock();
    private final Condition          notEmpty = lock.newCondition();
    private final ArrayDeque<Command> queue    = new ArrayDeque<>();
    private boolean                  closed;

    /**
     * Append a command
     *
     * @return false if the channel is closed and the command was not queued
     */
    public boolean offer(Command command) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            queue.addLast(command);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a command is available
     *
     * @return the next command, or null once the channel is closed and empty
     */
    public Command take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuse further commands and wake the consumer
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every queued command, in order
     */
    public List<Command> drainRemaining() {
        lock.lock();
        try {
            var remaining = new ArrayList<>(queue);
            queue.clear();
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
