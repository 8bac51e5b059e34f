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

import com.hellblazer.conduit.bridge.protocol.CommandType;
import com.hellblazer.conduit.bridge.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps outstanding request ids to the futures awaiting their answer. Requests are registered by the thread issuing
 * the call and resolved by the thread running the poll; the command server never touches the correlator.
 * <p>
 * Cancelling a returned future removes its entry; an answer arriving afterwards is dropped silently.
 *
 * @author hal.hildebrand
 */
public class Correlator {
    private static final Logger log = LoggerFactory.getLogger(Correlator.class);

    private final ConcurrentHashMap<Long, PendingRequest<?>> pending = new ConcurrentHashMap<>();

    private record PendingRequest<T>(long requestId, CommandType origin, CompletableFuture<T> future,
                                     Function<Message, T> extractor) {

        void complete(Message message) {
            if (message instanceof Message.Failure failure) {
                future.completeExceptionally(BridgeException.from(failure));
                return;
            }
            T result;
            try {
                result = extractor.apply(message);
            } catch (ClassCastException e) {
                future.completeExceptionally(new ProtocolViolationException(
                "Request " + requestId + " (" + origin + ") was answered by " + message.type(), origin, requestId));
                return;
            }
            future.complete(result);
        }
    }

    /**
     * Register a request
     *
     * @param extractor maps the answering message to the request's result
     * @return the future completed when the answer is resolved
     * @throws IllegalStateException if the request id is already outstanding
     */
    public <T> CompletableFuture<T> register(long requestId, CommandType origin, Function<Message, T> extractor) {
        if (requestId == 0) {
            throw new IllegalArgumentException("Request id 0 is reserved for fire-and-forget commands");
        }
        var future = new CompletableFuture<T>();
        var request = new PendingRequest<>(requestId, origin, future, extractor);
        if (pending.putIfAbsent(requestId, request) != null) {
            throw new IllegalStateException("Request id already outstanding: " + requestId);
        }
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                pending.remove(requestId, request);
            }
        });
        return future;
    }

    /**
     * Complete the request a message answers
     *
     * @return false if no request with the message's id is outstanding; the message is dropped
     */
    public boolean resolve(Message message) {
        var request = pending.remove(message.requestId());
        if (request == null) {
            log.debug("Dropped {} for request {} with no pending caller", message.type(), message.requestId());
            return false;
        }
        request.complete(message);
        return true;
    }

    /**
     * Abandon a request: its future is cancelled and a late answer will be dropped
     *
     * @return false if the request was not outstanding
     */
    public boolean cancel(long requestId) {
        var request = pending.remove(requestId);
        if (request == null) {
            return false;
        }
        request.future().cancel(false);
        return true;
    }

    /**
     * Remove a request without completing its future
     */
    boolean discard(long requestId) {
        return pending.remove(requestId) != null;
    }

    /**
     * Fail every outstanding request
     *
     * @return the number of requests failed
     */
    public int cancelAll(Throwable cause) {
        var requests = new ArrayList<>(pending.values());
        int failed = 0;
        for (var request : requests) {
            if (pending.remove(request.requestId(), request)) {
                request.future().completeExceptionally(cause);
                failed++;
            }
        }
        return failed;
    }

    /**
     * Number of outstanding requests
     */
    public int pending() {
        return pending.size();
    }

    public boolean isPending(long requestId) {
        return pending.containsKey(requestId);
    }
}
