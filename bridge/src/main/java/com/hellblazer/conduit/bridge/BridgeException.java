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
import com.hellblazer.conduit.resource.Handle;

/**
 * Root of the bridge's error taxonomy. Async operations complete exceptionally with a subclass of this exception;
 * failed fire-and-forget commands are published as one on {@link CommandQueue#errors()}.
 *
 * @author hal.hildebrand
 */
public class BridgeException extends RuntimeException {
    private final ErrorKind   kind;
    private final CommandType origin;
    private final Handle      subject;
    private final long        requestId;

    public BridgeException(ErrorKind kind, String message) {
        this(kind, message, null, null, 0, null);
    }

    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, 0, cause);
    }

    public BridgeException(ErrorKind kind, String message, CommandType origin, Handle subject, long requestId,
                           Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.origin = origin;
        this.subject = subject;
        this.requestId = requestId;
    }

    /**
     * Rebuild the typed exception described by an error message
     */
    public static BridgeException from(Message.Failure failure) {
        var origin = failure.origin();
        var subject = failure.subject();
        var id = failure.requestId();
        var detail = failure.detail();
        return switch (failure.kind()) {
            case INVALID_HANDLE -> new InvalidHandleException(detail, origin, subject, id);
            case NATIVE_OPERATION_FAILED -> new NativeOperationException(detail, origin, subject, id);
            case LIFECYCLE -> new LifecycleException(detail, origin, subject, id);
            case PROPERTY_PATH -> new PropertyPathException(detail, origin, subject, id);
            case PROTOCOL -> new ProtocolViolationException(detail, origin, id);
        };
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the type of the command that failed, or null if the failure is not tied to a command
     */
    public CommandType getOrigin() {
        return origin;
    }

    /**
     * @return the handle the failure concerns, or null
     */
    public Handle getSubject() {
        return subject;
    }

    /**
     * @return the id of the failed request, 0 for fire-and-forget commands
     */
    public long getRequestId() {
        return requestId;
    }
}
