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
package com.hellblazer.conduit.resource;

/**
 * Thrown when a handle cannot be resolved against a {@link ResourceRegistry}.
 *
 * @author hal.hildebrand
 */
public class UnknownHandleException extends RuntimeException {

    public enum Reason {
        /** The handle carries the absent id */
        ABSENT,
        /** Never bound, already freed, or bound in a previous session */
        NOT_FOUND,
        /** The handle exists but is not of the kind the caller expected */
        WRONG_KIND,
        /** A new object was to be registered under a handle that is already bound */
        ALREADY_BOUND
    }

    private final Handle handle;
    private final Reason reason;

    public UnknownHandleException(Handle handle, Reason reason, String message) {
        super(message);
        this.handle = handle;
        this.reason = reason;
    }

    public Handle getHandle() {
        return handle;
    }

    public Reason getReason() {
        return reason;
    }
}
