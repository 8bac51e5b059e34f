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
import com.hellblazer.conduit.resource.Handle;

/**
 * An operation was attempted on a queue with no running session: before the first acquire, after the last
 * release, while the server is draining, or on a release without a matching acquire.
 *
 * @author hal.hildebrand
 */
public class LifecycleException extends BridgeException {

    public LifecycleException(String message) {
        super(ErrorKind.LIFECYCLE, message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(ErrorKind.LIFECYCLE, message, cause);
    }

    public LifecycleException(String message, CommandType origin, Handle subject, long requestId) {
        super(ErrorKind.LIFECYCLE, message, origin, subject, requestId, null);
    }
}
