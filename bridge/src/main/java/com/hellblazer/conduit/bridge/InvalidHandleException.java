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
 * A command referenced a handle that was never created, was already deleted, or is of the wrong kind.
 *
 * @author hal.hildebrand
 */
public class InvalidHandleException extends BridgeException {

    public InvalidHandleException(String message, CommandType origin, Handle subject, long requestId) {
        super(ErrorKind.INVALID_HANDLE, message, origin, subject, requestId, null);
    }
}
