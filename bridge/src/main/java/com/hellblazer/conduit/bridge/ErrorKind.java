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

/**
 * Classification of failures reported across the bridge.
 *
 * @author hal.hildebrand
 */
public enum ErrorKind {
    /** A command referenced a handle that does not exist or is of the wrong kind */
    INVALID_HANDLE,
    /** The scene engine rejected the operation */
    NATIVE_OPERATION_FAILED,
    /** The queue has no running session, or the server is draining or stopped */
    LIFECYCLE,
    /** A dotted property path did not resolve on the target instance */
    PROPERTY_PATH,
    /** Contract violation between client and server; fatal to the connection */
    PROTOCOL
}
