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

/**
 * The client and server disagree about the command/message contract: a command without a tag, a tag that does not
 * match its payload, or a reply of the wrong type. The connection is closed; the queue must be released and
 * acquired again.
 *
 * @author hal.hildebrand
 */
public class ProtocolViolationException extends BridgeException {

    public ProtocolViolationException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolViolationException(String message, CommandType origin, long requestId) {
        super(ErrorKind.PROTOCOL, message, origin, null, requestId, null);
    }
}
