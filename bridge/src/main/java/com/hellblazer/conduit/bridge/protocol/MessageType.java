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
package com.hellblazer.conduit.bridge.protocol;

/**
 * Stable tag of every message variant.
 *
 * @author hal.hildebrand
 */
public enum MessageType {
    CREATED, NAMES, DESCRIPTORS, ENUMS, VALUE, COUNT, PIXELS, DRAWN, COMPLETED, ERROR, SETTLED, PROPERTY_CHANGED,
    SUBSCRIPTIONS_DROPPED;

    /**
     * Whether messages of this type are produced without a request to answer
     */
    public boolean isUnsolicited() {
        return this == SETTLED || this == PROPERTY_CHANGED || this == SUBSCRIPTIONS_DROPPED;
    }
}
