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
package com.hellblazer.conduit.engine;

/**
 * Types of the properties of a view model and of the inputs of a state machine.
 *
 * @author hal.hildebrand
 */
public enum PropertyType {
    NUMBER, STRING, BOOLEAN, ENUM, COLOR, TRIGGER, LIST, VIEW_MODEL, IMAGE, ARTBOARD;

    /**
     * Whether values of this type can be carried by a {@link PropertyValue}
     */
    public boolean isValue() {
        return switch (this) {
            case NUMBER, STRING, BOOLEAN, ENUM, COLOR, TRIGGER -> true;
            default -> false;
        };
    }
}
