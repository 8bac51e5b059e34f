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
 * Selects an artboard of a file or a state machine of an artboard: the default one, one by name, or one by index.
 *
 * @author hal.hildebrand
 */
public record Selector(Mode mode, String name, int index) {

    public enum Mode {
        DEFAULT, NAME, INDEX
    }

    public Selector {
        if (mode == Mode.NAME && (name == null || name.isEmpty())) {
            throw new IllegalArgumentException("Name selector requires a name");
        }
        if (mode == Mode.INDEX && index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
    }

    public static Selector byDefault() {
        return new Selector(Mode.DEFAULT, null, -1);
    }

    public static Selector byName(String name) {
        return new Selector(Mode.NAME, name, -1);
    }

    public static Selector byIndex(int index) {
        return new Selector(Mode.INDEX, null, index);
    }

    @Override
    public String toString() {
        return switch (mode) {
            case DEFAULT -> "default";
            case NAME -> "'" + name + "'";
            case INDEX -> "#" + index;
        };
    }
}
