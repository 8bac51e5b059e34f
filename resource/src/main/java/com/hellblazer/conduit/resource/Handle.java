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

import java.util.Objects;

/**
 * Opaque, typed identifier standing in for a native object that clients must never dereference directly.
 * <p>
 * Ids are unique within their kind for the lifetime of the owning {@link HandleAllocator}. An id of 0 denotes an
 * absent (optional) handle.
 *
 * @param kind the kind of native object
 * @param id   the identifier, 0 when absent
 * @author hal.hildebrand
 */
public record Handle(HandleKind kind, long id) {

    public static final long ABSENT_ID = 0L;

    public Handle {
        Objects.requireNonNull(kind, "kind");
        if (id < 0) {
            throw new IllegalArgumentException("Handle id must be non-negative: " + id);
        }
    }

    public static Handle absent(HandleKind kind) {
        return new Handle(kind, ABSENT_ID);
    }

    public static Handle of(HandleKind kind, long id) {
        return new Handle(kind, id);
    }

    public boolean isPresent() {
        return id != ABSENT_ID;
    }

    public boolean is(HandleKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return isPresent() ? kind + "#" + id : kind + "#absent";
    }
}
