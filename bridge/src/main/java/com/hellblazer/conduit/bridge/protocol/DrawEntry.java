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

import com.hellblazer.conduit.resource.Handle;

import java.util.Objects;

/**
 * One operation of a batched draw: an artboard, the state machine driving it (may be absent) and an optional
 * affine transform {@code [xx, xy, yx, yy, tx, ty]}. Without a transform the draw call's fit and alignment apply.
 *
 * @author hal.hildebrand
 */
public record DrawEntry(Handle artboard, Handle stateMachine, float[] transform) {

    public DrawEntry {
        Objects.requireNonNull(artboard, "artboard");
        Objects.requireNonNull(stateMachine, "stateMachine");
        if (transform != null) {
            if (transform.length != 6) {
                throw new IllegalArgumentException("Transform must have 6 components: " + transform.length);
            }
            transform = transform.clone();
        }
    }

    public static DrawEntry of(Handle artboard, Handle stateMachine) {
        return new DrawEntry(artboard, stateMachine, null);
    }

    @Override
    public float[] transform() {
        return transform == null ? null : transform.clone();
    }
}
