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

import java.util.Objects;

/**
 * One artboard to draw, optionally driven by a state machine, with an optional affine transform
 * {@code [xx, xy, yx, yy, tx, ty]}. Without a transform the artboard is placed by the call's fit and alignment.
 *
 * @author hal.hildebrand
 */
public record DrawOperation(Artboard artboard, StateMachine stateMachine, float[] transform) {

    public DrawOperation {
        Objects.requireNonNull(artboard, "artboard");
        if (transform != null) {
            if (transform.length != 6) {
                throw new IllegalArgumentException("Transform must have 6 components: " + transform.length);
            }
            transform = transform.clone();
        }
    }
}
