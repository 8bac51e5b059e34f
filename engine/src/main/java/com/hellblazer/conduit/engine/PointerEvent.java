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
 * Pointer input in surface coordinates, mapped into artboard space through the fit and alignment the artboard is
 * drawn with.
 *
 * @author hal.hildebrand
 */
public record PointerEvent(Phase phase, int pointerId, float x, float y, float surfaceWidth, float surfaceHeight,
                           Fit fit, Alignment alignment) {

    public enum Phase {
        DOWN, MOVE, UP, EXIT
    }

    public PointerEvent {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(fit, "fit");
        Objects.requireNonNull(alignment, "alignment");
    }
}
