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
 * Frame level drawing parameters shared by every operation of a draw call.
 *
 * @param fit        scaling of artboards without an explicit transform
 * @param alignment  anchoring of artboards without an explicit transform
 * @param clearColor ARGB color the surface is cleared to before drawing
 * @param scale      layout scale factor, used by {@link Fit#LAYOUT}
 * @author hal.hildebrand
 */
public record DrawConfig(Fit fit, Alignment alignment, int clearColor, float scale) {

    public DrawConfig {
        Objects.requireNonNull(fit, "fit");
        Objects.requireNonNull(alignment, "alignment");
        if (!(scale > 0)) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }
    }

    public static DrawConfig defaults() {
        return new DrawConfig(Fit.CONTAIN, Alignment.CENTER, 0x00000000, 1.0f);
    }
}
