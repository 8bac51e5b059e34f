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
 * Computes the affine transform {@code [xx, xy, yx, yy, tx, ty]} that places content of a given size into a frame
 * according to a {@link Fit} and {@link Alignment}.
 *
 * @author hal.hildebrand
 */
public final class FitTransform {

    private FitTransform() {
    }

    public static float[] compute(Fit fit, Alignment alignment, float frameWidth, float frameHeight,
                                  float contentWidth, float contentHeight, float scaleFactor) {
        if (contentWidth <= 0 || contentHeight <= 0) {
            return new float[] { 1, 0, 0, 1, 0, 0 };
        }
        float sx;
        float sy;
        var widthRatio = frameWidth / contentWidth;
        var heightRatio = frameHeight / contentHeight;
        switch (fit) {
            case FILL -> {
                sx = widthRatio;
                sy = heightRatio;
            }
            case CONTAIN -> sx = sy = Math.min(widthRatio, heightRatio);
            case COVER -> sx = sy = Math.max(widthRatio, heightRatio);
            case FIT_WIDTH -> sx = sy = widthRatio;
            case FIT_HEIGHT -> sx = sy = heightRatio;
            case SCALE_DOWN -> sx = sy = Math.min(1.0f, Math.min(widthRatio, heightRatio));
            case LAYOUT -> sx = sy = scaleFactor;
            default -> sx = sy = 1.0f;
        }
        var tx = (1 + alignment.getX()) / 2 * (frameWidth - sx * contentWidth);
        var ty = (1 + alignment.getY()) / 2 * (frameHeight - sy * contentHeight);
        return new float[] { sx, 0, 0, sy, tx, ty };
    }

    /**
     * Map a frame point back into content space
     *
     * @return {x, y} in content coordinates
     */
    public static float[] invert(float[] transform, float x, float y) {
        var det = transform[0] * transform[3] - transform[1] * transform[2];
        if (det == 0) {
            return new float[] { Float.NaN, Float.NaN };
        }
        var dx = x - transform[4];
        var dy = y - transform[5];
        return new float[] { (dx * transform[3] - dy * transform[2]) / det,
                             (dy * transform[0] - dx * transform[1]) / det };
    }
}
