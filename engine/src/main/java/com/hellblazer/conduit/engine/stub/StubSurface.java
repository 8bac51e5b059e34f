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
package com.hellblazer.conduit.engine.stub;

import com.hellblazer.conduit.engine.Surface;

/**
 * @author hal.hildebrand
 */
class StubSurface extends AbstractStubObject implements Surface {
    private final int width;
    private final int height;
    final byte[]      pixels;

    StubSurface(StubSceneEngine engine, int width, int height) {
        super(engine);
        this.width = width;
        this.height = height;
        this.pixels = new byte[width * height * 4];
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    void clear(int argb) {
        for (int i = 0; i < width * height; i++) {
            put(i, argb);
        }
    }

    void fill(int x0, int y0, int x1, int y1, int argb) {
        for (int y = Math.max(0, y0); y < Math.min(height, y1); y++) {
            for (int x = Math.max(0, x0); x < Math.min(width, x1); x++) {
                put(y * width + x, argb);
            }
        }
    }

    private void put(int pixel, int argb) {
        var offset = pixel * 4;
        pixels[offset] = (byte) (argb >>> 16);
        pixels[offset + 1] = (byte) (argb >>> 8);
        pixels[offset + 2] = (byte) argb;
        pixels[offset + 3] = (byte) (argb >>> 24);
    }

    @Override
    public String toString() {
        return String.format("StubSurface[%dx%d]", width, height);
    }
}
