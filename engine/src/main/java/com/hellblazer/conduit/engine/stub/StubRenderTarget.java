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

import com.hellblazer.conduit.engine.RenderTarget;
import com.hellblazer.conduit.engine.Surface;

/**
 * @author hal.hildebrand
 */
class StubRenderTarget extends AbstractStubObject implements RenderTarget {
    private final StubSurface surface;
    private final int         sampleCount;

    StubRenderTarget(StubSceneEngine engine, StubSurface surface, int sampleCount) {
        super(engine);
        this.surface = surface;
        this.sampleCount = sampleCount;
    }

    @Override
    public Surface getSurface() {
        return surface;
    }

    @Override
    public int getSampleCount() {
        return sampleCount;
    }
}
