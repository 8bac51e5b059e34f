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

import com.hellblazer.conduit.engine.Artboard;

/**
 * @author hal.hildebrand
 */
class StubArtboard extends AbstractStubObject implements Artboard {
    final StubSceneFile               file;
    final SceneDocument.ArtboardDef   def;
    private float                     width;
    private float                     height;

    StubArtboard(StubSceneEngine engine, StubSceneFile file, SceneDocument.ArtboardDef def) {
        super(engine);
        this.file = file;
        this.def = def;
        reset();
    }

    @Override
    public String getName() {
        return def.name();
    }

    @Override
    public float getWidth() {
        return width;
    }

    @Override
    public float getHeight() {
        return height;
    }

    void resize(float width, float height) {
        this.width = width;
        this.height = height;
    }

    void reset() {
        width = def.width();
        height = def.height();
    }

    @Override
    public String toString() {
        return String.format("StubArtboard[%s %.0fx%.0f]", def.name(), width, height);
    }
}
