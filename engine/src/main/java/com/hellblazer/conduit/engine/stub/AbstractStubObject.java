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

import com.hellblazer.conduit.engine.EngineException;
import com.hellblazer.conduit.engine.EngineObject;

/**
 * Base of the stub engine's objects: counts itself live until closed, and refuses to be closed off the context
 * thread.
 *
 * @author hal.hildebrand
 */
abstract class AbstractStubObject implements EngineObject {
    protected final StubSceneEngine engine;
    private boolean                 closed;

    protected AbstractStubObject(StubSceneEngine engine) {
        this.engine = engine;
        engine.objectCreated();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        engine.checkThread();
        closed = true;
        engine.objectClosed();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    void ensureOpen() {
        if (closed) {
            throw new EngineException(getClass().getSimpleName() + " has been closed");
        }
    }
}
