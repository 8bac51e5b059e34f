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

import com.hellblazer.conduit.engine.PointerEvent;
import com.hellblazer.conduit.engine.PropertyValue;
import com.hellblazer.conduit.engine.StateMachine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settles once it has been advanced for {@code settleAfter} seconds without any input, pointer event or binding
 * change in between.
 *
 * @author hal.hildebrand
 */
class StubStateMachine extends AbstractStubObject implements StateMachine {
    final StubArtboard                      artboard;
    final SceneDocument.StateMachineDef     def;
    final Map<String, PropertyValue>        inputs        = new LinkedHashMap<>();
    final Map<String, Integer>              triggerCounts = new LinkedHashMap<>();
    ViewModelNode                           bound;
    PointerEvent                            lastPointer;
    float[]                                 lastPointerLocal;
    private float                           remaining;

    StubStateMachine(StubSceneEngine engine, StubArtboard artboard, SceneDocument.StateMachineDef def) {
        super(engine);
        this.artboard = artboard;
        this.def = def;
        for (var input : def.inputs()) {
            inputs.put(input.name(), input.initial());
        }
        wake();
    }

    @Override
    public String getName() {
        return def.name();
    }

    void wake() {
        remaining = def.settleAfter();
    }

    boolean advance(float seconds) {
        remaining -= seconds;
        return remaining <= 0;
    }

    void fire(String trigger) {
        triggerCounts.merge(trigger, 1, Integer::sum);
        wake();
    }

    @Override
    public String toString() {
        return String.format("StubStateMachine[%s/%s]", artboard.getName(), def.name());
    }
}
