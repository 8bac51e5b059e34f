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

import com.hellblazer.conduit.engine.BindableInstance;

/**
 * A reference to a view model instance. Several references may share one {@link ViewModelNode}, for example a
 * nested instance obtained from its parent; closing a reference leaves the node alive for the others.
 *
 * @author hal.hildebrand
 */
class StubBindableInstance extends AbstractStubObject implements BindableInstance {
    final ViewModelNode node;

    StubBindableInstance(StubSceneEngine engine, ViewModelNode node) {
        super(engine);
        this.node = node;
    }

    @Override
    public String getViewModelName() {
        return node.def.name();
    }

    @Override
    public String getInstanceName() {
        return node.instanceName;
    }

    @Override
    public String toString() {
        return "StubBindableInstance[" + node + "]";
    }
}
