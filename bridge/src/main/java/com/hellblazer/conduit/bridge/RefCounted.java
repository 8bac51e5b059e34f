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
package com.hellblazer.conduit.bridge;

/**
 * Lifetime managed by tagged acquire/release pairs. The underlying resources exist while at least one acquire is
 * outstanding.
 *
 * @author hal.hildebrand
 */
public interface RefCounted {

    /**
     * Take a reference on behalf of {@code tag}
     */
    void acquire(Object tag);

    /**
     * Give back a reference taken by {@code tag}
     *
     * @throws LifecycleException if {@code tag} holds no reference
     */
    void release(Object tag);

    int refCount();
}
