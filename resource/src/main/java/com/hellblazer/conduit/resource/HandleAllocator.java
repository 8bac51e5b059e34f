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
package com.hellblazer.conduit.resource;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe source of handle ids. One counter per {@link HandleKind}, starting at 1 and increasing monotonically,
 * so an id is never issued twice for the lifetime of the allocator.
 * <p>
 * The allocator outlives individual registries: a facade keeps one allocator across sessions so that a stale handle
 * from a torn down session can never alias an object of a later one.
 *
 * @author hal.hildebrand
 */
public class HandleAllocator {
    private final Map<HandleKind, AtomicLong> counters = new EnumMap<>(HandleKind.class);

    public HandleAllocator() {
        for (HandleKind kind : HandleKind.values()) {
            counters.put(kind, new AtomicLong(0));
        }
    }

    /**
     * Issue a fresh, previously unused handle of the given kind
     */
    public Handle next(HandleKind kind) {
        return new Handle(kind, counters.get(kind).incrementAndGet());
    }

    /**
     * Number of handles issued so far for a kind
     */
    public long issued(HandleKind kind) {
        return counters.get(kind).get();
    }
}
