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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ownership record for one native object held by the {@link ResourceRegistry}
 *
 * @author hal.hildebrand
 */
public class RegistryEntry {

    private final Handle        handle;
    private final AutoCloseable nativeRef;
    private final String        description;
    private final long          createdNanos   = System.nanoTime();
    private final AtomicInteger accessCount    = new AtomicInteger(0);
    private final AtomicLong    lastAccessTime = new AtomicLong(createdNanos);

    RegistryEntry(Handle handle, AutoCloseable nativeRef, String description) {
        this.handle = handle;
        this.nativeRef = nativeRef;
        this.description = description;
    }

    public Handle getHandle() {
        return handle;
    }

    public String getDescription() {
        return description;
    }

    public int getAccessCount() {
        return accessCount.get();
    }

    public long getAgeMillis() {
        return (System.nanoTime() - createdNanos) / 1_000_000L;
    }

    public long getLastAccessNanos() {
        return lastAccessTime.get();
    }

    AutoCloseable nativeRef() {
        return nativeRef;
    }

    void recordAccess() {
        accessCount.incrementAndGet();
        lastAccessTime.set(System.nanoTime());
    }

    @Override
    public String toString() {
        return String.format("RegistryEntry[handle=%s, description=%s, accesses=%d, age=%d ms]", handle, description,
                             accessCount.get(), getAgeMillis());
    }
}
