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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every native object of one bridge session, keyed by {@link Handle}, with one partition per
 * {@link HandleKind}.
 * <p>
 * Thread confinement: once {@link #claim()} has been called, {@link #bind}, {@link #get}, {@link #free} and
 * {@link #closeAll()} may only be invoked from the claiming thread, which is what lets single-thread-affinity native
 * objects live here without any locking around the objects themselves. {@link #allocate(HandleKind)} and the
 * statistics accessors are safe from any thread.
 *
 * @author hal.hildebrand
 */
public class ResourceRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);

    private final HandleAllocator                             allocator;
    private final Map<HandleKind, Map<Long, RegistryEntry>> partitions = new EnumMap<>(HandleKind.class);
    private final AtomicLong                                  totalBound = new AtomicLong(0);
    private final AtomicLong                                  totalFreed = new AtomicLong(0);
    private volatile Thread                                   owner;
    private volatile boolean                                  closed     = false;

    /**
     * Create a registry with a private allocator
     */
    public ResourceRegistry() {
        this(new HandleAllocator());
    }

    /**
     * Create a registry drawing ids from a shared allocator
     */
    public ResourceRegistry(HandleAllocator allocator) {
        this.allocator = allocator;
        for (HandleKind kind : HandleKind.values()) {
            partitions.put(kind, new ConcurrentHashMap<>());
        }
    }

    /**
     * Confine this registry to the calling thread
     */
    public void claim() {
        owner = Thread.currentThread();
        log.debug("Resource registry claimed by {}", owner.getName());
    }

    public Thread getOwner() {
        return owner;
    }

    /**
     * Issue a fresh, previously unused handle. Safe from any thread; the handle is not bound to anything until
     * {@link #bind} is called on the owning thread.
     */
    public Handle allocate(HandleKind kind) {
        ensureNotClosed();
        return allocator.next(kind);
    }

    /**
     * Install native ownership of an object under a handle
     *
     * @throws IllegalArgumentException if the handle is absent or already bound
     */
    public void bind(Handle handle, AutoCloseable nativeRef, String description) {
        ensureOwner();
        ensureNotClosed();
        if (!handle.isPresent()) {
            throw new IllegalArgumentException("Cannot bind an absent handle: " + handle);
        }
        var entry = new RegistryEntry(handle, nativeRef, description);
        if (partitions.get(handle.kind()).putIfAbsent(handle.id(), entry) != null) {
            throw new IllegalArgumentException("Handle already bound: " + handle);
        }
        totalBound.incrementAndGet();
        log.debug("Bound {} ({})", handle, description);
    }

    /**
     * Verify that a new object can be bound under a handle: present, of the expected kind and not yet bound
     *
     * @throws UnknownHandleException otherwise
     */
    public void checkUnbound(Handle handle, HandleKind expected) {
        ensureOwner();
        if (!handle.isPresent()) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.ABSENT,
                                             "Cannot register a " + expected.getDisplayName() + " under " + handle);
        }
        if (handle.kind() != expected) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.WRONG_KIND,
                                             "Expected " + expected.getDisplayName() + " handle but got " + handle);
        }
        if (partitions.get(handle.kind()).containsKey(handle.id())) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.ALREADY_BOUND,
                                             "Handle already bound: " + handle);
        }
    }

    /**
     * Resolve a handle to its native object
     *
     * @throws UnknownHandleException if the handle is absent or not bound
     */
    public Object get(Handle handle) {
        return entry(handle).nativeRef();
    }

    /**
     * Resolve a handle that must be of the expected kind and native type
     *
     * @throws UnknownHandleException if the handle is absent, not bound, or of the wrong kind
     */
    public <T> T get(Handle handle, HandleKind expected, Class<T> type) {
        if (handle.kind() != expected) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.WRONG_KIND,
                                             "Expected " + expected.getDisplayName() + " handle but got " + handle);
        }
        var nativeRef = entry(handle).nativeRef();
        if (!type.isInstance(nativeRef)) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.WRONG_KIND,
                                             handle + " does not refer to a " + type.getSimpleName());
        }
        return type.cast(nativeRef);
    }

    /**
     * Whether a handle is currently bound
     */
    public boolean contains(Handle handle) {
        ensureOwner();
        return handle.isPresent() && partitions.get(handle.kind()).containsKey(handle.id());
    }

    /**
     * Release native ownership and remove the entry
     *
     * @throws UnknownHandleException if the handle is absent, never bound or already freed
     */
    public void free(Handle handle) {
        ensureOwner();
        if (!handle.isPresent()) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.ABSENT,
                                             "Cannot free an absent handle: " + handle);
        }
        var entry = partitions.get(handle.kind()).remove(handle.id());
        if (entry == null) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.NOT_FOUND,
                                             "Unknown or already freed handle: " + handle);
        }
        release(entry);
        totalFreed.incrementAndGet();
        log.debug("Freed {}", handle);
    }

    /**
     * Number of live entries of a kind
     */
    public int size(HandleKind kind) {
        return partitions.get(kind).size();
    }

    /**
     * Number of live entries across all kinds
     */
    public int size() {
        return partitions.values().stream().mapToInt(Map::size).sum();
    }

    public RegistryStatistics getStatistics() {
        Map<HandleKind, Integer> live = new EnumMap<>(HandleKind.class);
        int total = 0;
        for (var e : partitions.entrySet()) {
            int count = e.getValue().size();
            if (count > 0) {
                live.put(e.getKey(), count);
                total += count;
            }
        }
        return new RegistryStatistics(Collections.unmodifiableMap(live), total, totalBound.get(), totalFreed.get());
    }

    /**
     * Release every live entry, newest kinds first so dependents go before the files they came from
     *
     * @return the number of entries released
     */
    public int closeAll() {
        ensureOwner();
        int released = 0;
        var kinds = new ArrayList<>(partitions.keySet());
        Collections.reverse(kinds);
        for (HandleKind kind : kinds) {
            var partition = partitions.get(kind);
            for (var entry : new ArrayList<>(partition.values())) {
                partition.remove(entry.getHandle().id());
                release(entry);
                totalFreed.incrementAndGet();
                released++;
            }
        }
        if (released > 0) {
            log.info("Released {} native resources", released);
        }
        return released;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closeAll();
        closed = true;
        log.debug("Resource registry closed");
    }

    public boolean isClosed() {
        return closed;
    }

    private RegistryEntry entry(Handle handle) {
        ensureOwner();
        if (!handle.isPresent()) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.ABSENT,
                                             "Absent " + handle.kind().getDisplayName() + " handle");
        }
        var entry = partitions.get(handle.kind()).get(handle.id());
        if (entry == null) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.NOT_FOUND,
                                             "Unknown " + handle.kind().getDisplayName() + " handle: " + handle);
        }
        entry.recordAccess();
        return entry;
    }

    private void release(RegistryEntry entry) {
        var nativeRef = entry.nativeRef();
        if (nativeRef == null) {
            return;
        }
        try {
            nativeRef.close();
        } catch (Exception e) {
            log.error("Failed to release native resource: {}", entry.getHandle(), e);
        }
    }

    private void ensureOwner() {
        var current = owner;
        if (current != null && current != Thread.currentThread()) {
            throw new IllegalStateException(
            "Resource registry is confined to " + current.getName() + " but was accessed from "
            + Thread.currentThread().getName());
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Resource registry is closed");
        }
    }
}
