package com.hellblazer.conduit.resource;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HandleAllocator and Handle
 */
class HandleAllocatorTest {

    @Property
    void idsAreUniqueAndIncreasing(@ForAll @Size(min = 1, max = 200) List<HandleKind> kinds) {
        var allocator = new HandleAllocator();
        Set<Handle> seen = new HashSet<>();
        for (HandleKind kind : kinds) {
            var before = allocator.issued(kind);
            var handle = allocator.next(kind);
            assertTrue(seen.add(handle), "duplicate " + handle);
            assertEquals(before + 1, handle.id());
            assertTrue(handle.isPresent());
        }
    }

    @Property(tries = 20)
    void concurrentAllocationNeverCollides(@ForAll @IntRange(min = 2, max = 8) int threads) throws Exception {
        var allocator = new HandleAllocator();
        Set<Handle> seen = ConcurrentHashMap.newKeySet();
        var executor = Executors.newFixedThreadPool(threads);
        var latch = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        seen.add(allocator.next(HandleKind.STATE_MACHINE));
                    }
                    latch.countDown();
                });
            }
            assertTrue(latch.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(threads * 500, seen.size());
        assertEquals(threads * 500L, allocator.issued(HandleKind.STATE_MACHINE));
    }

    @Test
    void testAbsentHandle() {
        var absent = Handle.absent(HandleKind.BINDABLE_INSTANCE);
        assertFalse(absent.isPresent());
        assertEquals("BINDABLE_INSTANCE#absent", absent.toString());
        assertEquals("FILE#7", Handle.of(HandleKind.FILE, 7).toString());
    }

    @Test
    void testNegativeIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> Handle.of(HandleKind.FILE, -1));
        assertThrows(NullPointerException.class, () -> new Handle(null, 1));
    }

    @Test
    void testKindPredicates() {
        assertTrue(HandleKind.IMAGE.isAsset());
        assertTrue(HandleKind.FONT.isAsset());
        assertFalse(HandleKind.SURFACE.isAsset());
        assertTrue(HandleKind.DRAW_KEY.isClientOnly());
        assertFalse(HandleKind.ARTBOARD.isClientOnly());
    }
}
