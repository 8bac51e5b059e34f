package com.hellblazer.conduit.bridge.channel;

import com.hellblazer.conduit.bridge.protocol.Command;
import com.hellblazer.conduit.resource.Handle;
import com.hellblazer.conduit.resource.HandleKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandChannel
 */
public class CommandChannelTest {

    private static Command.ReadPixels read(long requestId) {
        return new Command.ReadPixels(requestId, Handle.of(HandleKind.SURFACE, 1));
    }

    @Test
    void testFifoOrder() throws InterruptedException {
        var channel = new CommandChannel();
        for (long i = 1; i <= 5; i++) {
            assertTrue(channel.offer(read(i)));
        }
        assertEquals(5, channel.size());
        for (long i = 1; i <= 5; i++) {
            assertEquals(i, channel.take().requestId());
        }
        assertEquals(0, channel.size());
    }

    @Test
    void testTakeBlocksUntilOffer() throws Exception {
        var channel = new CommandChannel();
        var taken = new AtomicReference<Command>();
        var done = new CountDownLatch(1);
        var consumer = new Thread(() -> {
            try {
                taken.set(channel.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        assertFalse(done.await(100, TimeUnit.MILLISECONDS), "take should block on an empty channel");
        channel.offer(read(7));
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(7, taken.get().requestId());
    }

    @Test
    void testCloseWakesConsumer() throws Exception {
        var channel = new CommandChannel();
        var done = new CountDownLatch(1);
        var result = new AtomicReference<Command>(read(99));
        var consumer = new Thread(() -> {
            try {
                result.set(channel.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        channel.close();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertNull(result.get(), "A closed, empty channel yields null");
        assertTrue(channel.isClosed());
    }

    @Test
    void testClosedChannelRefusesButKeepsQueued() throws InterruptedException {
        var channel = new CommandChannel();
        channel.offer(read(1));
        channel.offer(read(2));
        channel.close();

        assertFalse(channel.offer(read(3)));
        assertEquals(1, channel.take().requestId());
        assertEquals(2, channel.take().requestId());
        assertNull(channel.take());
    }

    @Test
    void testDrainRemaining() {
        var channel = new CommandChannel();
        channel.offer(read(1));
        channel.offer(read(2));
        channel.offer(read(3));

        var remaining = channel.drainRemaining();
        assertEquals(List.of(1L, 2L, 3L), remaining.stream().map(Command::requestId).toList());
        assertEquals(0, channel.size());
    }

    @Test
    void testConcurrentProducersPreserveEachProducersOrder() throws Exception {
        var channel = new CommandChannel();
        int producers = 4;
        int perProducer = 500;
        var threads = new ArrayList<Thread>();
        for (int p = 0; p < producers; p++) {
            final long base = (p + 1) * 100_000L;
            threads.add(new Thread(() -> {
                for (int i = 0; i < perProducer; i++) {
                    channel.offer(read(base + i));
                }
            }));
        }
        threads.forEach(Thread::start);
        for (var thread : threads) {
            thread.join();
        }

        var last = new long[producers];
        for (int i = 0; i < producers * perProducer; i++) {
            var id = channel.take().requestId();
            int producer = (int) (id / 100_000L) - 1;
            assertTrue(id > last[producer] || last[producer] == 0, "Producer order violated at " + id);
            last[producer] = id;
        }
        assertEquals(0, channel.size());
    }
}
