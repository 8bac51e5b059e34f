package com.hellblazer.conduit.bridge.channel;

import com.hellblazer.conduit.bridge.protocol.Message;
import com.hellblazer.conduit.resource.Handle;
import com.hellblazer.conduit.resource.HandleKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MessageChannel
 */
public class MessageChannelTest {

    private static Message completed(long requestId) {
        return new Message.Completed(requestId, Handle.of(HandleKind.FILE, 1));
    }

    @Test
    void testDrainAllInOrder() {
        var channel = new MessageChannel();
        for (long i = 1; i <= 10; i++) {
            channel.push(completed(i));
        }
        var drained = new ArrayList<Long>();
        assertEquals(10, channel.drain(0, m -> drained.add(m.requestId())));
        assertEquals(10, drained.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i + 1, drained.get(i));
        }
        assertEquals(0, channel.size());
        assertEquals(10, channel.getTotalPushed());
    }

    @Test
    void testDrainLimit() {
        var channel = new MessageChannel();
        for (long i = 1; i <= 10; i++) {
            channel.push(completed(i));
        }
        var drained = new ArrayList<Long>();
        assertEquals(4, channel.drain(4, m -> drained.add(m.requestId())));
        assertEquals(6, channel.size());
        assertEquals(6, channel.drain(100, m -> drained.add(m.requestId())));
        assertEquals(10, drained.size());
        assertEquals(10L, drained.get(9));
    }

    @Test
    void testMessagesPushedDuringDrainWaitForNextDrain() {
        var channel = new MessageChannel();
        channel.push(completed(1));
        channel.push(completed(2));

        var drained = new ArrayList<Long>();
        var count = channel.drain(0, m -> {
            drained.add(m.requestId());
            channel.push(completed(m.requestId() + 100));
        });
        assertEquals(2, count);
        assertEquals(2, channel.size());

        channel.drain(0, m -> drained.add(m.requestId()));
        assertEquals(4, drained.size());
        assertEquals(101L, drained.get(2));
        assertEquals(102L, drained.get(3));
    }

    @Test
    void testEmptyDrain() {
        var channel = new MessageChannel();
        assertEquals(0, channel.drain(0, m -> fail("Nothing to drain")));
    }
}
