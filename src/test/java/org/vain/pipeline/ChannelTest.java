package org.vain.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelTest {

    @Test
    @Timeout(10)
    public void testItemsArriveInOrder() throws InterruptedException {
        Channel<Integer> channel = new Channel<>();
        Thread sender = new Thread(() -> {
            try {
                for (int i = 0; i < 100; i++) {
                    channel.send(i);
                }
                channel.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();

        List<Integer> received = new ArrayList<>();
        Integer item;
        while ((item = channel.receive()) != null) {
            received.add(item);
        }
        sender.join();
        assertEquals(100, received.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i, received.get(i));
        }
    }

    @Test
    @Timeout(10)
    public void testReceiveAfterCloseKeepsReturningNull() throws InterruptedException {
        Channel<String> channel = new Channel<>();
        channel.send("a");
        Thread closer = new Thread(() -> {
            try {
                channel.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        closer.start();
        assertEquals("a", channel.receive());
        assertNull(channel.receive());
        assertNull(channel.receive());
        closer.join();
    }

    @Test
    @Timeout(10)
    public void testDrainReleasesSender() throws InterruptedException {
        Channel<Integer> channel = new Channel<>();
        Thread sender = new Thread(() -> {
            try {
                for (int i = 0; i < 10; i++) {
                    channel.send(i);
                }
                channel.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();
        assertEquals(0, channel.receive());
        channel.drain();
        sender.join();
        assertFalse(sender.isAlive());
        assertNull(channel.receive());
    }

    @Test
    public void testNullIsRejected() {
        Channel<String> channel = new Channel<>();
        assertThrows(IllegalArgumentException.class, () -> channel.send(null));
    }
}
