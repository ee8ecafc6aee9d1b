package org.vain.pipeline;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * A single-slot hand-off between two pipeline stages.
 * <p>
 * {@link #send} blocks while the slot is full, {@link #receive} blocks while it
 * is empty. After {@link #close} the receiver gets {@code null} once the items
 * already sent are drained. One sender and one receiver per channel.
 */
public final class Channel<T> {

    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> queue = new ArrayBlockingQueue<>(1);
    private boolean drained;

    public void send(T item) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("null item");
        }
        queue.put(item);
    }

    public void close() throws InterruptedException {
        queue.put(CLOSED);
    }

    @SuppressWarnings("unchecked")
    public T receive() throws InterruptedException {
        if (drained) {
            return null;
        }
        Object item = queue.take();
        if (item == CLOSED) {
            drained = true;
            return null;
        }
        return (T) item;
    }

    /**
     * Discards everything up to the close marker, so the sender can finish.
     */
    public void drain() throws InterruptedException {
        while (receive() != null) {
            // discard
        }
    }
}
