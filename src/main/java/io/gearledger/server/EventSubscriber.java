package io.gearledger.server;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/** Outbound queue of one open event stream. Frames are delivered in publish order. */
final class EventSubscriber {
    private static final Frame CLOSE = new Frame(null);

    private final BlockingQueue<Frame> queue;
    private volatile boolean closed;

    EventSubscriber(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /** Non-blocking; false when the queue is full or the subscriber is closed. */
    boolean offer(String data) {
        return !closed && queue.offer(new Frame(data));
    }

    /**
     * Waits up to {@code timeoutMs} for the next frame. Returns null on timeout;
     * a frame with null data means the subscriber was closed.
     */
    Frame poll(long timeoutMs) throws InterruptedException {
        if (closed && queue.isEmpty()) {
            return CLOSE;
        }
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void close() {
        closed = true;
        queue.clear();
        queue.offer(CLOSE);
    }

    boolean isClosed() {
        return closed;
    }

    record Frame(String data) {
        boolean isClose() {
            return data == null;
        }
    }
}
