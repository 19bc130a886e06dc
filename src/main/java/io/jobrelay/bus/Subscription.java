package io.jobrelay.bus;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One listener attached to a channel. Delivery goes through a bounded buffer; when the
 * buffer is full the message is dropped for this listener only and counted.
 */
public final class Subscription implements AutoCloseable {
    private final ChannelHub hub;
    private final String channel;
    private final BlockingQueue<String> buffer;
    private final AtomicLong dropped;
    private final AtomicBoolean closed;

    Subscription(ChannelHub hub, String channel, int capacity) {
        this.hub = hub;
        this.channel = channel;
        this.buffer = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.dropped = new AtomicLong(0L);
        this.closed = new AtomicBoolean(false);
    }

    public String channel() {
        return channel;
    }

    boolean offer(String message) {
        if (closed.get()) {
            return false;
        }
        if (buffer.offer(message)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * @return the next message, or null when none arrived within the timeout
     */
    public String poll(long timeout, TimeUnit unit) throws InterruptedException {
        return buffer.poll(timeout, unit);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            hub.unsubscribe(this);
            buffer.clear();
        }
    }
}
