package io.jobrelay.supervisor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local copy of a job's meta map. Updates stay in memory and reach the store at most once
 * per flush interval, so persisted meta may lag by up to one interval until {@link #flush()}
 * runs at the end of the job.
 */
public final class MetaBuffer {
    private static final Logger LOG = LogManager.getLogger(MetaBuffer.class);

    @FunctionalInterface
    public interface Writer {
        void write(Map<String, Object> snapshot);
    }

    private final Map<String, Object> values;
    private final long flushIntervalMs;
    private final Writer writer;
    private boolean dirty;
    private long lastFlushMs;

    public MetaBuffer(Map<String, Object> initial, long flushIntervalMs, Writer writer) {
        this.values = new LinkedHashMap<>(initial == null ? Map.of() : initial);
        this.flushIntervalMs = Math.max(0L, flushIntervalMs);
        this.writer = writer;
        this.dirty = false;
        this.lastFlushMs = 0L;
    }

    public synchronized void put(String key, Object value) {
        Object prev = values.put(key, value);
        if (prev == null ? value != null : !prev.equals(value)) {
            dirty = true;
        }
    }

    public synchronized void putAll(Map<String, Object> updates) {
        for (Map.Entry<String, Object> e : updates.entrySet()) {
            put(e.getKey(), e.getValue());
        }
    }

    public synchronized Object get(String key) {
        return values.get(key);
    }

    public synchronized Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }

    public synchronized boolean dirty() {
        return dirty;
    }

    /**
     * Writes when dirty and the interval has elapsed. A failed write is logged and retried on
     * a later call.
     */
    public synchronized boolean flushIfDue(long nowMs) {
        if (!dirty || nowMs - lastFlushMs < flushIntervalMs) {
            return false;
        }
        try {
            writer.write(new LinkedHashMap<>(values));
            dirty = false;
            lastFlushMs = nowMs;
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Deferred meta flush failed, will retry: {}", e.getMessage());
            lastFlushMs = nowMs;
            return false;
        }
    }

    public synchronized void flush() {
        writer.write(new LinkedHashMap<>(values));
        dirty = false;
        lastFlushMs = System.currentTimeMillis();
    }
}
