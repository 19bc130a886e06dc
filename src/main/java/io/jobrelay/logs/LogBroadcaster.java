package io.jobrelay.logs;

import io.jobrelay.bus.ChannelHub;
import io.jobrelay.bus.Subscription;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.LogRecord;
import io.jobrelay.storage.LogStore;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable per-job line history plus live fan-out on {@code logs:<jobId>}.
 */
public final class LogBroadcaster {
    private static final Logger LOG = LogManager.getLogger(LogBroadcaster.class);
    private static final String CHANNEL_PREFIX = "logs:";

    private final LogStore store;
    private final ChannelHub hub;
    private final int bufferSize;
    private final long successTtlSeconds;
    private final long failureTtlSeconds;
    private final ConcurrentMap<String, Object> jobLocks = new ConcurrentHashMap<>();

    public LogBroadcaster(LogStore store, ChannelHub hub, int bufferSize, long successTtlSeconds, long failureTtlSeconds) {
        this.store = store;
        this.hub = hub;
        this.bufferSize = bufferSize;
        this.successTtlSeconds = successTtlSeconds;
        this.failureTtlSeconds = failureTtlSeconds;
    }

    public static String channel(String jobId) {
        return CHANNEL_PREFIX + jobId;
    }

    /**
     * Appends the line and pushes it to live listeners. The push happens under the same
     * per-job lock as the append, so a listener never sees a line the store does not hold.
     */
    public LogRecord publish(String jobId, LogKind kind, String line) {
        synchronized (lockFor(jobId)) {
            LogRecord record = store.append(jobId, kind, line, System.currentTimeMillis());
            hub.publish(channel(jobId), encode(record));
            return record;
        }
    }

    public LogRecord publishEnd(String jobId) {
        return publish(jobId, LogKind.CONTROL, LogRecord.END_OF_STREAM);
    }

    public LogSubscription subscribe(String jobId) {
        Subscription live = hub.subscribe(channel(jobId), bufferSize);
        List<LogRecord> history;
        synchronized (lockFor(jobId)) {
            history = store.history(jobId);
        }
        return new LogSubscription(jobId, live, history, store);
    }

    public List<LogRecord> history(String jobId) {
        return store.history(jobId);
    }

    public boolean hasEnded(String jobId) {
        return store.hasEndMarker(jobId);
    }

    /**
     * Applies retention once the job is over. A non-positive TTL removes the history now.
     */
    public void finalize(String jobId, boolean succeeded) {
        long ttl = succeeded ? successTtlSeconds : failureTtlSeconds;
        if (ttl <= 0) {
            delete(jobId);
            return;
        }
        store.expireAt(jobId, System.currentTimeMillis() + ttl * 1000L);
    }

    public int delete(String jobId) {
        synchronized (lockFor(jobId)) {
            int removed = store.delete(jobId);
            jobLocks.remove(jobId);
            return removed;
        }
    }

    public int purgeExpired(long nowMs) {
        int purged = 0;
        for (String jobId : store.expiredJobIds(nowMs)) {
            delete(jobId);
            purged++;
        }
        if (purged > 0) {
            LOG.info("Purged {} expired log histories", purged);
        }
        return purged;
    }

    private Object lockFor(String jobId) {
        return jobLocks.computeIfAbsent(jobId, k -> new Object());
    }

    private static String encode(LogRecord record) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("seq", record.seq());
        frame.put("type", record.kind().wireName());
        frame.put("line", record.line());
        frame.put("created_at_ms", record.createdAtMs());
        return Jsons.toCompactJson(frame);
    }
}
