package io.jobrelay.logs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.bus.Subscription;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.LogRecord;
import io.jobrelay.storage.LogStore;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Replay-then-live view of one job's log. Records come out in sequence order with no
 * duplicates. Whenever the live channel is quiet the store is read past the last delivered
 * sequence, which recovers dropped frames and lines written by a worker in another process.
 */
public final class LogSubscription implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(LogSubscription.class);

    private final String jobId;
    private final Subscription live;
    private final LogStore store;
    private final Deque<LogRecord> pending;
    private long lastSeq;
    private long seenDrops;
    private boolean ended;

    LogSubscription(String jobId, Subscription live, List<LogRecord> history, LogStore store) {
        this.jobId = jobId;
        this.live = live;
        this.store = store;
        this.pending = new ArrayDeque<>(history);
        this.lastSeq = 0L;
        this.seenDrops = 0L;
        this.ended = false;
    }

    public String jobId() {
        return jobId;
    }

    /**
     * @return the next record, or null if nothing arrived within the timeout or the stream ended
     */
    public LogRecord next(long timeout, TimeUnit unit) throws InterruptedException {
        if (ended) {
            return null;
        }
        LogRecord fromQueue = takePending();
        if (fromQueue != null) {
            return deliver(fromQueue);
        }
        String raw = live.poll(timeout, unit);
        if (raw == null) {
            if (catchUpFromStore()) {
                LogRecord recovered = takePending();
                return recovered == null ? null : deliver(recovered);
            }
            return null;
        }
        LogRecord record = decode(raw);
        if (record == null || record.seq() <= lastSeq) {
            return null;
        }
        if (record.seq() > lastSeq + 1) {
            pending.addAll(store.range(jobId, lastSeq, record.seq()));
        }
        pending.addLast(record);
        LogRecord first = takePending();
        return first == null ? null : deliver(first);
    }

    public boolean ended() {
        return ended;
    }

    public long lastSeq() {
        return lastSeq;
    }

    @Override
    public void close() {
        live.close();
        pending.clear();
    }

    private LogRecord takePending() {
        while (!pending.isEmpty()) {
            LogRecord head = pending.pollFirst();
            if (head.seq() > lastSeq) {
                return head;
            }
        }
        return null;
    }

    private LogRecord deliver(LogRecord record) {
        lastSeq = record.seq();
        if (record.endOfStream()) {
            ended = true;
        }
        return record;
    }

    private boolean catchUpFromStore() {
        long drops = live.droppedCount();
        if (drops > seenDrops) {
            LOG.debug("Live buffer for job {} dropped {} frames, reading them from the store", jobId, drops - seenDrops);
            seenDrops = drops;
        }
        List<LogRecord> missing = store.range(jobId, lastSeq, Long.MAX_VALUE);
        pending.addAll(missing);
        return !missing.isEmpty();
    }

    private LogRecord decode(String raw) {
        try {
            ObjectNode node = Jsons.readObject(raw);
            return new LogRecord(
                    jobId,
                    node.path("seq").asLong(),
                    LogKind.fromWire(node.path("type").asText(null)),
                    node.path("line").asText(""),
                    node.path("created_at_ms").asLong()
            );
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring malformed live log frame for job {}: {}", jobId, e.getMessage());
            return null;
        }
    }
}
