package io.jobrelay.logs;

import io.jobrelay.bus.ChannelHub;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.LogRecord;
import io.jobrelay.storage.Database;
import io.jobrelay.storage.LogStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LogBroadcasterTest {

    @Test
    void sequenceNumbersStartAtOneWithoutGaps() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-seq-");
        try {
            LogBroadcaster logs = broadcaster(root, 64, 60L, 60L);
            logs.publish("job_a", LogKind.STATUS, "starting");
            logs.publish("job_a", LogKind.STDOUT, "hello");
            logs.publish("job_b", LogKind.STDOUT, "other job");
            logs.publish("job_a", LogKind.STDERR, "warn");
            logs.publishEnd("job_a");

            List<LogRecord> history = logs.history("job_a");
            Assertions.assertEquals(4, history.size());
            for (int i = 0; i < history.size(); i++) {
                Assertions.assertEquals(i + 1L, history.get(i).seq());
            }
            Assertions.assertTrue(history.get(3).endOfStream());
            Assertions.assertEquals(1L, logs.history("job_b").get(0).seq());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lateSubscriberReplaysHistoryThenEnds() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-replay-");
        try {
            LogBroadcaster logs = broadcaster(root, 64, 60L, 60L);
            logs.publish("job_a", LogKind.STDOUT, "one");
            logs.publish("job_a", LogKind.STDOUT, "two");
            logs.publishEnd("job_a");

            try (LogSubscription sub = logs.subscribe("job_a")) {
                List<String> lines = drain(sub);
                Assertions.assertEquals(List.of("one", "two", LogRecord.END_OF_STREAM), lines);
                Assertions.assertTrue(sub.ended());
                Assertions.assertNull(sub.next(10, TimeUnit.MILLISECONDS));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void subscribingWhileWriterRunsYieldsEveryLineOnce() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-race-");
        try {
            LogBroadcaster logs = broadcaster(root, 4_096, 60L, 60L);
            int total = 200;
            CountDownLatch halfway = new CountDownLatch(1);
            Thread writer = new Thread(() -> {
                for (int i = 1; i <= total; i++) {
                    logs.publish("job_race", LogKind.STDOUT, "line-" + i);
                    if (i == total / 2) {
                        halfway.countDown();
                    }
                }
                logs.publishEnd("job_race");
            });
            writer.start();
            Assertions.assertTrue(halfway.await(10, TimeUnit.SECONDS));

            List<Long> seqs = new ArrayList<>();
            try (LogSubscription sub = logs.subscribe("job_race")) {
                long deadline = System.currentTimeMillis() + 20_000L;
                while (!sub.ended() && System.currentTimeMillis() < deadline) {
                    LogRecord record = sub.next(200, TimeUnit.MILLISECONDS);
                    if (record != null) {
                        seqs.add(record.seq());
                    }
                }
            }
            writer.join(10_000L);

            Assertions.assertEquals(total + 1, seqs.size());
            for (int i = 0; i < seqs.size(); i++) {
                Assertions.assertEquals(i + 1L, seqs.get(i));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void droppedLiveFramesAreRecoveredFromHistory() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-drop-");
        try {
            LogBroadcaster logs = broadcaster(root, 2, 60L, 60L);
            try (LogSubscription sub = logs.subscribe("job_slow")) {
                for (int i = 1; i <= 10; i++) {
                    logs.publish("job_slow", LogKind.STDOUT, "line-" + i);
                }
                logs.publishEnd("job_slow");

                List<String> lines = drain(sub);
                Assertions.assertEquals(11, lines.size());
                Assertions.assertEquals("line-1", lines.get(0));
                Assertions.assertEquals("line-10", lines.get(9));
                Assertions.assertEquals(LogRecord.END_OF_STREAM, lines.get(10));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void observerInAnotherProcessFollowsThroughTheStore() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-remote-");
        try {
            LogBroadcaster worker = broadcaster(root, 64, 60L, 60L);
            LogBroadcaster observer = broadcaster(root, 64, 60L, 60L);
            worker.publish("job_remote", LogKind.STATUS, "before");

            try (LogSubscription sub = observer.subscribe("job_remote")) {
                Assertions.assertEquals("before", sub.next(100, TimeUnit.MILLISECONDS).line());
                worker.publish("job_remote", LogKind.STDOUT, "after");
                worker.publishEnd("job_remote");

                List<String> lines = drain(sub);
                Assertions.assertEquals(List.of("after", LogRecord.END_OF_STREAM), lines);
                Assertions.assertTrue(sub.ended());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retentionFollowsOutcomeTtl() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-logs-ttl-");
        try {
            Database db = database(root);
            LogStore store = new LogStore(db);
            LogBroadcaster logs = new LogBroadcaster(store, new ChannelHub(), 16, 60L, 0L);

            logs.publish("job_ok", LogKind.STDOUT, "done");
            long before = System.currentTimeMillis();
            logs.finalize("job_ok", true);
            Long expiresAt = store.expiresAt("job_ok");
            Assertions.assertNotNull(expiresAt);
            Assertions.assertTrue(expiresAt >= before + 60_000L);

            logs.publish("job_bad", LogKind.STDERR, "boom");
            logs.finalize("job_bad", false);
            Assertions.assertTrue(logs.history("job_bad").isEmpty());

            Assertions.assertEquals(0, logs.purgeExpired(before));
            Assertions.assertEquals(1, logs.purgeExpired(expiresAt + 1L));
            Assertions.assertTrue(logs.history("job_ok").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void envelopeCarriesTypeAndLine() {
        LogEnvelope envelope = LogEnvelope.of(new LogRecord("job_x", 3L, LogKind.STDERR, "oops", 1L));
        Assertions.assertEquals("stderr", envelope.type());
        Assertions.assertTrue(envelope.toJson().contains("\"line\":\"oops\""));
        Assertions.assertEquals("status", LogEnvelope.LISTENING.type());
    }

    private static List<String> drain(LogSubscription sub) throws InterruptedException {
        List<String> lines = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 10_000L;
        while (!sub.ended() && System.currentTimeMillis() < deadline) {
            LogRecord record = sub.next(100, TimeUnit.MILLISECONDS);
            if (record != null) {
                lines.add(record.line());
            }
        }
        return lines;
    }

    private static LogBroadcaster broadcaster(Path root, int buffer, long okTtl, long failTtl) {
        return new LogBroadcaster(new LogStore(database(root)), new ChannelHub(), buffer, okTtl, failTtl);
    }

    private static Database database(Path root) {
        Database db = new Database(JobRelayConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
