package io.jobrelay.supervisor;

import io.jobrelay.config.RuntimeSettings.SupervisorTimings;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.storage.StorageUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

final class ProcessSupervisorTest {
    private static final SupervisorTimings FAST = new SupervisorTimings(100L, 100L, 4_096, 500L);

    @Test
    void successNeedsExitZeroAndMarker() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-ok-");
        try {
            Path script = script(root, "ok.sh", """
                    echo "starting"
                    echo "progress::45"
                    echo "Results directory: out/run"
                    echo "status::success"
                    """);
            List<String> lines = Collections.synchronizedList(new ArrayList<>());
            MetaBuffer meta = new MetaBuffer(Map.of(), 0L, snapshot -> {
            });

            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 30_000L),
                    (kind, line) -> lines.add(kind.wireName() + ":" + line), meta, () -> false);

            Assertions.assertTrue(outcome.succeeded());
            Assertions.assertEquals(0, outcome.exitCode());
            Assertions.assertNull(outcome.errorKind());
            Assertions.assertEquals("out/run", outcome.resultsPath());
            Assertions.assertEquals(45, meta.get(MetaKeys.OVERALL_PROGRESS));
            Assertions.assertEquals(0, meta.get(MetaKeys.EXIT_CODE));
            Assertions.assertNotNull(meta.get(MetaKeys.DURATION_SECONDS));
            Assertions.assertTrue(lines.contains("stdout:starting"));
            Assertions.assertTrue(lines.contains("stdout:status::success"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exitZeroWithoutMarkerFails() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-nomarker-");
        try {
            Path script = script(root, "quiet.sh", "echo \"done\"\n");
            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 30_000L),
                    (kind, line) -> {
                    }, buffer(), () -> false);

            Assertions.assertEquals(SupervisorOutcome.Result.FAILED, outcome.result());
            Assertions.assertEquals(0, outcome.exitCode());
            Assertions.assertEquals(SupervisorOutcome.KIND_MISSING_MARKER, outcome.errorKind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonZeroExitCarriesStderrSnippet() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-fail-");
        try {
            Path script = script(root, "fail.sh", """
                    echo "status::success"
                    echo "fatal: reference genome missing" >&2
                    exit 1
                    """);
            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 30_000L),
                    (kind, line) -> {
                    }, buffer(), () -> false);

            Assertions.assertEquals(SupervisorOutcome.Result.FAILED, outcome.result());
            Assertions.assertEquals(1, outcome.exitCode());
            Assertions.assertEquals(SupervisorOutcome.KIND_EXIT_CODE, outcome.errorKind());
            Assertions.assertEquals("Pipeline failed with return code 1.", outcome.errorMessage());
            Assertions.assertTrue(outcome.stderrSnippet().contains("reference genome missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timeoutKillsProcess() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-timeout-");
        try {
            Path script = script(root, "slow.sh", "echo \"begin\"\nsleep 30\necho \"status::success\"\n");
            long start = System.currentTimeMillis();
            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 1_000L),
                    (kind, line) -> {
                    }, buffer(), () -> false);

            Assertions.assertEquals(SupervisorOutcome.Result.FAILED, outcome.result());
            Assertions.assertEquals(SupervisorOutcome.KIND_TIMEOUT, outcome.errorKind());
            Assertions.assertTrue(System.currentTimeMillis() - start < 20_000L);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopRequestEndsRunAsStopped() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-stop-");
        try {
            Path script = script(root, "long.sh", "echo \"begin\"\nsleep 30\n");
            long stopAt = System.currentTimeMillis() + 500L;
            List<String> lines = Collections.synchronizedList(new ArrayList<>());
            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 60_000L),
                    (kind, line) -> lines.add(kind.wireName() + ":" + line), buffer(),
                    () -> System.currentTimeMillis() >= stopAt);

            Assertions.assertEquals(SupervisorOutcome.Result.STOPPED, outcome.result());
            Assertions.assertNull(outcome.errorKind());
            Assertions.assertTrue(lines.contains("status:Stop requested, terminating process."));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingSinkDoesNotStopCapture() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-sink-");
        try {
            Path script = script(root, "ok.sh", """
                    echo "progress::30"
                    echo "status::success"
                    """);
            MetaBuffer meta = buffer();
            SupervisorOutcome outcome = supervisor().run(invocation(script, root, 30_000L),
                    (kind, line) -> {
                        throw new StorageUnavailableException("store busy", null);
                    }, meta, () -> false);

            Assertions.assertTrue(outcome.succeeded());
            Assertions.assertEquals(30, meta.get(MetaKeys.OVERALL_PROGRESS));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unexpectedFailureKillsProcessBeforePropagating() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-crash-");
        try {
            Path script = script(root, "long.sh", "echo \"begin\"\nsleep 30\n");
            AtomicReference<ProcessHandle> child = new AtomicReference<>();
            AtomicInteger samples = new AtomicInteger();
            ProcessSupervisor crashing = new ProcessSupervisor(FAST, handle -> {
                child.set(handle);
                if (samples.incrementAndGet() >= 3) {
                    throw new IllegalStateException("sampler broke");
                }
                return ResourceSampler.ResourceSample.NONE;
            });

            IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class,
                    () -> crashing.run(invocation(script, root, 60_000L), (kind, line) -> {
                    }, buffer(), () -> false));

            Assertions.assertEquals("sampler broke", thrown.getMessage());
            Assertions.assertFalse(child.get().isAlive());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingExecutableIsLaunchFailure() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-sup-missing-");
        try {
            Invocation invocation = invocation(root.resolve("nope.sh"), root, 1_000L);
            Assertions.assertThrows(ProcessLaunchException.class,
                    () -> supervisor().run(invocation, (kind, line) -> {
                    }, buffer(), () -> false));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pumpEmitsTrailingFragmentAtEof() {
        BlockingQueue<ProcessSupervisor.StreamEvent> events = new LinkedBlockingQueue<>();
        byte[] bytes = "first\r\nsecond\npartial".getBytes(StandardCharsets.UTF_8);
        ProcessSupervisor.pump(new ByteArrayInputStream(bytes), LogKind.STDOUT, events);

        List<String> lines = new ArrayList<>();
        boolean closed = false;
        for (ProcessSupervisor.StreamEvent event : events) {
            if (event.closed()) {
                closed = true;
            } else {
                lines.add(event.line());
            }
        }
        Assertions.assertEquals(List.of("first", "second", "partial"), lines);
        Assertions.assertTrue(closed);
    }

    @Test
    void stderrTailKeepsLastBytes() {
        StderrTail tail = new StderrTail(64);
        for (int i = 0; i < 50; i++) {
            tail.appendLine("line " + i);
        }
        String snippet = tail.snippet();
        Assertions.assertTrue(snippet.length() <= 64);
        Assertions.assertTrue(snippet.endsWith("line 49\n"));
        Assertions.assertFalse(snippet.contains("line 1\n"));
    }

    private static ProcessSupervisor supervisor() {
        return new ProcessSupervisor(FAST, handle -> ResourceSampler.ResourceSample.NONE);
    }

    private static MetaBuffer buffer() {
        return new MetaBuffer(Map.of(), 0L, snapshot -> {
        });
    }

    private static Invocation invocation(Path script, Path root, long timeoutMs) {
        return new Invocation(script, List.of(), root.resolve("work"), Map.of(), timeoutMs, root.resolve("work").resolve("trace.txt"));
    }

    private static Path script(Path root, String name, String body) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
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
