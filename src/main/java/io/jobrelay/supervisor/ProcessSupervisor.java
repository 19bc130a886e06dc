package io.jobrelay.supervisor;

import io.jobrelay.config.RuntimeSettings.SupervisorTimings;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.progress.ProgressReconciler;
import io.jobrelay.progress.ProgressTracker;
import io.jobrelay.progress.TraceSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Runs one external process to completion. A reader thread per output stream feeds a merged
 * queue; a single control loop handles lines, resource samples, trace-file reads, stop
 * checkpoints and the timeout. Process exit arrives as an event from {@link Process#onExit()}.
 */
public final class ProcessSupervisor {
    private static final Logger LOG = LogManager.getLogger(ProcessSupervisor.class);
    private static final long CHECKPOINT_INTERVAL_MS = 1_000L;
    private static final long DRAIN_AFTER_EXIT_MS = 2_000L;
    private static final long REAP_WAIT_MS = 5_000L;

    private final SupervisorTimings timings;
    private final ResourceSampler sampler;

    public ProcessSupervisor(SupervisorTimings timings, ResourceSampler sampler) {
        this.timings = timings;
        this.sampler = sampler;
    }

    public SupervisorOutcome run(Invocation invocation, LineSink sink, MetaBuffer meta, BooleanSupplier stopRequested) {
        Process process = launch(invocation);
        long startNanos = System.nanoTime();
        LOG.info("Started {} with pid {}", invocation.executable(), process.pid());

        BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
        Thread stdout = startReader(process.getInputStream(), LogKind.STDOUT, events, process.pid());
        Thread stderr = startReader(process.getErrorStream(), LogKind.STDERR, events, process.pid());
        CompletableFuture<Process> exit = process.onExit();
        exit.thenRun(() -> events.offer(StreamEvent.EXITED));

        OutputSignals signals = new OutputSignals(meta);
        StderrTail tail = new StderrTail(timings.stderrTailBytes());
        ResourceStats stats = new ResourceStats();
        TraceSnapshot trace = TraceSnapshot.EMPTY;

        long timeoutMs = invocation.timeoutMs();
        long nextSample = 0L;
        long nextProgress = timings.progressIntervalMs();
        long nextCheckpoint = CHECKPOINT_INTERVAL_MS;
        long exitedAt = -1L;
        long stopDeadline = -1L;
        int openStreams = 2;
        boolean timedOut = false;
        boolean stopped = false;
        boolean interrupted = false;

        try {
            while (true) {
                long elapsed = elapsedMs(startNanos);
                if (exitedAt < 0 && elapsed >= nextSample) {
                    stats.record(sampler.sample(process.toHandle()), elapsed);
                    nextSample = elapsed + timings.sampleIntervalMs();
                }
                if (elapsed >= nextProgress) {
                    trace = refreshProgress(invocation.traceFile(), trace, signals, meta);
                    nextProgress = elapsed + timings.progressIntervalMs();
                }
                if (exitedAt < 0 && !stopped && !timedOut && elapsed >= nextCheckpoint) {
                    nextCheckpoint = elapsed + CHECKPOINT_INTERVAL_MS;
                    if (isStopRequested(stopRequested)) {
                        stopped = true;
                        LOG.info("Stop requested for pid {}, terminating process tree", process.pid());
                        emit(sink, LogKind.STATUS, "Stop requested, terminating process.");
                        destroyTree(process, false);
                        stopDeadline = elapsed + timings.stopGraceMs();
                    }
                }
                if (stopped && exitedAt < 0 && stopDeadline >= 0 && elapsed >= stopDeadline) {
                    destroyTree(process, true);
                    stopDeadline = -1L;
                }
                if (exitedAt < 0 && !timedOut && elapsed >= timeoutMs) {
                    timedOut = true;
                    LOG.warn("Pid {} exceeded timeout of {}, killing process tree", process.pid(), Duration.ofMillis(timeoutMs));
                    destroyTree(process, true);
                }
                meta.flushIfDue(System.currentTimeMillis());

                if (exitedAt >= 0 && (openStreams == 0 || elapsed - exitedAt >= DRAIN_AFTER_EXIT_MS)) {
                    break;
                }

                long wait = nextWakeup(elapsed, nextSample, nextProgress, nextCheckpoint, timeoutMs, exitedAt);
                StreamEvent event = events.poll(wait, TimeUnit.MILLISECONDS);
                while (event != null) {
                    if (event == StreamEvent.EXITED) {
                        if (exitedAt < 0) {
                            exitedAt = elapsedMs(startNanos);
                        }
                    } else if (event.closed()) {
                        openStreams--;
                        if (event.error() != null) {
                            emit(sink, LogKind.ERROR, "Stream read error on " + event.kind().wireName() + ": " + event.error().getMessage());
                        }
                    } else {
                        handleLine(event, sink, signals, tail, trace, meta);
                    }
                    event = events.poll();
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
            destroyTree(process, true);
        } catch (RuntimeException e) {
            LOG.error("Supervision of pid {} failed, killing process tree", process.pid(), e);
            destroyTree(process, true);
            reap(process);
            stdout.interrupt();
            stderr.interrupt();
            throw e;
        }

        Integer exitCode = reap(process);
        stdout.interrupt();
        stderr.interrupt();
        trace = refreshProgress(invocation.traceFile(), trace, signals, meta);
        if (trace.submittedCount() > 0) {
            LOG.debug("Trace for pid {}: {}/{} tasks completed", process.pid(), trace.completedCount(), trace.submittedCount());
        }

        double durationSeconds = round(elapsedMs(startNanos) / 1000.0, 2);
        double peakMb = round(stats.peakBytes / (1024.0 * 1024.0), 1);
        double avgCpu = round(stats.averageCpu(), 1);
        meta.put(MetaKeys.PEAK_MEMORY_MB, peakMb);
        meta.put(MetaKeys.AVERAGE_CPU_PERCENT, avgCpu);
        meta.put(MetaKeys.DURATION_SECONDS, durationSeconds);
        meta.put(MetaKeys.EXIT_CODE, exitCode);

        String snippet = tail.isEmpty() ? null : tail.snippet();
        SupervisorOutcome.Result result;
        String errorKind = null;
        String errorMessage = null;
        if (interrupted) {
            result = SupervisorOutcome.Result.FAILED;
            errorKind = SupervisorOutcome.KIND_INTERNAL;
            errorMessage = "Supervision interrupted before the process finished.";
        } else if (stopped) {
            result = SupervisorOutcome.Result.STOPPED;
            errorMessage = "Job stopped by request.";
        } else if (timedOut) {
            result = SupervisorOutcome.Result.FAILED;
            errorKind = SupervisorOutcome.KIND_TIMEOUT;
            errorMessage = "Pipeline timed out after " + Duration.ofMillis(timeoutMs) + ".";
        } else if (exitCode == null || exitCode != 0) {
            result = SupervisorOutcome.Result.FAILED;
            errorKind = SupervisorOutcome.KIND_EXIT_CODE;
            errorMessage = "Pipeline failed with return code " + exitCode + ".";
        } else if (!signals.successMarker()) {
            result = SupervisorOutcome.Result.FAILED;
            errorKind = SupervisorOutcome.KIND_MISSING_MARKER;
            errorMessage = "Pipeline exited with code 0 but did not report status::success.";
        } else {
            result = SupervisorOutcome.Result.SUCCEEDED;
        }
        LOG.info("Pid {} finished: {} (exit={}, {}s)", process.pid(), result, exitCode, durationSeconds);
        return new SupervisorOutcome(result, exitCode, errorKind, errorMessage, snippet,
                signals.resultsPath(), peakMb, avgCpu, durationSeconds);
    }

    private Process launch(Invocation invocation) {
        Path exe = invocation.executable();
        boolean bareName = exe.getParent() == null && !exe.isAbsolute();
        if (!bareName) {
            if (!Files.isRegularFile(exe)) {
                throw new ProcessLaunchException("Executable not found: " + exe);
            }
            if (!Files.isExecutable(exe)) {
                throw new ProcessLaunchException("Executable is not invocable: " + exe);
            }
        }
        List<String> command = new ArrayList<>();
        command.add(exe.toString());
        command.addAll(invocation.arguments());
        ProcessBuilder pb = new ProcessBuilder(command);
        if (invocation.workingDir() != null) {
            try {
                Files.createDirectories(invocation.workingDir());
            } catch (IOException e) {
                throw new ProcessLaunchException("Working directory unavailable: " + invocation.workingDir(), e);
            }
            pb.directory(invocation.workingDir().toFile());
        }
        pb.environment().putAll(invocation.environment());
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            return process;
        } catch (IOException e) {
            throw new ProcessLaunchException("Failed to start " + exe + ": " + e.getMessage(), e);
        }
    }

    private static void handleLine(StreamEvent event, LineSink sink, OutputSignals signals, StderrTail tail,
                                   TraceSnapshot trace, MetaBuffer meta) {
        emit(sink, event.kind(), event.line());
        if (event.kind() == LogKind.STDERR) {
            tail.appendLine(event.line());
            return;
        }
        if (signals.scan(event.line())) {
            meta.put(MetaKeys.PROCESS_PROGRESS, ProgressReconciler.percent(trace, signals.lastTool()));
        }
    }

    /**
     * A line the sink cannot take is lost from the log but capture continues.
     */
    private static void emit(LineSink sink, LogKind kind, String line) {
        try {
            sink.accept(kind, line);
        } catch (RuntimeException e) {
            LOG.warn("Dropped {} line, log sink failed: {}", kind.wireName(), e.getMessage());
        }
    }

    private static TraceSnapshot refreshProgress(Path traceFile, TraceSnapshot previous, OutputSignals signals, MetaBuffer meta) {
        TraceSnapshot next = ProgressTracker.parse(traceFile, previous);
        if (next.submittedCount() > 0) {
            meta.put(MetaKeys.TRACE_SUBMITTED, next.submittedCount());
            meta.put(MetaKeys.TRACE_COMPLETED, next.completedCount());
        }
        if (next.submittedCount() > 0 || signals.lastTool() != null) {
            meta.put(MetaKeys.PROCESS_PROGRESS, ProgressReconciler.percent(next, signals.lastTool()));
        }
        return next;
    }

    private static boolean isStopRequested(BooleanSupplier stopRequested) {
        if (stopRequested == null) {
            return false;
        }
        try {
            return stopRequested.getAsBoolean();
        } catch (RuntimeException e) {
            LOG.warn("Stop checkpoint failed, continuing: {}", e.getMessage());
            return false;
        }
    }

    private static long nextWakeup(long elapsed, long nextSample, long nextProgress, long nextCheckpoint,
                                   long timeoutMs, long exitedAt) {
        long due;
        if (exitedAt >= 0) {
            due = exitedAt + DRAIN_AFTER_EXIT_MS;
        } else {
            due = Math.min(Math.min(nextSample, nextProgress), Math.min(nextCheckpoint, timeoutMs));
        }
        return Math.max(1L, due - elapsed);
    }

    private static void destroyTree(Process process, boolean force) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        if (force) {
            process.destroyForcibly();
            descendants.forEach(ProcessHandle::destroyForcibly);
        } else {
            process.destroy();
            descendants.forEach(ProcessHandle::destroy);
        }
    }

    private static Integer reap(Process process) {
        try {
            process.onExit().get(REAP_WAIT_MS, TimeUnit.MILLISECONDS);
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Pid {} did not exit cleanly: {}", process.pid(), e.getMessage());
        }
        if (process.isAlive()) {
            destroyTree(process, true);
            return null;
        }
        return process.exitValue();
    }

    private static Thread startReader(InputStream in, LogKind kind, BlockingQueue<StreamEvent> events, long pid) {
        Thread t = new Thread(() -> pump(in, kind, events), "jobrelay-" + kind.wireName() + "-" + pid);
        t.setDaemon(true);
        t.start();
        return t;
    }

    /**
     * Emits complete lines only. A trailing fragment is emitted once the stream closes.
     */
    static void pump(InputStream in, LogKind kind, BlockingQueue<StreamEvent> events) {
        StringBuilder partial = new StringBuilder();
        char[] buf = new char[4096];
        IOException failure = null;
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) >= 0) {
                for (int i = 0; i < n; i++) {
                    char c = buf[i];
                    if (c == '\n') {
                        int end = partial.length();
                        if (end > 0 && partial.charAt(end - 1) == '\r') {
                            partial.setLength(end - 1);
                        }
                        events.offer(StreamEvent.line(kind, partial.toString()));
                        partial.setLength(0);
                    } else {
                        partial.append(c);
                    }
                }
            }
        } catch (IOException e) {
            failure = e;
            LOG.warn("Read error on {}: {}", kind.wireName(), e.getMessage());
        }
        if (partial.length() > 0) {
            events.offer(StreamEvent.line(kind, partial.toString()));
        }
        events.offer(StreamEvent.closed(kind, failure));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    record StreamEvent(LogKind kind, String line, boolean closed, IOException error) {
        static final StreamEvent EXITED = new StreamEvent(LogKind.CONTROL, null, false, null);

        static StreamEvent line(LogKind kind, String line) {
            return new StreamEvent(kind, line, false, null);
        }

        static StreamEvent closed(LogKind kind, IOException error) {
            return new StreamEvent(kind, null, true, error);
        }
    }

    /**
     * Peak resident memory and the mean of per-interval CPU percentages.
     */
    static final class ResourceStats {
        long peakBytes;
        private long lastCpuNanos = -1L;
        private long lastElapsedMs;
        private double cpuSum;
        private int cpuSamples;

        void record(ResourceSampler.ResourceSample sample, long elapsedMs) {
            peakBytes = Math.max(peakBytes, sample.residentBytes());
            if (lastCpuNanos >= 0 && elapsedMs > lastElapsedMs) {
                long cpuDelta = Math.max(0L, sample.cpuNanos() - lastCpuNanos);
                double wallNanos = (elapsedMs - lastElapsedMs) * 1_000_000.0;
                cpuSum += cpuDelta / wallNanos * 100.0;
                cpuSamples++;
            }
            lastCpuNanos = sample.cpuNanos();
            lastElapsedMs = elapsedMs;
        }

        double averageCpu() {
            return cpuSamples == 0 ? 0.0 : cpuSum / cpuSamples;
        }
    }
}
