package io.jobrelay.config;

import io.jobrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Tunables read from {@code jobrelay-settings.json} in the data root. Every field is
 * optional in the file; missing or out-of-range values fall back to the defaults.
 */
public record RuntimeSettings(
        Path pipelineExecutable,
        Path resultsDir,
        Path tempDir,
        Path workDir,
        long defaultJobTimeoutMs,
        long resultTtlSeconds,
        long failureTtlSeconds,
        long logSuccessTtlSeconds,
        long logFailureTtlSeconds,
        int registryMaxSize,
        int listTerminalLimit,
        int workerCount,
        long sampleIntervalMs,
        long progressIntervalMs,
        long metaFlushIntervalMs,
        int stderrTailBytes,
        long stopGraceMs,
        int subscriberBufferSize,
        String traceFileName
) {
    public static RuntimeSettings defaults(JobRelayConfig config) {
        return new RuntimeSettings(
                config.rootDir().resolve("pipeline.sh"),
                config.defaultResultsDir(),
                config.defaultTempDir(),
                config.defaultWorkDir(),
                JobRelayConfig.DEFAULT_JOB_TIMEOUT_MS,
                JobRelayConfig.DEFAULT_RESULT_TTL_SECONDS,
                JobRelayConfig.DEFAULT_FAILURE_TTL_SECONDS,
                JobRelayConfig.DEFAULT_RESULT_TTL_SECONDS,
                JobRelayConfig.DEFAULT_FAILURE_TTL_SECONDS,
                JobRelayConfig.DEFAULT_REGISTRY_MAX_SIZE,
                JobRelayConfig.DEFAULT_LIST_TERMINAL_LIMIT,
                1,
                JobRelayConfig.DEFAULT_SAMPLE_INTERVAL_MS,
                JobRelayConfig.DEFAULT_PROGRESS_INTERVAL_MS,
                JobRelayConfig.DEFAULT_META_FLUSH_INTERVAL_MS,
                JobRelayConfig.DEFAULT_STDERR_TAIL_BYTES,
                JobRelayConfig.DEFAULT_STOP_GRACE_MS,
                JobRelayConfig.DEFAULT_SUBSCRIBER_BUFFER,
                JobRelayConfig.DEFAULT_TRACE_FILE_NAME
        );
    }

    public static RuntimeSettings load(JobRelayConfig config) {
        RuntimeSettings defaults = defaults(config);
        Path file = config.settingsFile();
        if (!Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            RuntimeSettingsFile raw = Jsons.mapper().readValue(file.toFile(), RuntimeSettingsFile.class);
            return fromFile(raw, defaults, config.rootDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static RuntimeSettings fromFile(RuntimeSettingsFile file, RuntimeSettings defaults, Path root) {
        if (file == null) {
            return defaults;
        }
        long resultTtl = sanitizeLong(file.resultTtlSeconds(), defaults.resultTtlSeconds(), 1L);
        long failureTtl = sanitizeLong(file.failureTtlSeconds(), defaults.failureTtlSeconds(), 1L);
        return new RuntimeSettings(
                sanitizePath(file.pipelineExecutable(), defaults.pipelineExecutable(), root),
                sanitizePath(file.resultsDir(), defaults.resultsDir(), root),
                sanitizePath(file.tempDir(), defaults.tempDir(), root),
                sanitizePath(file.workDir(), defaults.workDir(), root),
                sanitizeLong(file.defaultJobTimeoutMs(), defaults.defaultJobTimeoutMs(), 1_000L),
                resultTtl,
                failureTtl,
                file.logSuccessTtlSeconds() == null ? resultTtl : file.logSuccessTtlSeconds(),
                file.logFailureTtlSeconds() == null ? failureTtl : file.logFailureTtlSeconds(),
                sanitizeInt(file.registryMaxSize(), defaults.registryMaxSize(), 1),
                sanitizeInt(file.listTerminalLimit(), defaults.listTerminalLimit(), 1),
                sanitizeInt(file.workerCount(), defaults.workerCount(), 1),
                sanitizeLong(file.sampleIntervalMs(), defaults.sampleIntervalMs(), 50L),
                sanitizeLong(file.progressIntervalMs(), defaults.progressIntervalMs(), 50L),
                sanitizeLong(file.metaFlushIntervalMs(), defaults.metaFlushIntervalMs(), 0L),
                sanitizeInt(file.stderrTailBytes(), defaults.stderrTailBytes(), 64),
                sanitizeLong(file.stopGraceMs(), defaults.stopGraceMs(), 0L),
                sanitizeInt(file.subscriberBufferSize(), defaults.subscriberBufferSize(), 1),
                file.traceFileName() == null || file.traceFileName().isBlank()
                        ? defaults.traceFileName()
                        : file.traceFileName().trim()
        );
    }

    public SupervisorTimings supervisorTimings() {
        return new SupervisorTimings(sampleIntervalMs, progressIntervalMs, stderrTailBytes, stopGraceMs);
    }

    /**
     * Cadences handed to the process supervisor for one job.
     */
    public record SupervisorTimings(long sampleIntervalMs, long progressIntervalMs, int stderrTailBytes, long stopGraceMs) {
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static Path sanitizePath(String value, Path fallback, Path root) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        Path p = Paths.get(value.trim());
        return p.isAbsolute() ? p.normalize() : root.resolve(p).normalize();
    }

    record RuntimeSettingsFile(
            String pipelineExecutable,
            String resultsDir,
            String tempDir,
            String workDir,
            Long defaultJobTimeoutMs,
            Long resultTtlSeconds,
            Long failureTtlSeconds,
            Long logSuccessTtlSeconds,
            Long logFailureTtlSeconds,
            Integer registryMaxSize,
            Integer listTerminalLimit,
            Integer workerCount,
            Long sampleIntervalMs,
            Long progressIntervalMs,
            Long metaFlushIntervalMs,
            Integer stderrTailBytes,
            Long stopGraceMs,
            Integer subscriberBufferSize,
            String traceFileName
    ) {
    }
}
