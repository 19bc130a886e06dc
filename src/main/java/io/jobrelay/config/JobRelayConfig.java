package io.jobrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class JobRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "jobrelay-settings.json";
    public static final long DEFAULT_JOB_TIMEOUT_MS = 2L * 60L * 60L * 1000L;
    public static final long DEFAULT_RESULT_TTL_SECONDS = 86_400L;
    public static final long DEFAULT_FAILURE_TTL_SECONDS = 604_800L;
    public static final int DEFAULT_REGISTRY_MAX_SIZE = 500;
    public static final int DEFAULT_LIST_TERMINAL_LIMIT = 50;
    public static final long DEFAULT_SAMPLE_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_PROGRESS_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_META_FLUSH_INTERVAL_MS = 2_000L;
    public static final int DEFAULT_STDERR_TAIL_BYTES = 4_096;
    public static final long DEFAULT_STOP_GRACE_MS = 10_000L;
    public static final int DEFAULT_SUBSCRIBER_BUFFER = 1_024;
    public static final String DEFAULT_TRACE_FILE_NAME = "execution_trace.txt";

    private final Path rootDir;

    public JobRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static JobRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new JobRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("jobrelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path defaultResultsDir() {
        return rootDir.resolve("results");
    }

    public Path defaultTempDir() {
        return rootDir.resolve("tmp");
    }

    public Path defaultWorkDir() {
        return rootDir.resolve("work");
    }
}
