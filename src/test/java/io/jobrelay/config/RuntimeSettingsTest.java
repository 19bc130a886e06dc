package io.jobrelay.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class RuntimeSettingsTest {

    @Test
    void defaultsApplyWhenSettingsFileIsMissing() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-settings-default-");
        try {
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            RuntimeSettings settings = RuntimeSettings.load(config);

            Assertions.assertEquals(2L * 60L * 60L * 1000L, settings.defaultJobTimeoutMs());
            Assertions.assertEquals(86_400L, settings.resultTtlSeconds());
            Assertions.assertEquals(604_800L, settings.failureTtlSeconds());
            Assertions.assertEquals(50, settings.listTerminalLimit());
            Assertions.assertEquals(5_000L, settings.sampleIntervalMs());
            Assertions.assertEquals(4_096, settings.stderrTailBytes());
            Assertions.assertEquals(config.rootDir().resolve("results"), settings.resultsDir());
            Assertions.assertEquals("execution_trace.txt", settings.traceFileName());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitizedAndPathsResolvedAgainstRoot() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-settings-file-");
        try {
            Files.writeString(root.resolve(JobRelayConfig.SETTINGS_FILE), """
                    {
                      "resultsDir": "out",
                      "defaultJobTimeoutMs": 10,
                      "sampleIntervalMs": 1,
                      "registryMaxSize": 3,
                      "resultTtlSeconds": 600,
                      "logFailureTtlSeconds": 0,
                      "workerCount": 0,
                      "unknownKey": "ignored"
                    }
                    """);
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            RuntimeSettings settings = RuntimeSettings.load(config);

            Assertions.assertEquals(config.rootDir().resolve("out"), settings.resultsDir());
            Assertions.assertEquals(1_000L, settings.defaultJobTimeoutMs());
            Assertions.assertEquals(50L, settings.sampleIntervalMs());
            Assertions.assertEquals(3, settings.registryMaxSize());
            Assertions.assertEquals(1, settings.workerCount());
            Assertions.assertEquals(600L, settings.logSuccessTtlSeconds());
            Assertions.assertEquals(0L, settings.logFailureTtlSeconds());
            Assertions.assertEquals(604_800L, settings.failureTtlSeconds());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFileIsReported() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-settings-bad-");
        try {
            Files.writeString(root.resolve(JobRelayConfig.SETTINGS_FILE), "{not json");
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            Assertions.assertThrows(IllegalStateException.class, () -> RuntimeSettings.load(config));
        } finally {
            deleteRecursively(root);
        }
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
