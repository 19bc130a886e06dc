package io.jobrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Input files a job owns inside the temp directory, listed under {@code temporary_inputs}.
 * Paths outside the temp directory are never touched.
 */
final class TemporaryInputs {
    static final String ARG_KEY = "temporary_inputs";
    private static final Logger LOG = LogManager.getLogger(TemporaryInputs.class);

    private TemporaryInputs() {
    }

    static int release(JsonNode args, Path tempDir) {
        if (args == null || tempDir == null) {
            return 0;
        }
        JsonNode list = args.path(ARG_KEY);
        if (!list.isArray()) {
            return 0;
        }
        Path root = tempDir.toAbsolutePath().normalize();
        int removed = 0;
        for (JsonNode item : list) {
            String raw = item.asText("");
            if (raw.isBlank()) {
                continue;
            }
            Path p = Paths.get(raw).toAbsolutePath().normalize();
            if (!p.startsWith(root) || p.equals(root)) {
                LOG.warn("Not releasing {}: outside temp directory {}", p, root);
                continue;
            }
            try {
                if (Files.deleteIfExists(p)) {
                    removed++;
                    LOG.info("Cleaned up temporary input: {}", p);
                }
            } catch (IOException e) {
                LOG.warn("Could not clean up temporary input {}: {}", p, e.getMessage());
            }
        }
        return removed;
    }
}
