package io.jobrelay.supervisor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record Invocation(
        Path executable,
        List<String> arguments,
        Path workingDir,
        Map<String, String> environment,
        long timeoutMs,
        Path traceFile
) {
    public Invocation {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }
}
