package io.jobrelay.supervisor;

/**
 * How one supervised run ended. {@code errorKind} is one of {@code exit_code},
 * {@code missing_success_marker}, {@code timeout} or {@code internal}; null on success and stop.
 */
public record SupervisorOutcome(
        Result result,
        Integer exitCode,
        String errorKind,
        String errorMessage,
        String stderrSnippet,
        String resultsPath,
        double peakMemoryMb,
        double averageCpuPercent,
        double durationSeconds
) {
    public enum Result {
        SUCCEEDED,
        FAILED,
        STOPPED
    }

    public static final String KIND_LAUNCH = "launch";
    public static final String KIND_EXIT_CODE = "exit_code";
    public static final String KIND_MISSING_MARKER = "missing_success_marker";
    public static final String KIND_TIMEOUT = "timeout";
    public static final String KIND_INTERNAL = "internal";

    public boolean succeeded() {
        return result == Result.SUCCEEDED;
    }
}
