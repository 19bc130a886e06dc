package io.jobrelay.model;

/**
 * One captured line. {@code seq} starts at 1 and has no gaps within a job.
 */
public record LogRecord(
        String jobId,
        long seq,
        LogKind kind,
        String line,
        long createdAtMs
) {
    public static final String END_OF_STREAM = "EOF";

    public boolean endOfStream() {
        return kind == LogKind.CONTROL && END_OF_STREAM.equals(line);
    }
}
