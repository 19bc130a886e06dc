package io.jobrelay.model;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    STARTED,
    FINISHED,
    FAILED,
    STOPPED;

    public boolean terminal() {
        return this == FINISHED || this == FAILED || this == STOPPED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job status must not be blank");
        }
        return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
