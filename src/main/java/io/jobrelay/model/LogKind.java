package io.jobrelay.model;

import java.util.Locale;

public enum LogKind {
    STDOUT,
    STDERR,
    STATUS,
    ERROR,
    CONTROL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LogKind fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return STATUS;
        }
        return LogKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
