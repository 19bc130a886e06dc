package io.jobrelay.logs;

import io.jobrelay.model.LogRecord;
import io.jobrelay.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frame handed to stream observers: {@code {"type": "...", "line": "..."}}.
 */
public record LogEnvelope(String type, String line) {
    public static final LogEnvelope LISTENING = new LogEnvelope("status", "Listening for logs...");

    public static LogEnvelope of(LogRecord record) {
        return new LogEnvelope(record.kind().wireName(), record.line());
    }

    public String toJson() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type);
        out.put("line", line);
        return Jsons.toCompactJson(out);
    }
}
