package io.jobrelay.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

public record JobRecord(
        String id,
        JobStatus status,
        ObjectNode args,
        Map<String, Object> meta,
        Long enqueuedAtMs,
        Long startedAtMs,
        Long endedAtMs,
        String result,
        String error,
        long timeoutMs,
        long resultTtlSeconds,
        long failureTtlSeconds,
        boolean stopRequested,
        long version
) {
    public static final String ID_PREFIX = "job_";

    public Object metaValue(String key) {
        return meta == null ? null : meta.get(key);
    }

    public String metaText(String key) {
        Object v = metaValue(key);
        return v == null ? null : String.valueOf(v);
    }
}
