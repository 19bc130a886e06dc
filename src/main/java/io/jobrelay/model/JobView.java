package io.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Flattened view over a staged record or a job record, used for listings and status
 * queries. {@code status} is {@code "staged"} for staged records.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobView(
        String jobId,
        String runName,
        String status,
        String description,
        Long stagedAt,
        Long enqueuedAt,
        Long startedAt,
        Long endedAt,
        Object result,
        String error,
        Map<String, Object> meta,
        ResourceInfo resources
) {
    @JsonIgnore
    public long sortKey() {
        if (endedAt != null) {
            return endedAt;
        }
        if (startedAt != null) {
            return startedAt;
        }
        if (enqueuedAt != null) {
            return enqueuedAt;
        }
        return stagedAt == null ? 0L : stagedAt;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ResourceInfo(Double peakMemoryMb, Double averageCpuPercent, Double durationSeconds) {
    }
}
