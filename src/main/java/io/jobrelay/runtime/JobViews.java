package io.jobrelay.runtime;

import io.jobrelay.model.JobRecord;
import io.jobrelay.model.JobStatus;
import io.jobrelay.model.JobView;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.model.StagedJob;
import io.jobrelay.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

final class JobViews {
    static final String STAGED_STATUS = "staged";
    private static final int SNIPPET_CHARS = 100;

    private JobViews() {
    }

    static JobView staged(StagedJob job) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(MetaKeys.RUN_NAME, job.runName());
        meta.put(MetaKeys.DESCRIPTION, job.description());
        return new JobView(
                job.id(),
                job.runName(),
                STAGED_STATUS,
                job.description(),
                job.stagedAtMs(),
                null,
                null,
                null,
                null,
                null,
                meta,
                null
        );
    }

    static JobView of(JobRecord job) {
        Map<String, Object> meta = job.meta() == null ? Map.of() : job.meta();
        String error = job.status() == JobStatus.FAILED ? errorSummary(job) : null;
        return new JobView(
                job.id(),
                job.metaText(MetaKeys.RUN_NAME),
                job.status().wireName(),
                job.metaText(MetaKeys.DESCRIPTION),
                null,
                job.enqueuedAtMs(),
                job.startedAtMs(),
                job.endedAtMs(),
                parseResult(job.result()),
                error,
                meta,
                resources(meta)
        );
    }

    static String errorSummary(JobRecord job) {
        String summary = job.metaText(MetaKeys.ERROR_MESSAGE);
        if (summary == null || summary.isBlank()) {
            summary = job.error() == null || job.error().isBlank() ? "Job failed processing" : job.error();
        }
        String snippet = job.metaText(MetaKeys.STDERR_SNIPPET);
        if (snippet != null && !snippet.isEmpty()) {
            String tail = snippet.length() > SNIPPET_CHARS ? snippet.substring(snippet.length() - SNIPPET_CHARS) : snippet;
            summary += " (stderr: ..." + tail + ")";
        }
        return summary;
    }

    private static Object parseResult(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Jsons.readMap(raw);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static JobView.ResourceInfo resources(Map<String, Object> meta) {
        Double peak = number(meta.get(MetaKeys.PEAK_MEMORY_MB));
        Double cpu = number(meta.get(MetaKeys.AVERAGE_CPU_PERCENT));
        Double duration = number(meta.get(MetaKeys.DURATION_SECONDS));
        if (peak == null && cpu == null && duration == null) {
            return null;
        }
        return new JobView.ResourceInfo(peak, cpu, duration);
    }

    private static Double number(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }
}
