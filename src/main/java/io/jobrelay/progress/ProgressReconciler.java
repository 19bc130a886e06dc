package io.jobrelay.progress;

/**
 * Combines the trace-file ratio with the tool's own aggregate line. The two sources race;
 * whichever reports the larger cumulative count is taken.
 */
public final class ProgressReconciler {
    private ProgressReconciler() {
    }

    public static int percent(TraceSnapshot trace, ToolProgress tool) {
        int submitted = trace == null ? 0 : trace.submittedCount();
        int completed = trace == null ? 0 : trace.completedCount();
        if (tool != null && (tool.submitted() > submitted || tool.completed() > completed)) {
            submitted = Math.max(submitted, tool.submitted());
            completed = Math.max(completed, tool.completed());
        }
        return ratio(completed, submitted);
    }

    static int ratio(int completed, int submitted) {
        if (submitted <= 0) {
            return 0;
        }
        double pct = (double) completed / (double) submitted * 100.0;
        return clamp((int) Math.round(pct));
    }

    public static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
