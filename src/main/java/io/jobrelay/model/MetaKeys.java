package io.jobrelay.model;

/**
 * Field names used in a job's meta map.
 */
public final class MetaKeys {
    public static final String RUN_NAME = "run_name";
    public static final String DESCRIPTION = "description";
    public static final String STAGED_JOB_ID_ORIGIN = "staged_job_id_origin";
    public static final String IS_RERUN_EXECUTION = "is_rerun_execution";
    public static final String ORIGINAL_JOB_ID = "original_job_id";

    public static final String OVERALL_PROGRESS = "overall_progress";
    public static final String CURRENT_TASK = "current_task";
    public static final String CURRENT_PROCESS = "current_process";
    public static final String RESULTS_PATH = "results_path";
    public static final String PIPELINE_STATUS = "pipeline_status";
    public static final String TOOL_PERCENT = "tool_progress_percent";
    public static final String TOOL_COMPLETED = "tool_completed_count";
    public static final String TOOL_SUBMITTED = "tool_submitted_count";
    public static final String TRACE_SUBMITTED = "trace_submitted_count";
    public static final String TRACE_COMPLETED = "trace_completed_count";
    public static final String PROCESS_PROGRESS = "process_progress";

    public static final String PEAK_MEMORY_MB = "peak_memory_mb";
    public static final String AVERAGE_CPU_PERCENT = "average_cpu_percent";
    public static final String DURATION_SECONDS = "duration_seconds";
    public static final String EXIT_CODE = "exit_code";

    public static final String ERROR_MESSAGE = "error_message";
    public static final String ERROR_KIND = "error_kind";
    public static final String ERROR_DETAILS = "error_details";
    public static final String STDERR_SNIPPET = "stderr_snippet";

    public static final String COMPLETED_TASK = "Completed";

    private MetaKeys() {
    }
}
