package io.jobrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.bus.NotificationBus;
import io.jobrelay.config.RuntimeSettings;
import io.jobrelay.logs.LogBroadcaster;
import io.jobrelay.model.JobRecord;
import io.jobrelay.model.JobStatus;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.storage.JobRepository;
import io.jobrelay.supervisor.Invocation;
import io.jobrelay.supervisor.MetaBuffer;
import io.jobrelay.supervisor.ProcessLaunchException;
import io.jobrelay.supervisor.ProcessSupervisor;
import io.jobrelay.supervisor.SupervisorOutcome;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one claimed job and always finalizes it, whatever the supervisor reports.
 */
public final class JobWorker {
    static final String RUN_METADATA_FILE = "run_metadata.json";
    private static final Logger LOG = LogManager.getLogger(JobWorker.class);

    private final JobRepository jobs;
    private final LogBroadcaster logs;
    private final NotificationBus notifications;
    private final ProcessSupervisor supervisor;
    private final RuntimeSettings settings;

    public JobWorker(JobRepository jobs, LogBroadcaster logs, NotificationBus notifications,
                     ProcessSupervisor supervisor, RuntimeSettings settings) {
        this.jobs = jobs;
        this.logs = logs;
        this.notifications = notifications;
        this.supervisor = supervisor;
        this.settings = settings;
    }

    public SupervisorOutcome execute(JobRecord job) {
        String jobId = job.id();
        MetaBuffer meta = new MetaBuffer(job.meta(), settings.metaFlushIntervalMs(), snapshot -> jobs.updateMeta(jobId, snapshot));
        meta.put(MetaKeys.CURRENT_TASK, "Starting");
        LOG.info("[Job {}] Starting pipeline task", jobId);

        SupervisorOutcome outcome = null;
        try {
            logs.publish(jobId, LogKind.STATUS, "Starting pipeline task for job " + jobId + ".");
            Invocation invocation = resolveInvocation(job);
            logs.publish(jobId, LogKind.STATUS, "Running " + invocation.executable() + " in " + invocation.workingDir());
            meta.put(MetaKeys.CURRENT_TASK, "Running pipeline");
            outcome = supervisor.run(
                    invocation,
                    (kind, line) -> logs.publish(jobId, kind, line),
                    meta,
                    () -> jobs.isStopRequested(jobId)
            );
        } catch (ProcessLaunchException | IllegalArgumentException e) {
            LOG.error("[Job {}] Launch failed: {}", jobId, e.getMessage());
            outcome = failure(SupervisorOutcome.KIND_LAUNCH, "Pipeline could not be started: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("[Job {}] Unexpected error during pipeline execution", jobId, e);
            meta.put(MetaKeys.ERROR_DETAILS, String.valueOf(e.getMessage()));
            outcome = failure(SupervisorOutcome.KIND_INTERNAL, "Unexpected task error: " + e.getClass().getSimpleName());
        } finally {
            if (outcome == null) {
                outcome = failure(SupervisorOutcome.KIND_INTERNAL, "Pipeline task aborted.");
            }
            finish(job, meta, outcome);
        }
        return outcome;
    }

    private void finish(JobRecord job, MetaBuffer meta, SupervisorOutcome outcome) {
        String jobId = job.id();
        JobStatus terminal = switch (outcome.result()) {
            case SUCCEEDED -> JobStatus.FINISHED;
            case STOPPED -> JobStatus.STOPPED;
            case FAILED -> JobStatus.FAILED;
        };
        boolean succeeded = terminal == JobStatus.FINISHED;
        if (succeeded) {
            meta.put(MetaKeys.CURRENT_TASK, MetaKeys.COMPLETED_TASK);
        } else {
            meta.put(MetaKeys.ERROR_MESSAGE, outcome.errorMessage());
            if (outcome.errorKind() != null) {
                meta.put(MetaKeys.ERROR_KIND, outcome.errorKind());
            }
            if (outcome.stderrSnippet() != null) {
                meta.put(MetaKeys.STDERR_SNIPPET, outcome.stderrSnippet());
            }
        }
        Path resultsPath = resultsPath(jobId, outcome);
        if (resultsPath != null) {
            meta.put(MetaKeys.RESULTS_PATH, resultsPath.toString());
        }
        guard(jobId, "final meta flush", meta::flush);

        Map<String, Object> snapshot = meta.snapshot();
        String result = Jsons.toCompactJson(result(terminal, resultsPath, snapshot));
        guard(jobId, "status transition", () -> {
            JobRepository.Completion completion = jobs.complete(jobId, terminal, result, outcome.errorMessage(), snapshot, System.currentTimeMillis());
            if (!completion.updated()) {
                LOG.warn("[Job {}] Record changed or was removed before completion; status not updated", jobId);
            }
            for (String evicted : completion.evictedJobIds()) {
                logs.delete(evicted);
                LOG.info("Job {} evicted from the {} registry", evicted, terminal.wireName());
            }
        });
        if (succeeded && resultsPath != null) {
            guard(jobId, "run metadata", () -> writeRunMetadata(jobId, resultsPath, snapshot));
        }
        guard(jobId, "final status line", () -> {
            if (succeeded) {
                logs.publish(jobId, LogKind.STATUS, "Pipeline finished successfully.");
            } else if (terminal == JobStatus.STOPPED) {
                logs.publish(jobId, LogKind.STATUS, outcome.errorMessage());
            } else {
                logs.publish(jobId, LogKind.ERROR, outcome.errorMessage());
            }
        });
        guard(jobId, "end of stream", () -> logs.publishEnd(jobId));
        guard(jobId, "log retention", () -> logs.finalize(jobId, succeeded));
        guard(jobId, "completion notice", () -> notifications.publishCompletion(jobId, succeeded, summary(job, terminal, outcome)));
        guard(jobId, "temporary inputs", () -> TemporaryInputs.release(job.args(), settings.tempDir()));
        LOG.info("[Job {}] Finalized as {}", jobId, terminal.wireName());
    }

    Invocation resolveInvocation(JobRecord job) {
        ObjectNode args = job.args() == null ? Jsons.newObject() : job.args();
        Path executable = args.hasNonNull("executable")
                ? Paths.get(args.get("executable").asText())
                : settings.pipelineExecutable();
        List<String> arguments = new ArrayList<>();
        JsonNode rawArgs = args.path("arguments");
        if (!rawArgs.isMissingNode() && !rawArgs.isNull()) {
            if (!rawArgs.isArray()) {
                throw new IllegalArgumentException("'arguments' must be an array of strings");
            }
            for (JsonNode a : rawArgs) {
                arguments.add(a.asText());
            }
        }
        Path workDir = args.hasNonNull("working_dir")
                ? settings.workDir().resolve(args.get("working_dir").asText()).normalize()
                : settings.workDir().resolve(job.id());
        Map<String, String> env = new LinkedHashMap<>();
        JsonNode rawEnv = args.path("environment");
        if (rawEnv.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = rawEnv.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                env.put(e.getKey(), e.getValue().asText());
            }
        }
        env.put("JOBRELAY_JOB_ID", job.id());
        env.put("JOBRELAY_RESULTS_DIR", settings.resultsDir().toString());
        Path trace = args.hasNonNull("trace_file")
                ? workDir.resolve(args.get("trace_file").asText()).normalize()
                : workDir.resolve(settings.traceFileName());
        return new Invocation(executable, arguments, workDir, env, job.timeoutMs(), trace);
    }

    private Path resultsPath(String jobId, SupervisorOutcome outcome) {
        if (outcome.resultsPath() == null || outcome.resultsPath().isBlank()) {
            return outcome.succeeded() ? settings.resultsDir().resolve(jobId) : null;
        }
        return settings.resultsDir().resolve(outcome.resultsPath()).normalize();
    }

    private void writeRunMetadata(String jobId, Path resultsPath, Map<String, Object> snapshot) {
        try {
            Files.createDirectories(resultsPath);
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("job_id", jobId);
            doc.put("written_at", Instant.now().toString());
            doc.put("meta", snapshot);
            Files.writeString(resultsPath.resolve(RUN_METADATA_FILE), Jsons.toJson(doc));
            LOG.info("[Job {}] Run metadata written to {}", jobId, resultsPath.resolve(RUN_METADATA_FILE));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write run metadata for job " + jobId, e);
        }
    }

    private static Map<String, Object> result(JobStatus terminal, Path resultsPath, Map<String, Object> meta) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", terminal == JobStatus.FINISHED ? "success" : terminal.wireName());
        out.put("results_path", resultsPath == null ? null : resultsPath.toString());
        Map<String, Object> resources = new LinkedHashMap<>();
        resources.put(MetaKeys.PEAK_MEMORY_MB, meta.get(MetaKeys.PEAK_MEMORY_MB));
        resources.put(MetaKeys.AVERAGE_CPU_PERCENT, meta.get(MetaKeys.AVERAGE_CPU_PERCENT));
        resources.put(MetaKeys.DURATION_SECONDS, meta.get(MetaKeys.DURATION_SECONDS));
        out.put("resources", resources);
        return out;
    }

    private static String summary(JobRecord job, JobStatus terminal, SupervisorOutcome outcome) {
        String name = job.metaText(MetaKeys.RUN_NAME);
        String label = name == null ? job.id() : "'" + name + "'";
        if (terminal == JobStatus.FINISHED) {
            return "Job " + label + " finished successfully.";
        }
        return "Job " + label + " " + terminal.wireName() + ": " + outcome.errorMessage();
    }

    private static SupervisorOutcome failure(String kind, String message) {
        return new SupervisorOutcome(SupervisorOutcome.Result.FAILED, null, kind, message, null, null, 0.0, 0.0, 0.0);
    }

    private static void guard(String jobId, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("[Job {}] Finalizer step '{}' failed", jobId, step, e);
        }
    }
}
