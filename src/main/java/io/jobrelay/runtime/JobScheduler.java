package io.jobrelay.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.config.RuntimeSettings;
import io.jobrelay.logs.LogBroadcaster;
import io.jobrelay.model.JobRecord;
import io.jobrelay.model.JobStatus;
import io.jobrelay.model.JobView;
import io.jobrelay.model.LogKind;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.model.StagedJob;
import io.jobrelay.storage.JobLockedException;
import io.jobrelay.storage.JobNotFoundException;
import io.jobrelay.storage.JobRepository;
import io.jobrelay.storage.StagedJobStore;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Moves work through its lifecycle: staged parameters become queued jobs, queued jobs are
 * cancelled or stopped, finished jobs are listed, removed and re-staged.
 */
public final class JobScheduler {
    private static final Logger LOG = LogManager.getLogger(JobScheduler.class);
    private static final DateTimeFormatter RERUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final long STOP_SETTLE_MS = 10_000L;
    private static final long STOP_POLL_MS = 100L;
    private static final List<JobStatus> TERMINAL_REGISTRIES = List.of(JobStatus.FINISHED, JobStatus.FAILED, JobStatus.STOPPED);

    private final StagedJobStore stagedStore;
    private final JobRepository jobs;
    private final LogBroadcaster logs;
    private final RuntimeSettings settings;

    public JobScheduler(StagedJobStore stagedStore, JobRepository jobs, LogBroadcaster logs, RuntimeSettings settings) {
        this.stagedStore = stagedStore;
        this.jobs = jobs;
        this.logs = logs;
        this.settings = settings;
    }

    public String stage(ObjectNode params) {
        String id = stagedStore.stage(params);
        LOG.info("Staged job {} (run name '{}')", id, params.path(MetaKeys.RUN_NAME).asText(""));
        return id;
    }

    /**
     * Inserts a queued job under {@code proposedId}, or under a fresh id when that one is
     * taken or blank.
     */
    public String enqueue(String proposedId, ObjectNode args, long timeoutMs, long resultTtlSeconds,
                          long failureTtlSeconds, Map<String, Object> meta) {
        String candidate = proposedId == null || proposedId.isBlank() ? freshJobId() : proposedId.trim();
        long now = System.currentTimeMillis();
        while (!jobs.insertQueued(new JobRepository.NewJob(
                candidate,
                args == null ? Jsons.newObject() : args,
                meta == null ? Map.of() : meta,
                now,
                timeoutMs,
                resultTtlSeconds,
                failureTtlSeconds))) {
            String replacement = freshJobId();
            LOG.warn("Job id {} already exists, using {}", candidate, replacement);
            candidate = replacement;
        }
        return candidate;
    }

    public String promote(String stagedId) {
        if (!StagedJob.isStagedId(stagedId)) {
            throw new IllegalArgumentException("Not a staged job id: " + stagedId);
        }
        StagedJob staged = stagedStore.fetchStaged(stagedId)
                .orElseThrow(() -> new JobNotFoundException(stagedId));
        ObjectNode params = staged.params();
        String runName = staged.runName();
        if (runName == null || runName.isBlank()) {
            String suffix = stagedId.substring(StagedJob.ID_PREFIX.length());
            runName = "run_" + suffix.substring(0, Math.min(8, suffix.length()));
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(MetaKeys.RUN_NAME, runName);
        meta.put(MetaKeys.DESCRIPTION, staged.description());
        meta.put(MetaKeys.STAGED_JOB_ID_ORIGIN, stagedId);
        meta.put(MetaKeys.IS_RERUN_EXECUTION, params.path("is_rerun").asBoolean(false));
        meta.put(MetaKeys.ORIGINAL_JOB_ID, params.hasNonNull("original_job_id") ? params.get("original_job_id").asText() : null);
        meta.put(MetaKeys.OVERALL_PROGRESS, 0);
        meta.put(MetaKeys.CURRENT_TASK, "Queued");

        String proposed = JobRecord.ID_PREFIX + stagedId.substring(StagedJob.ID_PREFIX.length());
        String jobId = enqueue(
                proposed,
                params.deepCopy(),
                timeoutOf(params),
                settings.resultTtlSeconds(),
                settings.failureTtlSeconds(),
                meta
        );
        stagedStore.removeStaged(stagedId);
        LOG.info("Enqueued job {} from {} (run name '{}')", jobId, stagedId, runName);
        return jobId;
    }

    public StopOutcome stop(String jobId) {
        if (StagedJob.isStagedId(jobId)) {
            throw new IllegalArgumentException("Cannot stop 'staged' job. Remove it.");
        }
        JobRecord job = jobs.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.status().terminal()) {
            return new StopOutcome(jobId, false, "Job already in terminal state: " + job.status().wireName() + ".");
        }
        if (job.status() == JobStatus.QUEUED && jobs.cancelQueued(jobId, System.currentTimeMillis())) {
            logs.publish(jobId, LogKind.STATUS, "Job cancelled before start.");
            logs.publishEnd(jobId);
            logs.finalize(jobId, false);
            TemporaryInputs.release(job.args(), settings.tempDir());
            LOG.info("Queued job {} cancelled", jobId);
            return new StopOutcome(jobId, true, "Queued job " + jobId + " canceled.");
        }
        if (jobs.requestStop(jobId)) {
            LOG.info("Stop signal sent to job {}", jobId);
            return new StopOutcome(jobId, true, "Stop signal sent to job " + jobId + ".");
        }
        JobRecord latest = jobs.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (latest.status().terminal()) {
            return new StopOutcome(jobId, false, "Job already in terminal state: " + latest.status().wireName() + ".");
        }
        return new StopOutcome(jobId, false, "Job " + jobId + " has status '" + latest.status().wireName() + "', cannot stop/cancel.");
    }

    /**
     * Removes a staged record, or a job with its registry entries and log history. A job that
     * is still active is asked to stop first, and is deleted only after its worker has
     * finalized it.
     *
     * @throws JobLockedException when the worker does not finish stopping in time
     */
    public String remove(String jobId) {
        if (StagedJob.isStagedId(jobId)) {
            Optional<StagedJob> staged = Optional.empty();
            try {
                staged = stagedStore.fetchStaged(jobId);
            } catch (IllegalStateException e) {
                LOG.warn("Removed corrupted staged job {}", jobId);
                return "Job " + jobId + " removed.";
            }
            if (!stagedStore.removeStaged(jobId)) {
                throw new JobNotFoundException(jobId);
            }
            staged.ifPresent(s -> TemporaryInputs.release(s.params(), settings.tempDir()));
            LOG.info("Removed staged job {}", jobId);
            return "Job " + jobId + " removed.";
        }
        Optional<JobRecord> current = jobs.find(jobId);
        if (current.isEmpty()) {
            int lines = logs.delete(jobId);
            if (lines == 0) {
                throw new JobNotFoundException(jobId);
            }
            LOG.info("Job {} already gone, cleaned up {} log records", jobId, lines);
            return "Job " + jobId + " removed.";
        }
        JobRecord job = current.get();
        if (!job.status().terminal()) {
            stop(jobId);
            Optional<JobRecord> settled = awaitFinalized(jobId);
            if (settled.isEmpty()) {
                int lines = logs.delete(jobId);
                LOG.info("Job {} was removed while stopping, cleaned up {} log records", jobId, lines);
                return "Job " + jobId + " removed.";
            }
            job = settled.get();
        }
        boolean deleted;
        try {
            deleted = jobs.delete(jobId, job.version());
        } catch (JobLockedException e) {
            LOG.warn("Removal of job {} raced a worker update", jobId);
            throw e;
        }
        int lines = logs.delete(jobId);
        TemporaryInputs.release(job.args(), settings.tempDir());
        LOG.info("Removed job {} (record deleted={}, log records={})", jobId, deleted, lines);
        return "Job " + jobId + " removed.";
    }

    /**
     * Polls until the job is terminal and its end marker is stored. A terminal job whose
     * marker never shows up is returned once the wait runs out.
     */
    private Optional<JobRecord> awaitFinalized(String jobId) {
        long deadline = System.currentTimeMillis() + settings.stopGraceMs() + STOP_SETTLE_MS;
        while (true) {
            Optional<JobRecord> latest = jobs.find(jobId);
            if (latest.isEmpty()) {
                return latest;
            }
            boolean terminal = latest.get().status().terminal();
            if (terminal && logs.hasEnded(jobId)) {
                return latest;
            }
            if (System.currentTimeMillis() >= deadline) {
                if (terminal) {
                    return latest;
                }
                LOG.warn("Job {} did not stop within the removal wait; stop flag left set", jobId);
                throw new JobLockedException(jobId);
            }
            try {
                Thread.sleep(STOP_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobLockedException(jobId, e);
            }
        }
    }

    /**
     * Staged entries and every registry, most recent first. Each terminal registry contributes
     * at most {@code listTerminalLimit} entries.
     */
    public List<JobView> list() {
        List<JobView> out = listStaged();
        Set<String> ids = new LinkedHashSet<>();
        ids.addAll(jobs.registryIds(JobStatus.QUEUED, 0));
        ids.addAll(jobs.registryIds(JobStatus.STARTED, 0));
        for (JobStatus registry : TERMINAL_REGISTRIES) {
            ids.addAll(jobs.registryIds(registry, settings.listTerminalLimit()));
        }
        for (JobRecord job : jobs.findMany(ids)) {
            out.add(JobViews.of(job));
        }
        out.sort(Comparator.comparingLong(JobView::sortKey).reversed());
        return out;
    }

    public List<JobView> listStaged() {
        List<JobView> out = new ArrayList<>();
        for (StagedJob staged : stagedStore.listStaged()) {
            out.add(JobViews.staged(staged));
        }
        return out;
    }

    public JobView status(String id) {
        if (StagedJob.isStagedId(id)) {
            return stagedStore.fetchStaged(id)
                    .map(JobViews::staged)
                    .orElseThrow(() -> new JobNotFoundException(id));
        }
        return jobs.find(id).map(JobViews::of).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Stages a new run from a terminal job's stored arguments. The original job is untouched.
     */
    public String rerun(String jobId) {
        if (StagedJob.isStagedId(jobId)) {
            throw new IllegalArgumentException("Cannot re-run a staged job: " + jobId);
        }
        JobRecord job = jobs.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.status().terminal()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.status().wireName() + "; only finished, failed or stopped jobs can be re-run.");
        }
        String originalName = job.metaText(MetaKeys.RUN_NAME);
        if (originalName == null || originalName.isBlank()) {
            String suffix = jobId.startsWith(JobRecord.ID_PREFIX) ? jobId.substring(JobRecord.ID_PREFIX.length()) : jobId;
            originalName = "run_" + suffix.substring(0, Math.min(8, suffix.length()));
        }
        String originalDesc = job.metaText(MetaKeys.DESCRIPTION);
        ObjectNode params = job.args() == null ? Jsons.newObject() : job.args().deepCopy();
        params.remove(TemporaryInputs.ARG_KEY);
        params.put(MetaKeys.RUN_NAME, originalName + "_rerun_" + LocalDateTime.now().format(RERUN_STAMP));
        params.put(MetaKeys.DESCRIPTION, "Re-run of '" + originalName + "'. Original desc: "
                + (originalDesc == null || originalDesc.isBlank() ? "N/A" : originalDesc));
        params.put("is_rerun", true);
        params.put("original_job_id", jobId);
        String stagedId = stagedStore.stage(params);
        LOG.info("Re-staged job {} as {}", jobId, stagedId);
        return stagedId;
    }

    public PurgeOutcome purgeExpired() {
        long now = System.currentTimeMillis();
        int purgedJobs = 0;
        int skipped = 0;
        for (String jobId : jobs.expiredTerminalJobs(now)) {
            Optional<JobRecord> job = jobs.find(jobId);
            if (job.isEmpty()) {
                continue;
            }
            try {
                if (jobs.delete(jobId, job.get().version())) {
                    purgedJobs++;
                }
            } catch (JobLockedException e) {
                skipped++;
            }
        }
        int purgedLogs = logs.purgeExpired(now);
        if (purgedJobs > 0 || skipped > 0) {
            LOG.info("Purged {} expired jobs ({} skipped as locked)", purgedJobs, skipped);
        }
        return new PurgeOutcome(purgedJobs, purgedLogs, skipped);
    }

    private long timeoutOf(ObjectNode params) {
        long requested = params.path("timeout_ms").asLong(0L);
        return requested > 0 ? requested : settings.defaultJobTimeoutMs();
    }

    private static String freshJobId() {
        return JobRecord.ID_PREFIX + UUID.randomUUID();
    }

    public record StopOutcome(String jobId, boolean signalled, String message) {
    }

    public record PurgeOutcome(int jobsPurged, int logHistoriesPurged, int lockedSkipped) {
    }
}
