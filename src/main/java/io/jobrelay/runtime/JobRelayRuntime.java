package io.jobrelay.runtime;

import io.jobrelay.bus.ChannelHub;
import io.jobrelay.bus.NotificationBus;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.config.RuntimeSettings;
import io.jobrelay.logs.LogBroadcaster;
import io.jobrelay.model.JobRecord;
import io.jobrelay.storage.Database;
import io.jobrelay.storage.JobRepository;
import io.jobrelay.storage.LogStore;
import io.jobrelay.storage.StagedJobStore;
import io.jobrelay.supervisor.ProcResourceSampler;
import io.jobrelay.supervisor.ProcessSupervisor;
import io.jobrelay.supervisor.ResourceSampler;
import io.jobrelay.supervisor.SupervisorOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns every store, bus and worker handle for one data root. Built by the entry point,
 * initialized once, closed on shutdown.
 */
public final class JobRelayRuntime implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(JobRelayRuntime.class);

    private final JobRelayConfig config;
    private final RuntimeSettings settings;
    private final Database database;
    private final StagedJobStore stagedStore;
    private final JobRepository jobs;
    private final ChannelHub hub;
    private final LogBroadcaster logs;
    private final NotificationBus notifications;
    private final JobScheduler scheduler;
    private final JobWorker worker;
    private final List<WorkerPool> pools;

    public JobRelayRuntime(JobRelayConfig config) {
        this(config, RuntimeSettings.load(config), new ProcResourceSampler());
    }

    public JobRelayRuntime(JobRelayConfig config, RuntimeSettings settings, ResourceSampler sampler) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.stagedStore = new StagedJobStore(database);
        this.jobs = new JobRepository(database, settings.registryMaxSize());
        this.hub = new ChannelHub();
        this.logs = new LogBroadcaster(
                new LogStore(database),
                hub,
                settings.subscriberBufferSize(),
                settings.logSuccessTtlSeconds(),
                settings.logFailureTtlSeconds()
        );
        this.notifications = new NotificationBus(hub, settings.subscriberBufferSize());
        this.scheduler = new JobScheduler(stagedStore, jobs, logs, settings);
        this.worker = new JobWorker(jobs, logs, notifications,
                new ProcessSupervisor(settings.supervisorTimings(), sampler), settings);
        this.pools = new CopyOnWriteArrayList<>();
    }

    public void init() {
        database.init();
        try {
            Files.createDirectories(settings.resultsDir());
            Files.createDirectories(settings.tempDir());
            Files.createDirectories(settings.workDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create runtime directories under " + config.rootDir(), e);
        }
        LOG.info("Runtime initialized at {}", config.rootDir());
    }

    /**
     * Claims the oldest queued job and runs it to completion on the calling thread.
     */
    public WorkerOutcome runWorkerOnce(String workerId) {
        Optional<JobRecord> claimed = jobs.claimNext(workerId, System.currentTimeMillis());
        if (claimed.isEmpty()) {
            return new WorkerOutcome(false, null, null, "No queued jobs");
        }
        JobRecord job = claimed.get();
        LOG.info("Worker {} claimed job {}", workerId, job.id());
        SupervisorOutcome outcome = worker.execute(job);
        return new WorkerOutcome(true, job.id(), outcome.result().name().toLowerCase(Locale.ROOT), outcome.errorMessage());
    }

    public WorkerPool startWorkers(int count, long idleMs) {
        WorkerPool pool = new WorkerPool(this, count, idleMs, "jobrelay-worker");
        pools.add(pool);
        return pool;
    }

    public JobRelayConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public StagedJobStore stagedStore() {
        return stagedStore;
    }

    public JobRepository jobs() {
        return jobs;
    }

    public LogBroadcaster logs() {
        return logs;
    }

    public NotificationBus notifications() {
        return notifications;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        for (WorkerPool pool : pools) {
            pool.close();
        }
        pools.clear();
        LOG.info("Runtime closed");
    }

    public record WorkerOutcome(boolean processed, String jobId, String result, String message) {
    }
}
