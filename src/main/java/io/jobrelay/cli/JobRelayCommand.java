package io.jobrelay.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.logs.LogEnvelope;
import io.jobrelay.logs.LogSubscription;
import io.jobrelay.model.LogRecord;
import io.jobrelay.runtime.JobRelayRuntime;
import io.jobrelay.runtime.JobScheduler;
import io.jobrelay.storage.JobLockedException;
import io.jobrelay.storage.JobNotFoundException;
import io.jobrelay.storage.StorageUnavailableException;
import io.jobrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "jobrelay",
        mixinStandardHelpOptions = true,
        description = "Job orchestration runtime with live log streaming",
        subcommands = {
                JobRelayCommand.InitCommand.class,
                JobRelayCommand.StageCommand.class,
                JobRelayCommand.StagedCommand.class,
                JobRelayCommand.StartCommand.class,
                JobRelayCommand.JobsCommand.class,
                JobRelayCommand.JobCommand.class,
                JobRelayCommand.StopCommand.class,
                JobRelayCommand.RemoveCommand.class,
                JobRelayCommand.RerunCommand.class,
                JobRelayCommand.LogsCommand.class,
                JobRelayCommand.WorkerCommand.class,
                JobRelayCommand.ServeCommand.class,
                JobRelayCommand.PurgeCommand.class
        }
)
public final class JobRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | stage | staged | start | jobs | job | stop | remove | rerun | logs | worker | serve | purge");
    }

    JobRelayRuntime runtime() {
        JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static int fail(RuntimeException e) {
        int code;
        if (e instanceof JobNotFoundException) {
            code = 4;
        } else if (e instanceof JobLockedException) {
            code = 5;
        } else if (e instanceof StorageUnavailableException) {
            code = 3;
        } else {
            code = 2;
        }
        System.out.println(Jsons.toJson(Map.of("error", String.valueOf(e.getMessage()))));
        return code;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println("Initialized JobRelay at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "stage", description = "Stage a parameter bundle for later execution")
    static final class StageCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--params-file"}, description = "JSON file with the full parameter object")
        String paramsFile;

        @Option(names = {"--run-name"}, description = "Run name")
        String runName;

        @Option(names = {"--description"}, description = "Free-text description")
        String description;

        @Option(names = {"--executable"}, description = "Executable to run instead of the configured pipeline")
        String executable;

        @Option(names = {"--arg"}, description = "Argument passed to the executable (repeatable)")
        List<String> arguments;

        @Option(names = {"--timeout-ms"}, description = "Per-job timeout override")
        Long timeoutMs;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = paramsFile == null
                    ? Jsons.newObject()
                    : Jsons.readObject(Files.readString(Path.of(paramsFile)));
            if (runName != null) {
                params.put("run_name", runName.trim().replace(" ", "_"));
            }
            if (description != null) {
                params.put("description", description);
            }
            if (executable != null) {
                params.put("executable", executable);
            }
            if (arguments != null && !arguments.isEmpty()) {
                ArrayNode arr = params.putArray("arguments");
                arguments.forEach(arr::add);
            }
            if (timeoutMs != null) {
                params.put("timeout_ms", timeoutMs);
            }
            try (JobRelayRuntime runtime = parent.runtime()) {
                String id = runtime.scheduler().stage(params);
                System.out.println(Jsons.toJson(Map.of("staged_job_id", id)));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "staged", description = "List staged jobs")
    static final class StagedCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.scheduler().listStaged()));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "start", description = "Promote a staged job into the queue")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Staged job id")
        String stagedId;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                String jobId = runtime.scheduler().promote(stagedId);
                System.out.println(Jsons.toJson(Map.of("job_id", jobId, "message", "Job enqueued.")));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "jobs", description = "List staged, queued, running and recent finished jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.scheduler().list()));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "job", description = "Show one staged or queued-or-later job")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job or staged id")
        String id;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.scheduler().status(id)));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "stop", description = "Cancel a queued job or signal a running one to stop")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                JobScheduler.StopOutcome out = runtime.scheduler().stop(jobId);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "remove", description = "Remove a staged job, or a job with its log history")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job or staged id")
        String id;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("message", runtime.scheduler().remove(id), "removed_id", id)));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "rerun", description = "Stage a new run from a finished, failed or stopped job")
    static final class RerunCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                String stagedId = runtime.scheduler().rerun(jobId);
                System.out.println(Jsons.toJson(Map.of("staged_job_id", stagedId, "original_job_id", jobId)));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "logs", description = "Print a job's log history, optionally following until end of stream")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = {"--follow", "-f"}, defaultValue = "false", description = "Keep streaming new lines until the job ends")
        boolean follow;

        @Override
        public Integer call() throws Exception {
            try (JobRelayRuntime runtime = parent.runtime()) {
                if (!follow) {
                    for (LogRecord record : runtime.logs().history(jobId)) {
                        System.out.println(LogEnvelope.of(record).toJson());
                    }
                    return 0;
                }
                System.out.println(LogEnvelope.LISTENING.toJson());
                try (LogSubscription sub = runtime.logs().subscribe(jobId)) {
                    while (!sub.ended()) {
                        LogRecord record = sub.next(1, TimeUnit.SECONDS);
                        if (record != null) {
                            System.out.println(LogEnvelope.of(record).toJson());
                        }
                    }
                }
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "worker", description = "Run queued jobs")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run at most one job and exit")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity for --once")
        String workerId;

        @Option(names = {"--workers"}, description = "Worker threads; defaults to the workerCount setting")
        Integer workers;

        @Option(names = {"--idle-ms"}, defaultValue = "1000", description = "Sleep between polls of an empty queue")
        long idleMs;

        @Override
        public Integer call() throws Exception {
            JobRelayRuntime runtime = parent.runtime();
            if (once) {
                try (runtime) {
                    System.out.println(Jsons.toJson(runtime.runWorkerOnce(workerId)));
                    return 0;
                }
            }
            int count = workers == null ? runtime.settings().workerCount() : Math.max(1, workers);
            CountDownLatch stopped = new CountDownLatch(1);
            runtime.startWorkers(count, idleMs);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "jobrelay-shutdown-hook"));
            System.out.println("Worker pool running with " + count + " worker(s); press Ctrl+C to stop.");
            stopped.await();
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP API with embedded workers")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--workers"}, description = "Embedded worker threads (0 disables); defaults to the workerCount setting")
        Integer workers;

        @Override
        public Integer call() throws Exception {
            JobRelayRuntime runtime = parent.runtime();
            JobRelayHttpServer http = new JobRelayHttpServer(runtime);
            int bound = http.start(host, port);
            int count = workers == null ? runtime.settings().workerCount() : Math.max(0, workers);
            if (count > 0) {
                runtime.startWorkers(count, 1_000L);
            }
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                http.close();
                runtime.close();
            }, "jobrelay-shutdown-hook"));
            System.out.println("JobRelay API listening on http://" + host + ":" + bound + "/api, workers=" + count);
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete expired job records and log histories")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            try (JobRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.scheduler().purgeExpired()));
                return 0;
            } catch (RuntimeException e) {
                return fail(e);
            }
        }
    }
}
