package io.jobrelay.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.bus.ChannelHub;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.logs.LogBroadcaster;
import io.jobrelay.model.JobRecord;
import io.jobrelay.model.JobStatus;
import io.jobrelay.model.MetaKeys;
import io.jobrelay.storage.Database;
import io.jobrelay.storage.LogStore;
import io.jobrelay.supervisor.ProcessSupervisor;
import io.jobrelay.supervisor.ResourceSampler;
import io.jobrelay.supervisor.SupervisorOutcome;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JobWorkerTest {

    @Test
    void unwritableLogStoreStillFinalizesJob() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-worker-nolog-");
        Path brokenRoot = Files.createTempDirectory("jobrelay-worker-nolog-store-");
        try (JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()))) {
            runtime.init();
            ObjectNode params = Jsons.newObject();
            params.put("executable", root.resolve("never-started.sh").toString());
            String jobId = runtime.scheduler().promote(runtime.scheduler().stage(params));
            JobRecord claimed = runtime.jobs().claimNext("w1", System.currentTimeMillis()).orElseThrow();

            // schema never created, so every append fails
            LogStore brokenStore = new LogStore(new Database(JobRelayConfig.fromRoot(brokenRoot.toString())));
            LogBroadcaster brokenLogs = new LogBroadcaster(brokenStore, new ChannelHub(), 16, 60L, 60L);
            JobWorker worker = new JobWorker(runtime.jobs(), brokenLogs, runtime.notifications(),
                    new ProcessSupervisor(runtime.settings().supervisorTimings(), handle -> ResourceSampler.ResourceSample.NONE),
                    runtime.settings());

            SupervisorOutcome outcome = worker.execute(claimed);

            Assertions.assertEquals(SupervisorOutcome.Result.FAILED, outcome.result());
            Assertions.assertEquals(SupervisorOutcome.KIND_INTERNAL, outcome.errorKind());
            JobRecord job = runtime.jobs().find(jobId).orElseThrow();
            Assertions.assertEquals(JobStatus.FAILED, job.status());
            Assertions.assertEquals(List.of("failed"), runtime.jobs().registriesOf(jobId));
            Assertions.assertEquals(SupervisorOutcome.KIND_INTERNAL, job.metaText(MetaKeys.ERROR_KIND));
        } finally {
            deleteRecursively(root);
            deleteRecursively(brokenRoot);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
