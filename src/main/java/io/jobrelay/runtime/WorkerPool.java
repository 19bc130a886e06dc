package io.jobrelay.runtime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads, each running at most one job at a time.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    private final JobRelayRuntime runtime;
    private final ExecutorService executor;
    private final AtomicBoolean running;
    private final long idleMs;

    WorkerPool(JobRelayRuntime runtime, int workers, long idleMs, String namePrefix) {
        this.runtime = runtime;
        this.idleMs = Math.max(10L, idleMs);
        this.running = new AtomicBoolean(true);
        AtomicInteger seq = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, namePrefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= Math.max(1, workers); i++) {
            String workerId = namePrefix + "-" + i;
            executor.submit(() -> loop(workerId));
        }
        LOG.info("Started {} worker(s)", Math.max(1, workers));
    }

    private void loop(String workerId) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                JobRelayRuntime.WorkerOutcome out = runtime.runWorkerOnce(workerId);
                if (!out.processed()) {
                    Thread.sleep(idleMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.error("Worker {} loop error", workerId, e);
                try {
                    Thread.sleep(idleMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Workers did not stop within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
