package io.jobrelay.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.jobrelay.bus.Subscription;
import io.jobrelay.logs.LogEnvelope;
import io.jobrelay.logs.LogSubscription;
import io.jobrelay.model.LogRecord;
import io.jobrelay.model.StagedJob;
import io.jobrelay.runtime.JobRelayRuntime;
import io.jobrelay.runtime.JobScheduler;
import io.jobrelay.storage.JobLockedException;
import io.jobrelay.storage.JobNotFoundException;
import io.jobrelay.storage.StorageUnavailableException;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * JSON API over the scheduler plus server-sent event streams for job logs and notifications.
 */
public final class JobRelayHttpServer implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(JobRelayHttpServer.class);
    private static final long STREAM_POLL_MS = 1_000L;
    private static final long KEEPALIVE_MS = 15_000L;

    private final JobRelayRuntime runtime;
    private final JobScheduler scheduler;
    private HttpServer server;
    private ExecutorService executor;

    public JobRelayHttpServer(JobRelayRuntime runtime) {
        this.runtime = runtime;
        this.scheduler = runtime.scheduler();
    }

    public synchronized int start(String host, int port) throws IOException {
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/api/stage", exchange -> handle(exchange, () -> {
            requireMethod(exchange, "POST");
            ObjectNode params = Jsons.readObject(readBody(exchange));
            String id = scheduler.stage(params);
            writeJson(exchange, Map.of("message", "Job staged.", "staged_job_id", id), 200);
        }));
        server.createContext("/api/staged", exchange -> handle(exchange, () -> {
            requireMethod(exchange, "GET");
            writeJson(exchange, scheduler.listStaged(), 200);
        }));
        server.createContext("/api/notifications", exchange -> handle(exchange, () -> {
            requireMethod(exchange, "GET");
            streamNotifications(exchange);
        }));
        server.createContext("/api/jobs", exchange -> handle(exchange, () -> routeJobs(exchange)));
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jobrelay-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        int bound = server.getAddress().getPort();
        LOG.info("HTTP API listening on http://{}:{}/api", host, bound);
        return bound;
    }

    private void routeJobs(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > "/api/jobs".length() ? path.substring("/api/jobs".length() + 1) : "";
        String method = exchange.getRequestMethod();
        if (rest.isEmpty()) {
            requireMethod(exchange, "GET");
            writeJson(exchange, scheduler.list(), 200);
            return;
        }
        String[] parts = rest.split("/");
        String id = parts[0];
        String action = parts.length > 1 ? parts[1] : "";
        switch (action) {
            case "" -> {
                if ("DELETE".equals(method)) {
                    writeJson(exchange, Map.of("message", scheduler.remove(id), "removed_id", id), 200);
                } else {
                    requireMethod(exchange, "GET");
                    writeJson(exchange, scheduler.status(id), 200);
                }
            }
            case "start" -> {
                requireMethod(exchange, "POST");
                String jobId = scheduler.promote(id);
                writeJson(exchange, Map.of("message", "Job enqueued.", "job_id", jobId), 200);
            }
            case "stop" -> {
                requireMethod(exchange, "POST");
                JobScheduler.StopOutcome out = scheduler.stop(id);
                writeJson(exchange, Map.of("message", out.message(), "job_id", out.jobId()), 200);
            }
            case "rerun" -> {
                requireMethod(exchange, "POST");
                String stagedId = scheduler.rerun(id);
                writeJson(exchange, Map.of("message", "Job re-staged.", "staged_job_id", stagedId), 200);
            }
            case "logs" -> {
                requireMethod(exchange, "GET");
                streamLogs(exchange, id);
            }
            default -> writeJson(exchange, Map.of("detail", "Not found"), 404);
        }
    }

    private void streamLogs(HttpExchange exchange, String jobId) throws IOException {
        if (StagedJob.isStagedId(jobId)) {
            throw new IllegalArgumentException("Staged jobs have no logs yet.");
        }
        if (!runtime.jobs().exists(jobId) && runtime.logs().history(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        try (LogSubscription sub = runtime.logs().subscribe(jobId)) {
            openEventStream(exchange);
            try (OutputStream os = exchange.getResponseBody()) {
                writeEvent(os, "log", null, LogEnvelope.LISTENING.toJson());
                long lastWrite = System.currentTimeMillis();
                while (!sub.ended()) {
                    LogRecord record = sub.next(STREAM_POLL_MS, TimeUnit.MILLISECONDS);
                    if (record != null) {
                        writeEvent(os, "log", Long.toString(record.seq()), LogEnvelope.of(record).toJson());
                        lastWrite = System.currentTimeMillis();
                    } else if (System.currentTimeMillis() - lastWrite >= KEEPALIVE_MS) {
                        os.write(": keepalive\n\n".getBytes(StandardCharsets.UTF_8));
                        os.flush();
                        lastWrite = System.currentTimeMillis();
                    }
                }
            } catch (IOException e) {
                LOG.debug("Log stream client for job {} went away: {}", jobId, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void streamNotifications(HttpExchange exchange) throws IOException {
        try (Subscription sub = runtime.notifications().subscribe()) {
            openEventStream(exchange);
            try (OutputStream os = exchange.getResponseBody()) {
                while (!Thread.currentThread().isInterrupted()) {
                    String message = sub.poll(KEEPALIVE_MS, TimeUnit.MILLISECONDS);
                    if (message == null) {
                        os.write(": keepalive\n\n".getBytes(StandardCharsets.UTF_8));
                        os.flush();
                    } else {
                        writeEvent(os, "notification", null, message);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Notification client went away: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void openEventStream(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.sendResponseHeaders(200, 0);
    }

    private static void writeEvent(OutputStream os, String event, String id, String data) throws IOException {
        StringBuilder frame = new StringBuilder();
        frame.append("event: ").append(event).append('\n');
        if (id != null) {
            frame.append("id: ").append(id).append('\n');
        }
        frame.append("data: ").append(data.replace("\r", " ").replace("\n", " ")).append("\n\n");
        os.write(frame.toString().getBytes(StandardCharsets.UTF_8));
        os.flush();
    }

    @FunctionalInterface
    private interface Handler {
        void run() throws IOException;
    }

    private static void handle(HttpExchange exchange, Handler handler) throws IOException {
        try {
            handler.run();
        } catch (MethodNotAllowed e) {
            writeError(exchange, e.getMessage(), 405);
        } catch (JobNotFoundException e) {
            writeError(exchange, e.getMessage(), 404);
        } catch (JobLockedException e) {
            writeError(exchange, e.getMessage(), 409);
        } catch (StorageUnavailableException e) {
            LOG.error("Storage error on {}: {}", exchange.getRequestURI(), e.getMessage());
            writeError(exchange, "Service unavailable: Storage error.", 503);
        } catch (IllegalArgumentException e) {
            writeError(exchange, e.getMessage(), 400);
        } catch (IllegalStateException e) {
            writeError(exchange, e.getMessage(), 409);
        } catch (RuntimeException e) {
            LOG.error("Unhandled error on {}", exchange.getRequestURI(), e);
            writeError(exchange, "Internal server error.", 500);
        } finally {
            exchange.close();
        }
    }

    private static void writeError(HttpExchange exchange, String detail, int status) throws IOException {
        if (exchange.getResponseCode() != -1) {
            LOG.warn("Response already started on {}, dropping {} error: {}", exchange.getRequestURI(), status, detail);
            return;
        }
        writeJson(exchange, error(detail), status);
    }

    private static Map<String, Object> error(String detail) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("detail", detail);
        return out;
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new MethodNotAllowed(method + " required");
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed(String message) {
            super(message);
        }
    }
}
