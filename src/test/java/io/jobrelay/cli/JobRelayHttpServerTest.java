package io.jobrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.LogKind;
import io.jobrelay.runtime.JobRelayRuntime;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class JobRelayHttpServerTest {

    @Test
    void stageStartStreamAndRemove() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-http-");
        try (JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()));
             JobRelayHttpServer server = new JobRelayHttpServer(runtime)) {
            runtime.init();
            int port = server.start("127.0.0.1", 0);
            String base = "http://127.0.0.1:" + port;
            HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

            HttpResponse<String> staged = send(client, HttpRequest.newBuilder(URI.create(base + "/api/stage"))
                    .POST(HttpRequest.BodyPublishers.ofString("{\"run_name\":\"http_run\"}")));
            Assertions.assertEquals(200, staged.statusCode());
            String stagedId = Jsons.readObject(staged.body()).path("staged_job_id").asText();
            Assertions.assertTrue(stagedId.startsWith("staged_"));

            HttpResponse<String> list = send(client, HttpRequest.newBuilder(URI.create(base + "/api/staged")).GET());
            JsonNode stagedList = Jsons.mapper().readTree(list.body());
            Assertions.assertEquals(1, stagedList.size());
            Assertions.assertEquals("http_run", stagedList.get(0).path("run_name").asText());
            Assertions.assertEquals("staged", stagedList.get(0).path("status").asText());

            HttpResponse<String> stagedLogs = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + stagedId + "/logs")).GET());
            Assertions.assertEquals(400, stagedLogs.statusCode());

            HttpResponse<String> started = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + stagedId + "/start"))
                    .POST(HttpRequest.BodyPublishers.noBody()));
            Assertions.assertEquals(200, started.statusCode());
            String jobId = Jsons.readObject(started.body()).path("job_id").asText();

            runtime.logs().publish(jobId, LogKind.STDOUT, "hello from pipeline");
            runtime.logs().publishEnd(jobId);
            HttpResponse<String> logs = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + jobId + "/logs")).GET());
            Assertions.assertEquals(200, logs.statusCode());
            Assertions.assertTrue(logs.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
            String body = logs.body();
            Assertions.assertTrue(body.contains("Listening for logs..."));
            Assertions.assertTrue(body.contains("hello from pipeline"));
            Assertions.assertTrue(body.contains("id: 2\n"));
            Assertions.assertTrue(body.indexOf("hello from pipeline") < body.indexOf("\"EOF\""));

            HttpResponse<String> status = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + jobId)).GET());
            ObjectNode view = Jsons.readObject(status.body());
            Assertions.assertEquals("queued", view.path("status").asText());
            Assertions.assertEquals(jobId, view.path("job_id").asText());

            HttpResponse<String> removed = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + jobId)).DELETE());
            Assertions.assertEquals(200, removed.statusCode());
            Assertions.assertEquals(jobId, Jsons.readObject(removed.body()).path("removed_id").asText());

            HttpResponse<String> gone = send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/" + jobId)).GET());
            Assertions.assertEquals(404, gone.statusCode());
            Assertions.assertEquals("Job '" + jobId + "' not found.", Jsons.readObject(gone.body()).path("detail").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void errorMapping() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-http-errors-");
        try (JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()));
             JobRelayHttpServer server = new JobRelayHttpServer(runtime)) {
            runtime.init();
            int port = server.start("127.0.0.1", 0);
            String base = "http://127.0.0.1:" + port;
            HttpClient client = HttpClient.newHttpClient();

            Assertions.assertEquals(405, send(client, HttpRequest.newBuilder(URI.create(base + "/api/stage")).GET()).statusCode());
            Assertions.assertEquals(400, send(client, HttpRequest.newBuilder(URI.create(base + "/api/stage"))
                    .POST(HttpRequest.BodyPublishers.ofString("not json"))).statusCode());
            Assertions.assertEquals(404, send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/job_unknown/logs")).GET()).statusCode());
            Assertions.assertEquals(400, send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/staged_x/stop"))
                    .POST(HttpRequest.BodyPublishers.noBody())).statusCode());
            Assertions.assertEquals(404, send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs/staged_missing/start"))
                    .POST(HttpRequest.BodyPublishers.noBody())).statusCode());
            Assertions.assertEquals(200, send(client, HttpRequest.newBuilder(URI.create(base + "/api/jobs")).GET()).statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static HttpResponse<String> send(HttpClient client, HttpRequest.Builder request) throws Exception {
        return client.send(request.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
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
