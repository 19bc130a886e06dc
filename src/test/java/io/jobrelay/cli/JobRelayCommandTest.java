package io.jobrelay.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRelayCommandTest {

    @Test
    void stageStartAndInspectThroughCommandLine() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-cli-");
        try {
            String rootArg = root.toString();
            Run staged = run("--root", rootArg, "stage", "--run-name", "cli run", "--description", "from cli");
            assertEquals(0, staged.exitCode());
            String stagedId = Jsons.readObject(staged.out()).path("staged_job_id").asText();
            assertTrue(stagedId.startsWith("staged_"));

            Run list = run("--root", rootArg, "staged");
            assertEquals(0, list.exitCode());
            assertTrue(list.out().contains("cli_run"));

            Run started = run("--root", rootArg, "start", stagedId);
            assertEquals(0, started.exitCode());
            ObjectNode startOut = Jsons.readObject(started.out());
            String jobId = startOut.path("job_id").asText();
            assertTrue(jobId.startsWith("job_"));

            Run status = run("--root", rootArg, "job", jobId);
            assertEquals(0, status.exitCode());
            assertEquals("queued", Jsons.readObject(status.out()).path("status").asText());

            Run stop = run("--root", rootArg, "stop", jobId);
            assertEquals(0, stop.exitCode());
            assertTrue(stop.out().contains("canceled"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresMapToExitCodes() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-cli-errors-");
        try {
            String rootArg = root.toString();
            Run missing = run("--root", rootArg, "job", "job_missing");
            assertEquals(4, missing.exitCode());
            assertTrue(missing.out().contains("not found"));

            Run stagedStop = run("--root", rootArg, "stop", "staged_abc");
            assertEquals(2, stagedStop.exitCode());

            Run idle = run("--root", rootArg, "worker", "--once");
            assertEquals(0, idle.exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new JobRelayCommand()).execute(args);
            return new Run(code, buffer.toString(StandardCharsets.UTF_8).trim());
        } finally {
            System.setOut(original);
        }
    }

    private record Run(int exitCode, String out) {
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
