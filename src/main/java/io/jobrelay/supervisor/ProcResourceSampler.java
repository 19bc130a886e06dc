package io.jobrelay.supervisor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Memory from {@code /proc/<pid>/status}, CPU from {@link ProcessHandle.Info}. Hosts without
 * procfs report zero memory.
 */
public final class ProcResourceSampler implements ResourceSampler {
    private static final Path PROC = Paths.get("/proc");

    @Override
    public ResourceSample sample(ProcessHandle root) {
        if (root == null || !root.isAlive()) {
            return ResourceSample.NONE;
        }
        List<ProcessHandle> tree = new ArrayList<>();
        tree.add(root);
        tree.addAll(root.descendants().collect(Collectors.toList()));
        long rss = 0L;
        long cpu = 0L;
        for (ProcessHandle h : tree) {
            rss += residentBytes(h.pid());
            cpu += h.info().totalCpuDuration().map(Duration::toNanos).orElse(0L);
        }
        return new ResourceSample(rss, cpu);
    }

    static long residentBytes(long pid) {
        Path status = PROC.resolve(Long.toString(pid)).resolve("status");
        if (!Files.isReadable(status)) {
            return 0L;
        }
        try {
            for (String line : Files.readAllLines(status)) {
                if (line.startsWith("VmRSS:")) {
                    return parseKb(line.substring("VmRSS:".length())) * 1024L;
                }
            }
        } catch (IOException | RuntimeException e) {
            return 0L;
        }
        return 0L;
    }

    static long parseKb(String raw) {
        String digits = raw.trim().split("\\s+")[0];
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
