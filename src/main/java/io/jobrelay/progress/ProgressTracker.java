package io.jobrelay.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Incremental reader for the tab-separated trace file a pipeline writes while it runs.
 * Field 1 is the task hash and field 4 the task status.
 */
public final class ProgressTracker {
    private static final Logger LOG = LogManager.getLogger(ProgressTracker.class);
    private static final String HEADER_PREFIX = "task_id\t";
    private static final String COMPLETED = "COMPLETED";
    private static final Set<String> PLACEHOLDER_HASHES = Set.of("-", "null", "n/a");
    private static final int HASH_FIELD = 1;
    private static final int STATUS_FIELD = 4;

    private ProgressTracker() {
    }

    public static TraceSnapshot parse(Path path, TraceSnapshot previous) {
        return parse(path, previous.offset(), previous.submitted(), previous.completed());
    }

    /**
     * Reads bytes past {@code lastOffset} up to the last complete line. A missing file or
     * one shorter than {@code lastOffset} leaves the inputs unchanged.
     */
    public static TraceSnapshot parse(Path path, long lastOffset, Set<String> submitted, Set<String> completed) {
        TraceSnapshot unchanged = new TraceSnapshot(lastOffset, submitted, completed);
        if (path == null || !Files.isRegularFile(path)) {
            return unchanged;
        }
        byte[] chunk;
        try (SeekableByteChannel ch = Files.newByteChannel(path, StandardOpenOption.READ)) {
            long size = ch.size();
            if (size <= lastOffset) {
                return unchanged;
            }
            long available = size - lastOffset;
            if (available > Integer.MAX_VALUE) {
                available = Integer.MAX_VALUE;
            }
            ByteBuffer buf = ByteBuffer.allocate((int) available);
            ch.position(lastOffset);
            while (buf.hasRemaining()) {
                if (ch.read(buf) < 0) {
                    break;
                }
            }
            chunk = new byte[buf.position()];
            buf.flip();
            buf.get(chunk);
        } catch (IOException e) {
            LOG.warn("Could not read trace file {}: {}", path, e.getMessage());
            return unchanged;
        }

        int end = lastNewline(chunk);
        if (end < 0) {
            return unchanged;
        }
        Set<String> nextSubmitted = new LinkedHashSet<>(submitted);
        Set<String> nextCompleted = new LinkedHashSet<>(completed);
        String text = new String(chunk, 0, end + 1, StandardCharsets.UTF_8);
        for (String rawLine : text.split("\n")) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (line.isBlank() || line.startsWith(HEADER_PREFIX)) {
                continue;
            }
            String[] fields = line.split("\t", -1);
            if (fields.length <= HASH_FIELD) {
                continue;
            }
            String hash = fields[HASH_FIELD].trim();
            if (hash.isEmpty() || PLACEHOLDER_HASHES.contains(hash.toLowerCase(Locale.ROOT))) {
                continue;
            }
            nextSubmitted.add(hash);
            if (fields.length > STATUS_FIELD
                    && COMPLETED.equals(fields[STATUS_FIELD].trim().toUpperCase(Locale.ROOT))) {
                nextCompleted.add(hash);
            }
        }
        return new TraceSnapshot(lastOffset + end + 1, nextSubmitted, nextCompleted);
    }

    private static int lastNewline(byte[] chunk) {
        for (int i = chunk.length - 1; i >= 0; i--) {
            if (chunk[i] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
