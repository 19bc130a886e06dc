package io.jobrelay.progress;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read position in a trace file plus the task hashes seen so far.
 */
public record TraceSnapshot(long offset, Set<String> submitted, Set<String> completed) {
    public static final TraceSnapshot EMPTY = new TraceSnapshot(0L, Set.of(), Set.of());

    public TraceSnapshot {
        submitted = Collections.unmodifiableSet(new LinkedHashSet<>(submitted));
        completed = Collections.unmodifiableSet(new LinkedHashSet<>(completed));
    }

    public int submittedCount() {
        return submitted.size();
    }

    public int completedCount() {
        return completed.size();
    }
}
