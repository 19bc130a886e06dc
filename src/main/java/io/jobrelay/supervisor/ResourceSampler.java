package io.jobrelay.supervisor;

/**
 * Reads resident memory and accumulated CPU time for a process and its descendants.
 */
public interface ResourceSampler {
    ResourceSample sample(ProcessHandle root);

    record ResourceSample(long residentBytes, long cpuNanos) {
        public static final ResourceSample NONE = new ResourceSample(0L, 0L);
    }
}
