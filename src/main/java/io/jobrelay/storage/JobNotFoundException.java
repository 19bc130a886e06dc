package io.jobrelay.storage;

public final class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job '" + jobId + "' not found.");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
