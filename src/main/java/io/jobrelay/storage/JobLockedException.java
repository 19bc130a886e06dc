package io.jobrelay.storage;

/**
 * A removal raced an in-flight worker update of the same job record.
 */
public final class JobLockedException extends RuntimeException {
    public JobLockedException(String jobId) {
        super("Job '" + jobId + "' is locked by an in-flight update, retry later.");
    }

    public JobLockedException(String jobId, Throwable cause) {
        super("Job '" + jobId + "' is locked by an in-flight update, retry later.", cause);
    }
}
