package io.jobrelay.supervisor;

/**
 * The entrypoint could not be started. Not retried.
 */
public final class ProcessLaunchException extends RuntimeException {
    public ProcessLaunchException(String message) {
        super(message);
    }

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
