package io.jobrelay.storage;

/**
 * The backing store could not be reached or refused the operation. Surfaced to callers
 * as service-unavailable; never swallowed.
 */
public final class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
