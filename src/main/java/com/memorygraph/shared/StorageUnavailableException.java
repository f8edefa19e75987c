package com.memorygraph.shared;

/**
 * The durable store or index could not be reached. Retryable by the caller with backoff;
 * never swallowed.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageUnavailableException(String message) {
        super(message);
    }
}
