package com.feedcron.store;

/**
 * Raised when the durable job store cannot be read or written.
 */
public class JobStoreException extends Exception {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
