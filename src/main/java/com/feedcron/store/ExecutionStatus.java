package com.feedcron.store;

/**
 * Outcome of a single job firing.
 */
public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    CANCELLED
}
