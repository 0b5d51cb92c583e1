package com.feedcron.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable persistence for job definitions and their execution log.
 * Definitions are keyed by (jobKey, jobGroup); every write touches a single key.
 */
public interface JobStore {
    /** Load the definition stored for the given key, if any. */
    Optional<JobDefinition> get(String jobKey, String jobGroup) throws JobStoreException;

    /**
     * Insert the definition, or replace the one stored under the same key.
     * A replaced definition keeps its stored id and creation time.
     *
     * @return the definition as stored
     */
    JobDefinition upsert(JobDefinition definition) throws JobStoreException;

    /** Remove a definition. Returns false if nothing was stored under the key. */
    boolean delete(String jobKey, String jobGroup) throws JobStoreException;

    /** Load every persisted definition. */
    List<JobDefinition> listAll() throws JobStoreException;

    /** Update only the paused flag. Returns false if no definition exists. */
    boolean updatePauseState(String jobKey, String jobGroup, boolean paused) throws JobStoreException;

    /** Update only the cron expression. Returns false if no definition exists. */
    boolean updateCronExpression(String jobKey, String jobGroup, String cronExpression) throws JobStoreException;

    /** Update only the last execution summary. Returns false if no definition exists. */
    boolean updateLastExecution(String jobKey, String jobGroup, Instant executionTime,
                                ExecutionStatus status) throws JobStoreException;

    /** Append one execution log entry. */
    void appendExecutionLog(ExecutionLogEntry entry) throws JobStoreException;

    /** Most recent entries first, at most {@code limit} of them. */
    List<ExecutionLogEntry> queryExecutionLog(String jobKey, int limit) throws JobStoreException;
}
