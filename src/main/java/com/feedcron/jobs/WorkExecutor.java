package com.feedcron.jobs;

/**
 * Runs the actual work of one job type (feed ingestion, cleanup, analytics, tagging).
 * Implementations read their parameters from the context, report how many items
 * they handled and throw to signal failure.
 */
public interface WorkExecutor {
    void execute(WorkContext context) throws Exception;
}
