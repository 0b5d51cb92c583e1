package com.feedcron.jobs;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each job type to the executor that runs it.
 */
public class WorkExecutorRegistry {
    private final Map<JobType, WorkExecutor> executors = new EnumMap<>(JobType.class);

    public synchronized WorkExecutorRegistry register(JobType type, WorkExecutor executor) {
        if (type == null || executor == null) {
            throw new IllegalArgumentException("Job type and executor required");
        }
        executors.put(type, executor);
        return this;
    }

    public synchronized WorkExecutor get(JobType type) {
        return executors.get(type);
    }

    public synchronized boolean supports(JobType type) {
        return type != null && executors.containsKey(type);
    }
}
