package com.feedcron.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * In-memory store whose writes can be made to fail on demand.
 */
public class FailingJobStore implements JobStore {
    private final InMemoryJobStore delegate = new InMemoryJobStore();
    private volatile boolean failWrites;
    private volatile boolean failReads;

    public FailingJobStore failWrites(boolean fail) {
        this.failWrites = fail;
        return this;
    }

    public FailingJobStore failReads(boolean fail) {
        this.failReads = fail;
        return this;
    }

    private void checkWrite() throws JobStoreException {
        if (failWrites) {
            throw new JobStoreException("store unavailable");
        }
    }

    private void checkRead() throws JobStoreException {
        if (failReads) {
            throw new JobStoreException("store unavailable");
        }
    }

    @Override
    public Optional<JobDefinition> get(String jobKey, String jobGroup) throws JobStoreException {
        checkRead();
        return delegate.get(jobKey, jobGroup);
    }

    @Override
    public JobDefinition upsert(JobDefinition definition) throws JobStoreException {
        checkWrite();
        return delegate.upsert(definition);
    }

    @Override
    public boolean delete(String jobKey, String jobGroup) throws JobStoreException {
        checkWrite();
        return delegate.delete(jobKey, jobGroup);
    }

    @Override
    public List<JobDefinition> listAll() throws JobStoreException {
        checkRead();
        return delegate.listAll();
    }

    @Override
    public boolean updatePauseState(String jobKey, String jobGroup, boolean paused) throws JobStoreException {
        checkWrite();
        return delegate.updatePauseState(jobKey, jobGroup, paused);
    }

    @Override
    public boolean updateCronExpression(String jobKey, String jobGroup, String cronExpression)
            throws JobStoreException {
        checkWrite();
        return delegate.updateCronExpression(jobKey, jobGroup, cronExpression);
    }

    @Override
    public boolean updateLastExecution(String jobKey, String jobGroup, Instant executionTime,
                                       ExecutionStatus status) throws JobStoreException {
        checkWrite();
        return delegate.updateLastExecution(jobKey, jobGroup, executionTime, status);
    }

    @Override
    public void appendExecutionLog(ExecutionLogEntry entry) throws JobStoreException {
        checkWrite();
        delegate.appendExecutionLog(entry);
    }

    @Override
    public List<ExecutionLogEntry> queryExecutionLog(String jobKey, int limit) throws JobStoreException {
        checkRead();
        return delegate.queryExecutionLog(jobKey, limit);
    }
}
