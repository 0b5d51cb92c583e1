package com.feedcron.core;

import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.Trigger;
import org.quartz.TriggerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vetoes a firing of a {@link DisallowConcurrentExecution} job while another
 * firing of the same job is still running. The vetoed firing is dropped, not queued.
 * <p>
 * Register it as the first job listener as well as a trigger listener. Quartz skips
 * {@code triggerComplete} when a job listener throws after the run, so the running
 * entry is also released from {@link #jobWasExecuted}, which then runs before any other
 * listener can fail.
 */
public class ConcurrentExecutionGuard implements TriggerListener, JobListener {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentExecutionGuard.class);

    /** Running job -> fire instance that owns it. */
    private final Map<JobKey, String> running = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "ConcurrentExecutionGuard";
    }

    @Override
    public void triggerFired(Trigger trigger, JobExecutionContext context) {
    }

    @Override
    public boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
        if (!context.getJobDetail().getJobClass().isAnnotationPresent(DisallowConcurrentExecution.class)) {
            return false;
        }
        JobKey key = context.getJobDetail().getKey();
        String owner = running.putIfAbsent(key, context.getFireInstanceId());
        if (owner != null) {
            log.warn("Job {} is still running (fire {}), vetoing firing of trigger {}",
                    key, owner, trigger.getKey());
            return true;
        }
        return false;
    }

    @Override
    public void triggerMisfired(Trigger trigger) {
    }

    @Override
    public void triggerComplete(Trigger trigger, JobExecutionContext context,
                                Trigger.CompletedExecutionInstruction triggerInstructionCode) {
        release(context);
    }

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        release(context);
    }

    private void release(JobExecutionContext context) {
        running.remove(context.getJobDetail().getKey(), context.getFireInstanceId());
    }

    boolean isRunning(JobKey key) {
        return running.containsKey(key);
    }
}
