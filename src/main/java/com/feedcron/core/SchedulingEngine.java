package com.feedcron.core;

import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.TriggerListener;

import java.util.Date;
import java.util.List;
import java.util.Set;

/**
 * The live, in-memory scheduler: owns trigger state, computes next fire times and
 * dispatches due jobs. Everything durable sits on top of it in the job store.
 */
public interface SchedulingEngine {
    void start() throws SchedulerException;

    boolean isStarted() throws SchedulerException;

    /** Stops dispatching; optionally waits for running jobs to finish. */
    void shutdown(boolean waitForJobsToComplete) throws SchedulerException;

    /** Raise the cancellation signal on every running job. Returns how many were signalled. */
    int interruptRunningJobs() throws SchedulerException;

    void addJobListener(JobListener listener) throws SchedulerException;

    void addTriggerListener(TriggerListener listener) throws SchedulerException;

    void scheduleJob(JobDetail job, Trigger trigger) throws SchedulerException;

    /** Schedule a trigger for a job that is already registered. */
    void scheduleTrigger(Trigger trigger) throws SchedulerException;

    /** Store a job without scheduling it; {@code replace} overwrites an existing job. */
    void addJob(JobDetail job, boolean replace) throws SchedulerException;

    /** Remove a job and all of its triggers. */
    boolean deleteJob(JobKey key) throws SchedulerException;

    boolean checkExists(JobKey key) throws SchedulerException;

    boolean checkExists(TriggerKey key) throws SchedulerException;

    JobDetail getJobDetail(JobKey key) throws SchedulerException;

    List<? extends Trigger> getTriggersOfJob(JobKey key) throws SchedulerException;

    Trigger.TriggerState getTriggerState(TriggerKey key) throws SchedulerException;

    void pauseTrigger(TriggerKey key) throws SchedulerException;

    void resumeTrigger(TriggerKey key) throws SchedulerException;

    /** Fire the job once, now, without touching its triggers. */
    void triggerJob(JobKey key) throws SchedulerException;

    /** Swap a trigger for a new one. Returns the new first fire time, or null if the old trigger was not found. */
    Date rescheduleJob(TriggerKey key, Trigger newTrigger) throws SchedulerException;

    List<String> getJobGroupNames() throws SchedulerException;

    Set<JobKey> getJobKeys(String group) throws SchedulerException;
}
