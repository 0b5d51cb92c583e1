package com.feedcron.core;

import org.quartz.InterruptableJob;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.TriggerListener;
import org.quartz.impl.matchers.EverythingMatcher;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.List;
import java.util.Set;

/**
 * SchedulingEngine backed by a Quartz {@link Scheduler}.
 */
public class QuartzSchedulingEngine implements SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(QuartzSchedulingEngine.class);

    private final Scheduler scheduler;

    public QuartzSchedulingEngine(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() throws SchedulerException {
        scheduler.start();
        log.info("Scheduler {} started", scheduler.getSchedulerName());
    }

    @Override
    public boolean isStarted() throws SchedulerException {
        return scheduler.isStarted() && !scheduler.isShutdown() && !scheduler.isInStandbyMode();
    }

    @Override
    public void shutdown(boolean waitForJobsToComplete) throws SchedulerException {
        if (scheduler.isShutdown()) {
            return;
        }
        log.info("Shutting down scheduler {} (waitForJobsToComplete={})",
                scheduler.getSchedulerName(), waitForJobsToComplete);
        scheduler.shutdown(waitForJobsToComplete);
    }

    @Override
    public int interruptRunningJobs() throws SchedulerException {
        int count = 0;
        for (JobExecutionContext running : scheduler.getCurrentlyExecutingJobs()) {
            if (running.getJobInstance() instanceof InterruptableJob
                    && scheduler.interrupt(running.getFireInstanceId())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void addJobListener(JobListener listener) throws SchedulerException {
        scheduler.getListenerManager().addJobListener(listener, EverythingMatcher.allJobs());
    }

    @Override
    public void addTriggerListener(TriggerListener listener) throws SchedulerException {
        scheduler.getListenerManager().addTriggerListener(listener, EverythingMatcher.allTriggers());
    }

    @Override
    public void scheduleJob(JobDetail job, Trigger trigger) throws SchedulerException {
        scheduler.scheduleJob(job, trigger);
    }

    @Override
    public void scheduleTrigger(Trigger trigger) throws SchedulerException {
        scheduler.scheduleJob(trigger);
    }

    @Override
    public void addJob(JobDetail job, boolean replace) throws SchedulerException {
        scheduler.addJob(job, replace);
    }

    @Override
    public boolean deleteJob(JobKey key) throws SchedulerException {
        return scheduler.deleteJob(key);
    }

    @Override
    public boolean checkExists(JobKey key) throws SchedulerException {
        return scheduler.checkExists(key);
    }

    @Override
    public boolean checkExists(TriggerKey key) throws SchedulerException {
        return scheduler.checkExists(key);
    }

    @Override
    public JobDetail getJobDetail(JobKey key) throws SchedulerException {
        return scheduler.getJobDetail(key);
    }

    @Override
    public List<? extends Trigger> getTriggersOfJob(JobKey key) throws SchedulerException {
        return scheduler.getTriggersOfJob(key);
    }

    @Override
    public Trigger.TriggerState getTriggerState(TriggerKey key) throws SchedulerException {
        return scheduler.getTriggerState(key);
    }

    @Override
    public void pauseTrigger(TriggerKey key) throws SchedulerException {
        scheduler.pauseTrigger(key);
    }

    @Override
    public void resumeTrigger(TriggerKey key) throws SchedulerException {
        scheduler.resumeTrigger(key);
    }

    @Override
    public void triggerJob(JobKey key) throws SchedulerException {
        scheduler.triggerJob(key);
    }

    @Override
    public Date rescheduleJob(TriggerKey key, Trigger newTrigger) throws SchedulerException {
        return scheduler.rescheduleJob(key, newTrigger);
    }

    @Override
    public List<String> getJobGroupNames() throws SchedulerException {
        return scheduler.getJobGroupNames();
    }

    @Override
    public Set<JobKey> getJobKeys(String group) throws SchedulerException {
        return scheduler.getJobKeys(GroupMatcher.jobGroupEquals(group));
    }
}
