package com.feedcron.jobs;

import org.quartz.Job;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.spi.JobFactory;
import org.quartz.spi.TriggerFiredBundle;

/**
 * Quartz job factory that binds each job instance to the executor registered for
 * its type. Job classes that belong to no {@link JobType} are created through
 * their no-arg constructor, as Quartz itself would.
 */
public class ExecutorJobFactory implements JobFactory {
    private final WorkExecutorRegistry registry;

    public ExecutorJobFactory(WorkExecutorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Job newJob(TriggerFiredBundle bundle, Scheduler scheduler) throws SchedulerException {
        Class<? extends Job> jobClass = bundle.getJobDetail().getJobClass();
        JobType type = JobType.forJobClass(jobClass);
        if (type == null) {
            try {
                return jobClass.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new SchedulerException("Cannot instantiate job class " + jobClass.getName(), e);
            }
        }
        WorkExecutor executor = registry.get(type);
        if (executor == null) {
            throw new SchedulerException("No work executor registered for " + type.getTypeName());
        }
        return type.newJob(executor);
    }
}
