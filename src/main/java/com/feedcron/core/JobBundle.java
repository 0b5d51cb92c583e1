package com.feedcron.core;

import com.feedcron.store.JobDefinition;
import org.quartz.JobDetail;
import org.quartz.Trigger;

/**
 * A job ready to register: the engine job, its cron trigger and the definition
 * that will be persisted for it.
 */
public final class JobBundle {
    private final JobDetail jobDetail;
    private final Trigger trigger;
    private final JobDefinition definition;

    public JobBundle(JobDetail jobDetail, Trigger trigger, JobDefinition definition) {
        this.jobDetail = jobDetail;
        this.trigger = trigger;
        this.definition = definition;
    }

    public JobDetail getJobDetail() { return jobDetail; }
    public Trigger getTrigger() { return trigger; }
    public JobDefinition getDefinition() { return definition; }
}
