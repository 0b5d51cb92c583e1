package com.feedcron.core;

import com.feedcron.store.MisfirePolicy;
import org.quartz.CronExpression;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;

import java.util.Date;
import java.util.List;

/**
 * Builds the triggers jobs run on: one recurring cron trigger per job, plus
 * one-shot retry triggers.
 */
public final class JobTriggers {
    static final String TRIGGER_SUFFIX = "-trigger";
    static final String RETRY_INFIX = "-retry-";

    private JobTriggers() {}

    /** Key of the recurring trigger owned by a job. */
    public static TriggerKey cronTriggerKey(JobKey jobKey) {
        return new TriggerKey(jobKey.getName() + TRIGGER_SUFFIX, jobKey.getGroup());
    }

    public static boolean isValidCron(String cron) {
        return cron != null && CronExpression.isValidExpression(cron);
    }

    /**
     * @throws IllegalArgumentException if the expression does not parse
     */
    public static void validateCron(String cron) {
        if (!isValidCron(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }
    }

    public static CronTrigger cronTrigger(JobKey jobKey, String cron, MisfirePolicy policy) {
        validateCron(cron);
        CronScheduleBuilder schedule = CronScheduleBuilder.cronSchedule(cron);
        switch (policy == null ? MisfirePolicy.FIRE_NOW : policy) {
            case DO_NOTHING:
                schedule = schedule.withMisfireHandlingInstructionDoNothing();
                break;
            case RESCHEDULE_IGNORING_MISFIRES:
                schedule = schedule.withMisfireHandlingInstructionIgnoreMisfires();
                break;
            case FIRE_NOW:
            default:
                schedule = schedule.withMisfireHandlingInstructionFireAndProceed();
                break;
        }
        return TriggerBuilder.newTrigger()
                .withIdentity(cronTriggerKey(jobKey))
                .forJob(jobKey)
                .withSchedule(schedule)
                .build();
    }

    /** One-shot trigger firing {@code jobKey} at {@code startAt} with the given data. */
    public static SimpleTrigger retryTrigger(JobKey jobKey, int attempt, Date startAt, JobDataMap data) {
        return TriggerBuilder.newTrigger()
                .withIdentity(jobKey.getName() + RETRY_INFIX + attempt, jobKey.getGroup())
                .forJob(jobKey)
                .usingJobData(data)
                .startAt(startAt)
                .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                        .withMisfireHandlingInstructionFireNow())
                .build();
    }

    /** The recurring trigger among a job's triggers, or null when it has none. */
    public static CronTrigger findCronTrigger(List<? extends Trigger> triggers) {
        for (Trigger t : triggers) {
            if (t instanceof CronTrigger) {
                return (CronTrigger) t;
            }
        }
        return null;
    }
}
