package com.feedcron.jobs;

import java.util.Map;

/**
 * The analytics job takes no parameters.
 */
public final class AnalyticsParameters extends JobParameters {
    @Override
    public JobType getJobType() {
        return JobType.ANALYTICS;
    }

    @Override
    protected void writeTo(Map<String, String> data) {
    }
}
