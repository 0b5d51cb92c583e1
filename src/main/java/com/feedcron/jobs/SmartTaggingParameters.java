package com.feedcron.jobs;

import java.util.Map;

public final class SmartTaggingParameters extends JobParameters {
    public static final String BATCH_SIZE_KEY = "BatchSize";
    public static final int DEFAULT_BATCH_SIZE = 10;

    private final int batchSize;

    public SmartTaggingParameters(int batchSize) {
        this.batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    }

    @Override
    public JobType getJobType() {
        return JobType.SMART_TAGGING;
    }

    @Override
    protected void writeTo(Map<String, String> data) {
        data.put(BATCH_SIZE_KEY, String.valueOf(batchSize));
    }

    public int getBatchSize() {
        return batchSize;
    }
}
