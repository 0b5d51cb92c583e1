package com.feedcron.jobs;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What a {@link WorkExecutor} sees of a firing: the job identity, its parameters,
 * a counter for processed items and the cooperative cancellation flag.
 */
public class WorkContext {
    private final String jobKey;
    private final String jobGroup;
    private final Map<String, String> data;
    private final AtomicBoolean cancelled;
    private volatile int itemsProcessed;

    public WorkContext(String jobKey, String jobGroup, Map<String, String> data, AtomicBoolean cancelled) {
        this.jobKey = jobKey;
        this.jobGroup = jobGroup;
        this.data = Collections.unmodifiableMap(data);
        this.cancelled = cancelled;
    }

    public String getJobKey() {
        return jobKey;
    }

    public String getJobGroup() {
        return jobGroup;
    }

    public Map<String, String> getData() {
        return data;
    }

    public String getString(String key) {
        return data.get(key);
    }

    /** Returns the value as an int, or {@code def} when absent or not a number. */
    public int getInt(String key, int def) {
        return JobParameters.parseInt(data.get(key), def);
    }

    public int getItemsProcessed() {
        return itemsProcessed;
    }

    public void setItemsProcessed(int itemsProcessed) {
        this.itemsProcessed = itemsProcessed;
    }

    /**
     * True once shutdown (or an operator) asked the running job to stop. Executors
     * check this between units of work and return early, leaving the processed
     * count at whatever was reached.
     */
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
