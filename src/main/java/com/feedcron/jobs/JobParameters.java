package com.feedcron.jobs;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed parameters of one job type. Each subclass renders itself to the string
 * map that travels in the Quartz job data and in the persisted definition.
 */
public abstract class JobParameters {

    public abstract JobType getJobType();

    /** Adds this job type's keys to the given map. */
    protected abstract void writeTo(Map<String, String> data);

    public Map<String, String> toJobData() {
        Map<String, String> data = new LinkedHashMap<>();
        writeTo(data);
        return data;
    }

    static int parseInt(Object value, int def) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value == null) {
            return def;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
