package com.feedcron.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Scheduler settings. Each key is looked up as a system property, then an
 * environment variable, then in the properties file, then falls back to its default.
 */
public final class SchedulerConfig {
    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    public static final String DEFAULT_PROPERTIES_FILE = "feedcron.properties";

    private final Properties fileProps;

    private final String schedulerName;
    private final int threadCount;
    private final long misfireThresholdMillis;
    private final boolean waitForJobsOnShutdown;
    private final boolean interruptJobsOnShutdown;
    private final int metricsPort;
    private final String cleanupCron;
    private final int retentionDays;
    private final String analyticsCron;
    private final String smartTaggingCron;
    private final int smartTaggingBatchSize;
    private final boolean maintenanceJobsEnabled;

    private SchedulerConfig(Properties fileProps) {
        this.fileProps = fileProps;
        this.schedulerName = get("SCHEDULER_NAME", "feedcron");
        this.threadCount = getInt("SCHEDULER_THREAD_COUNT", 10);
        this.misfireThresholdMillis = getInt("MISFIRE_THRESHOLD_MS", 60000);
        this.waitForJobsOnShutdown = Boolean.parseBoolean(get("WAIT_FOR_JOBS_ON_SHUTDOWN", "true"));
        this.interruptJobsOnShutdown = Boolean.parseBoolean(get("INTERRUPT_JOBS_ON_SHUTDOWN", "true"));
        this.metricsPort = getInt("METRICS_PORT", -1);
        this.cleanupCron = get("CLEANUP_CRON", "0 0 3 * * ?");
        this.retentionDays = getInt("RETENTION_DAYS", 30);
        this.analyticsCron = get("ANALYTICS_CRON", "0 5 0 * * ?");
        this.smartTaggingCron = get("SMART_TAGGING_CRON", "0 */30 * * * ?");
        this.smartTaggingBatchSize = getInt("SMART_TAGGING_BATCH_SIZE", 10);
        this.maintenanceJobsEnabled = Boolean.parseBoolean(get("MAINTENANCE_JOBS_ENABLED", "true"));
    }

    /** Loads from the default properties file location. */
    public static SchedulerConfig load() {
        return load(getDefaultPath());
    }

    /** Loads using the given properties file; a missing file is treated as empty. */
    public static SchedulerConfig load(Path propsPath) {
        Properties p = new Properties();
        if (Files.exists(propsPath)) {
            try (InputStream in = Files.newInputStream(propsPath)) {
                p.load(in);
            } catch (IOException e) {
                log.warn("Could not read {}, using defaults", propsPath, e);
            }
        }
        return new SchedulerConfig(p);
    }

    /** Uses the given properties in place of the properties file. */
    public static SchedulerConfig fromProperties(Properties props) {
        Properties copy = new Properties();
        copy.putAll(props);
        return new SchedulerConfig(copy);
    }

    static Path getDefaultPath() {
        String p = System.getProperty("feedcron.properties");
        if (p == null || p.isEmpty()) {
            p = System.getenv("FEEDCRON_PROPERTIES");
        }
        if (p == null || p.isEmpty()) {
            p = DEFAULT_PROPERTIES_FILE;
        }
        return Paths.get(p);
    }

    private String get(String key, String def) {
        String v = System.getProperty(key);
        if (v == null || v.isEmpty()) {
            v = System.getenv(key);
        }
        if (v == null || v.isEmpty()) {
            v = fileProps.getProperty(key);
        }
        return v == null || v.isEmpty() ? def : v.trim();
    }

    private int getInt(String key, int def) {
        String v = get(key, null);
        if (v == null) {
            return def;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using {}", v, key, def);
            return def;
        }
    }

    public String getSchedulerName() { return schedulerName; }
    public int getThreadCount() { return threadCount; }
    public long getMisfireThresholdMillis() { return misfireThresholdMillis; }
    public boolean isWaitForJobsOnShutdown() { return waitForJobsOnShutdown; }
    public boolean isInterruptJobsOnShutdown() { return interruptJobsOnShutdown; }
    /** -1 when the metrics endpoint is disabled. */
    public int getMetricsPort() { return metricsPort; }
    public String getCleanupCron() { return cleanupCron; }
    public int getRetentionDays() { return retentionDays; }
    public String getAnalyticsCron() { return analyticsCron; }
    public String getSmartTaggingCron() { return smartTaggingCron; }
    public int getSmartTaggingBatchSize() { return smartTaggingBatchSize; }
    public boolean isMaintenanceJobsEnabled() { return maintenanceJobsEnabled; }
}
