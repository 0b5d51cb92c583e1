package com.feedcron.feeds;

import com.feedcron.store.MisfirePolicy;

/**
 * An RSS/Atom feed to ingest on a schedule.
 */
public final class FeedConfig {
    /** Every 15 minutes. */
    public static final String DEFAULT_CRON = "0 */15 * * * ?";
    public static final int DEFAULT_MAX_RETRIES = 5;

    private final String id;
    private final String name;
    private final String url;
    private final String cronExpression;
    private final int maxRetries;
    private final MisfirePolicy misfirePolicy;

    public FeedConfig(String id, String name, String url) {
        this(id, name, url, DEFAULT_CRON, DEFAULT_MAX_RETRIES, MisfirePolicy.FIRE_NOW);
    }

    public FeedConfig(String id, String name, String url, String cronExpression,
                      int maxRetries, MisfirePolicy misfirePolicy) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Feed id is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Feed url is required");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.url = url;
        this.cronExpression = cronExpression == null || cronExpression.isBlank() ? DEFAULT_CRON : cronExpression;
        this.maxRetries = Math.max(0, maxRetries);
        this.misfirePolicy = misfirePolicy == null ? MisfirePolicy.FIRE_NOW : misfirePolicy;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getUrl() { return url; }
    public String getCronExpression() { return cronExpression; }
    public int getMaxRetries() { return maxRetries; }
    public MisfirePolicy getMisfirePolicy() { return misfirePolicy; }
}
