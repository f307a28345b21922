package com.querysub.client;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Settings under the {@code subscription} prefix.
 */
@ConfigurationProperties("subscription")
public class SubscriptionConfiguration {
    public static final long DEFAULT_SYNC_INTERVAL_MS = 10 * 60 * 1000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_TOPIC_MAX_LENGTH = 31;

    private long syncIntervalMs = DEFAULT_SYNC_INTERVAL_MS;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private int topicMaxLength = DEFAULT_TOPIC_MAX_LENGTH;
    private int schedulerThreads = 2;

    /**
     * Table synchronization runs when more than this has elapsed since the last one
     */
    public long getSyncIntervalMs() {
        return syncIntervalMs;
    }

    public void setSyncIntervalMs(long syncIntervalMs) {
        this.syncIntervalMs = syncIntervalMs;
    }

    /**
     * Query executions per consume cycle before giving up
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getTopicMaxLength() {
        return topicMaxLength;
    }

    public void setTopicMaxLength(int topicMaxLength) {
        this.topicMaxLength = topicMaxLength;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }
}
