package com.querysub.client;

import com.querysub.client.metrics.SubscriptionMetrics;
import com.querysub.common.api.BoundQuery;
import com.querysub.common.api.RowSequence;
import com.querysub.common.api.Session;
import com.querysub.common.exception.ErrorCode;
import com.querysub.common.exception.ExceptionLogger;
import com.querysub.common.exception.QueryException;
import com.querysub.common.exception.SubscriptionException;
import com.querysub.storage.progress.LoadOutcome;
import com.querysub.storage.progress.ProgressStore;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry points for creating, consuming and releasing subscriptions.
 *
 * At most one live subscription exists per (session, topic).
 */
@Singleton
public class SubscriptionManager {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final ProgressStore progressStore;
    private final EntityResolver entityResolver;
    private final DeliveryScheduler deliveryScheduler;
    private final SubscriptionConfiguration config;
    private final SubscriptionMetrics metrics;

    // Key: "sessionId/topic". A topic is reserved before its subscription is built.
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Boolean> reservedTopics = new ConcurrentHashMap<>();

    public SubscriptionManager(ProgressStore progressStore, EntityResolver entityResolver,
                               DeliveryScheduler deliveryScheduler, SubscriptionConfiguration config,
                               SubscriptionMetrics metrics) {
        this.progressStore = progressStore;
        this.entityResolver = entityResolver;
        this.deliveryScheduler = deliveryScheduler;
        this.config = config;
        this.metrics = metrics;
        log.info("SubscriptionManager initialized: syncInterval={}ms, maxAttempts={}, progressDir={}",
                config.getSyncIntervalMs(), config.getMaxAttempts(), progressStore.getProgressDir());
    }

    /**
     * Pull-mode subscribe: the caller drives cycles with {@link #consume}.
     */
    public Subscription subscribe(Session session, boolean restart, String topic, String sql,
                                  int intervalMs) throws SubscriptionException {
        return subscribe(session, restart, topic, sql, null, null, intervalMs);
    }

    /**
     * Create a subscription.
     *
     * @param session Live connection the query runs on
     * @param restart true to ignore any saved progress for the topic
     * @param topic Topic name, also the progress file name
     * @param sql A single select statement
     * @param callback Push-mode callback, or null for pull mode
     * @param param Passed back to {@code callback}
     * @param intervalMs Minimum time between consume cycles
     * @return A subscription whose tables are already synchronized
     * @throws SubscriptionException if the subscription cannot be created; nothing is left allocated
     */
    public Subscription subscribe(Session session, boolean restart, String topic, String sql,
                                  SubscriptionCallback callback, Object param, int intervalMs)
            throws SubscriptionException {
        if (session == null || !session.isConnected()) {
            throw ExceptionLogger.logAndThrow(log, SubscriptionException.disconnected(topic));
        }

        String name = normalizeTopic(topic);
        if (sql == null || sql.isBlank()) {
            throw new SubscriptionException(ErrorCode.VALIDATION_INVALID_QUERY,
                    "Empty sql statement for topic: " + name).withTopic(name);
        }
        if (intervalMs < 0) {
            throw new SubscriptionException(ErrorCode.VALIDATION_INVALID_INTERVAL,
                    "Negative consume interval: " + intervalMs).withTopic(name);
        }

        String key = registryKey(session, name);
        if (reservedTopics.putIfAbsent(key, Boolean.TRUE) != null) {
            throw SubscriptionException.topicInUse(session.getId(), name);
        }

        boolean created = false;
        try {
            Subscription subscription = create(session, restart, name, sql, callback, param, intervalMs);
            subscriptions.put(key, subscription);
            metrics.subscriptionOpened();
            created = true;
            log.info("Subscribed: topic={}, session={}, interval={}ms, mode={}",
                    name, session.getId(), intervalMs, callback != null ? "push" : "pull");
            return subscription;
        } finally {
            if (!created) {
                reservedTopics.remove(key);
            }
        }
    }

    private Subscription create(Session session, boolean restart, String topic, String sql,
                                SubscriptionCallback callback, Object param, int intervalMs)
            throws SubscriptionException {
        BoundQuery query;
        try {
            query = session.getQueryEngine().prepare(sql);
        } catch (QueryException e) {
            throw ExceptionLogger.logAndThrow(log, SubscriptionException.parseFailed(topic, e));
        } catch (OutOfMemoryError e) {
            throw SubscriptionException.resourceExhausted(topic, e);
        }

        Subscription subscription = null;
        try {
            if (!query.getStatementKind().isRowProducing()) {
                throw ExceptionLogger.logAndThrow(log,
                        SubscriptionException.invalidQueryKind(topic, query.getStatementKind()));
            }

            subscription = new Subscription(topic, session, query, intervalMs, callback, param,
                    progressStore, entityResolver, metrics, config);

            if (restart) {
                log.trace("restart subscription: {}", topic);
            } else {
                LoadOutcome outcome = subscription.loadProgress();
                log.debug("Progress load for topic={}: {}", topic, outcome);
            }

            if (!subscription.synchronizeTables()) {
                throw ExceptionLogger.logAndThrow(log, SubscriptionException.syncFailed(topic));
            }

            if (callback != null) {
                deliveryScheduler.start(subscription);
            }
            return subscription;

        } catch (OutOfMemoryError e) {
            release(query, subscription);
            throw SubscriptionException.resourceExhausted(topic, e);
        } catch (SubscriptionException | RuntimeException e) {
            release(query, subscription);
            throw e;
        }
    }

    /**
     * Undo a partially built subscription, last acquired first.
     */
    private void release(BoundQuery query, Subscription subscription) {
        if (subscription != null) {
            deliveryScheduler.cancel(subscription);
            subscription.close(true);
        } else if (query != null) {
            query.close();
        }
    }

    /**
     * Run one pull-mode consume cycle.
     *
     * @return Rows, or null if the subscription is null or every attempt failed
     */
    public RowSequence consume(Subscription subscription) {
        if (subscription == null) {
            return null;
        }
        return subscription.consume();
    }

    /**
     * Stop the push timer and release the subscription.
     *
     * @param keepProgress true to save progress, false to delete the topic's progress file
     */
    public void unsubscribe(Subscription subscription, boolean keepProgress) {
        if (subscription == null || subscription.isClosed()) {
            return;
        }

        deliveryScheduler.cancel(subscription);
        subscription.close(keepProgress);

        String key = registryKey(subscription.getSession(), subscription.getTopic());
        if (subscriptions.remove(key, subscription)) {
            reservedTopics.remove(key);
            metrics.subscriptionClosed();
        }
        log.info("Unsubscribed: topic={}, keepProgress={}", subscription.getTopic(), keepProgress);
    }

    public long getProgress(Subscription subscription, long entityId, long dflt) {
        if (subscription == null) {
            return dflt;
        }
        return subscription.getProgress(entityId, dflt);
    }

    public void updateProgress(Subscription subscription, long entityId, long key) {
        if (subscription == null) {
            return;
        }
        subscription.updateProgress(entityId, key);
    }

    /**
     * Look up a live subscription. {@code topic} is truncated the same way subscribe truncates it.
     */
    public Subscription getSubscription(Session session, String topic) {
        if (session == null || topic == null) {
            return null;
        }
        return subscriptions.get(registryKey(session, truncateTopic(topic)));
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Release every live subscription, keeping progress.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SubscriptionManager: {} live subscriptions", subscriptions.size());
        List<Subscription> live = new ArrayList<>(subscriptions.values());
        for (Subscription subscription : live) {
            try {
                unsubscribe(subscription, true);
            } catch (RuntimeException e) {
                log.error("Failed to release subscription: {}", subscription.getTopic(), e);
            }
        }
        log.info("SubscriptionManager shutdown complete");
    }

    /**
     * Validate the topic and truncate it to the configured maximum length.
     */
    String normalizeTopic(String topic) throws SubscriptionException {
        if (topic == null || topic.isBlank()) {
            throw SubscriptionException.invalidTopic(String.valueOf(topic), "topic must not be blank");
        }
        String name = truncateTopic(topic);
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.contains("..")
                || name.indexOf('\0') >= 0) {
            throw SubscriptionException.invalidTopic(name, "topic is used as a file name");
        }
        return name;
    }

    private String truncateTopic(String topic) {
        return topic.length() > config.getTopicMaxLength()
                ? topic.substring(0, config.getTopicMaxLength())
                : topic;
    }

    private static String registryKey(Session session, String topic) {
        return session.getId() + "/" + topic;
    }
}
