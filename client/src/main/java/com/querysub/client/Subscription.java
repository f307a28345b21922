package com.querysub.client;

import com.querysub.client.metrics.SubscriptionMetrics;
import com.querysub.common.api.ActiveQueryRegistry;
import com.querysub.common.api.BoundQuery;
import com.querysub.common.api.QueryEngine;
import com.querysub.common.api.RowSequence;
import com.querysub.common.api.Session;
import com.querysub.common.exception.ErrorCode;
import com.querysub.common.exception.ExceptionLogger;
import com.querysub.common.exception.QueryException;
import com.querysub.common.exception.SubscriptionException;
import com.querysub.common.model.EntityTags;
import com.querysub.common.model.TargetKind;
import com.querysub.storage.progress.LoadOutcome;
import com.querysub.storage.progress.ProgressStore;
import com.querysub.storage.watermark.WatermarkEntry;
import com.querysub.storage.watermark.WatermarkSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One topic's subscription: a bound query re-executed against per-table
 * watermarks.
 *
 * Cycles are serialized by a per-subscription lock: table synchronization,
 * consume, progress access and close never overlap. Created by
 * {@link SubscriptionManager}.
 */
public class Subscription {
    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final String topic;
    private final Session session;
    private final BoundQuery query;
    private final WatermarkSet watermarks;
    private final int intervalMs;
    private final SubscriptionCallback callback;
    private final Object callbackParam;

    private final ProgressStore progressStore;
    private final EntityResolver entityResolver;
    private final SubscriptionMetrics metrics;
    private final long syncIntervalMs;
    private final int maxAttempts;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile long lastSyncTime;
    private volatile long lastConsumeTime;
    private volatile PushTimer timer;
    private volatile boolean closed;

    Subscription(String topic, Session session, BoundQuery query, int intervalMs,
                 SubscriptionCallback callback, Object callbackParam,
                 ProgressStore progressStore, EntityResolver entityResolver,
                 SubscriptionMetrics metrics, SubscriptionConfiguration config) {
        this.topic = topic;
        this.session = session;
        this.query = query;
        this.watermarks = new WatermarkSet(32);
        this.intervalMs = intervalMs;
        this.callback = callback;
        this.callbackParam = callbackParam;
        this.progressStore = progressStore;
        this.entityResolver = entityResolver;
        this.metrics = metrics;
        this.syncIntervalMs = config.getSyncIntervalMs();
        this.maxAttempts = config.getMaxAttempts();
    }

    /**
     * Refresh the set of tables matched by the query and carry watermarks
     * over to it. Tables that vanished are dropped; new tables start from
     * {@link WatermarkSet#MIN_SENTINEL}.
     *
     * @return false if the tables could not be resolved; state is unchanged
     */
    boolean synchronizeTables() {
        lock.lock();
        try {
            long previousSyncTime = lastSyncTime;
            lastSyncTime = System.currentTimeMillis();

            TargetKind targetKind = query.getTargetKind();
            if (targetKind.isSingleEntity()) {
                long entityId = query.getEntityId();
                if (watermarks.size() != 1 || !watermarks.contains(entityId)) {
                    long key = watermarks.get(entityId, 0L);
                    watermarks.rebuild(List.of(new WatermarkEntry(entityId, key)));
                }
                metrics.recordSync(true);
                return true;
            }

            List<EntityTags> tables;
            try {
                tables = entityResolver.resolve(session.getQueryEngine(), query, topic);
            } catch (SubscriptionException e) {
                ExceptionLogger.logWarn(log, e);
                lastSyncTime = previousSyncTime;
                metrics.recordSync(false);
                return false;
            }

            List<WatermarkEntry> progress = new ArrayList<>(tables.size());
            for (EntityTags table : tables) {
                long key = watermarks.get(table.getEntityId(), WatermarkSet.MIN_SENTINEL);
                progress.add(new WatermarkEntry(table.getEntityId(), key));
            }
            watermarks.rebuild(progress);

            if (targetKind == TargetKind.SUPER_TABLE) {
                List<EntityTags> sorted = new ArrayList<>(tables);
                sorted.sort(EntityTags.BY_ENTITY_ID);
                query.bindEntities(sorted);
            }
            query.setMultiEntity(true);

            log.debug("Synchronized {} tables for topic={}", watermarks.size(), topic);
            metrics.recordSync(true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run one consume cycle: persist progress, pace (pull mode only), then
     * execute the query with up to {@code maxAttempts} attempts.
     *
     * @return Rows produced by the query, or null if every attempt failed
     */
    public RowSequence consume() {
        lock.lock();
        try {
            if (closed) {
                log.warn("Consume called on closed subscription: {}", topic);
                return null;
            }

            saveProgress();

            if (timer == null && !pace()) {
                return null;
            }

            long start = System.nanoTime();
            ActiveQueryRegistry activeQueries = session.getActiveQueries();
            QueryCompletion completion = null;

            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                activeQueries.remove(query);

                if (isSyncStale()) {
                    log.trace("begin table synchronization: {}", topic);
                    if (!synchronizeTables()) {
                        metrics.recordConsume(false, System.nanoTime() - start);
                        return null;
                    }
                    log.trace("table synchronization completed: {}", topic);
                }

                boolean multiEntity = query.isMultiEntity();
                query.resetExecutionState();
                query.setMultiEntity(multiEntity);

                metrics.recordQueryAttempt();
                completion = execute();
                if (completion == null) {
                    // interrupted, the cycle is abandoned
                    activeQueries.remove(query);
                    metrics.recordConsume(false, System.nanoTime() - start);
                    return null;
                }
                if (completion.isSuccess()) {
                    break;
                }

                // table may have been removed, synchronize before the next attempt
                lastSyncTime = 0;
                metrics.recordQueryRetry();
                log.warn("Query attempt {}/{} failed for topic={}, code={}",
                        attempt + 1, maxAttempts, topic, completion.code);
            }

            if (completion == null || !completion.isSuccess()) {
                int code = completion == null ? -1 : completion.code;
                ExceptionLogger.logError(log, QueryException.executionFailed(query.getSql(), code));
                activeQueries.remove(query);
                metrics.recordConsume(false, System.nanoTime() - start);
                return null;
            }

            lastConsumeTime = System.currentTimeMillis();
            metrics.recordConsume(true, System.nanoTime() - start);
            return completion.rows;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return Last acknowledged key for the table, or {@code dflt} if untracked
     */
    public long getProgress(long entityId, long dflt) {
        lock.lock();
        try {
            return watermarks.get(entityId, dflt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acknowledge rows up to {@code key} for a table. Ignored for untracked tables.
     */
    public void updateProgress(long entityId, long key) {
        lock.lock();
        try {
            watermarks.advance(entityId, key);
        } finally {
            lock.unlock();
        }
    }

    void saveProgress() {
        lock.lock();
        try {
            metrics.recordProgressSave(progressStore.save(topic, query.getSql(), watermarks));
        } finally {
            lock.unlock();
        }
    }

    LoadOutcome loadProgress() {
        lock.lock();
        try {
            LoadOutcome outcome = progressStore.load(topic, query.getSql(), watermarks);
            metrics.recordProgressLoad(outcome);
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the query and the watermarks. Waits for an in-flight cycle.
     */
    void close(boolean keepProgress) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            timer = null;

            if (keepProgress) {
                saveProgress();
            } else if (!progressStore.delete(topic)) {
                log.debug("No progress file removed for topic={}", topic);
            }

            session.getActiveQueries().remove(query);
            query.close();
            watermarks.clear();
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    private boolean pace() {
        long duration = System.currentTimeMillis() - lastConsumeTime;
        if (duration >= intervalMs) {
            return true;
        }
        log.trace("subscription consume too frequently, blocking...");
        try {
            Thread.sleep(intervalMs - duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pacing consume for topic={}", topic);
            return false;
        }
    }

    private boolean isSyncStale() {
        return System.currentTimeMillis() - lastSyncTime > syncIntervalMs;
    }

    /**
     * Submit the query and block until the engine reports completion.
     *
     * @return Completion, or null if the thread was interrupted while waiting
     */
    private QueryCompletion execute() {
        QueryEngine engine = session.getQueryEngine();
        CompletableFuture<QueryCompletion> future = new CompletableFuture<>();
        try {
            engine.executeAsync(query, (rows, code) -> future.complete(new QueryCompletion(rows, code)));
        } catch (RuntimeException e) {
            log.error("Engine rejected query submission for topic={}", topic, e);
            return new QueryCompletion(null, ErrorCode.QUERY_EXECUTION_FAILED.getCode());
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ExceptionLogger.logError(log, new SubscriptionException(ErrorCode.QUERY_INTERRUPTED,
                    "Interrupted while waiting for query completion", e).withTopic(topic));
            return null;
        } catch (ExecutionException e) {
            log.error("Query completion failed for topic={}", topic, e.getCause());
            return new QueryCompletion(null, ErrorCode.QUERY_EXECUTION_FAILED.getCode());
        }
    }

    public String getTopic() {
        return topic;
    }

    public String getSql() {
        return query.getSql();
    }

    public int getIntervalMs() {
        return intervalMs;
    }

    public long getLastSyncTime() {
        return lastSyncTime;
    }

    public long getLastConsumeTime() {
        return lastConsumeTime;
    }

    public boolean isPushMode() {
        return timer != null;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Snapshot of the watermarks in ascending table id order
     */
    public List<WatermarkEntry> getWatermarks() {
        lock.lock();
        try {
            return watermarks.entries();
        } finally {
            lock.unlock();
        }
    }

    Session getSession() {
        return session;
    }

    SubscriptionCallback getCallback() {
        return callback;
    }

    Object getCallbackParam() {
        return callbackParam;
    }

    PushTimer getTimer() {
        return timer;
    }

    void setTimer(PushTimer timer) {
        this.timer = timer;
    }

    @Override
    public String toString() {
        return String.format("Subscription{topic=%s, tables=%d, interval=%dms, push=%b, closed=%b}",
                topic, watermarks.size(), intervalMs, timer != null, closed);
    }

    private static final class QueryCompletion {
        private final RowSequence rows;
        private final int code;

        private QueryCompletion(RowSequence rows, int code) {
            this.rows = rows;
            this.code = code;
        }

        private boolean isSuccess() {
            return code == 0;
        }
    }
}
