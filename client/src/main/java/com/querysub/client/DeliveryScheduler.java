package com.querysub.client;

import com.querysub.client.metrics.SubscriptionMetrics;
import com.querysub.common.api.RowSequence;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives push-mode subscriptions: every {@code intervalMs} runs one consume
 * cycle and hands the rows to the subscription's callback.
 *
 * The shared timer threads only schedule. Each subscription's cycles run on
 * the worker owned by its {@link PushTimer}, so a backend that never
 * completes stalls that subscription alone. Each subscription has at most
 * one armed one-shot task, re-armed by its worker after every cycle, so
 * cycles of one subscription never overlap.
 */
@Singleton
public class DeliveryScheduler {
    private static final Logger log = LoggerFactory.getLogger(DeliveryScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final SubscriptionMetrics metrics;
    private final Set<PushTimer> timers = ConcurrentHashMap.newKeySet();

    public DeliveryScheduler(SubscriptionConfiguration config, SubscriptionMetrics metrics) {
        this.metrics = metrics;
        this.scheduler = Executors.newScheduledThreadPool(config.getSchedulerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("SubscriptionTimer-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        log.info("DeliveryScheduler initialized: timerThreads={}", config.getSchedulerThreads());
    }

    /**
     * Put a subscription in push mode. The first cycle runs after one interval.
     */
    public void start(Subscription subscription) {
        PushTimer timer = new PushTimer(subscription.getTopic());
        timers.add(timer);
        subscription.setTimer(timer);
        log.trace("asynchronize subscription, create new timer: {}", subscription.getTopic());
        arm(subscription, timer);
    }

    /**
     * Stop future cycles. A cycle already running completes normally.
     */
    public void cancel(Subscription subscription) {
        PushTimer timer = subscription.getTimer();
        subscription.setTimer(null);
        if (timer != null) {
            timers.remove(timer);
            timer.cancel();
            log.debug("Stopped push timer for topic={}", subscription.getTopic());
        }
    }

    private void arm(Subscription subscription, PushTimer timer) {
        try {
            timer.arm(scheduler.schedule(
                    () -> dispatch(subscription, timer),
                    subscription.getIntervalMs(),
                    TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler shut down, push delivery stopped for topic={}", subscription.getTopic());
        }
    }

    private void dispatch(Subscription subscription, PushTimer timer) {
        if (!timer.dispatch(() -> fire(subscription, timer))) {
            log.debug("Worker stopped, dropping push cycle for topic={}", subscription.getTopic());
        }
    }

    /**
     * One push cycle. Runs on the subscription's worker.
     */
    void fire(Subscription subscription, PushTimer timer) {
        if (subscription.getTimer() != timer || timer.isCancelled()) {
            return;
        }

        try {
            RowSequence rows = subscription.consume();
            if (rows != null) {
                deliver(subscription, rows);
            }
        } catch (RuntimeException e) {
            log.error("Push cycle failed for topic={}", subscription.getTopic(), e);
        }

        if (subscription.getTimer() == timer && !timer.isCancelled()) {
            arm(subscription, timer);
        }
    }

    private void deliver(Subscription subscription, RowSequence rows) {
        try (rows) {
            subscription.getCallback().onResult(subscription, rows, subscription.getCallbackParam(), 0);
        } catch (Exception e) {
            metrics.recordCallbackFailure();
            log.error("Subscription callback threw for topic={}", subscription.getTopic(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down DeliveryScheduler: {} push timers", timers.size());
        List<PushTimer> remaining = new ArrayList<>(timers);
        timers.clear();
        for (PushTimer timer : remaining) {
            timer.cancel();
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DeliveryScheduler stopped");
    }
}
