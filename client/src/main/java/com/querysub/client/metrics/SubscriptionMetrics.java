package com.querysub.client.metrics;

import com.querysub.storage.progress.LoadOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for subscriptions: consume cycles, query attempts,
 * table synchronizations and progress file I/O.
 */
@Singleton
public class SubscriptionMetrics {

    private final MeterRegistry registry;

    private final Counter consumeSuccess;
    private final Counter consumeFailure;
    private final Counter queryAttempts;
    private final Counter queryRetries;
    private final Counter syncSuccess;
    private final Counter syncFailure;
    private final Counter progressSaved;
    private final Counter progressSaveFailed;
    private final Counter callbackFailures;

    private final AtomicLong activeSubscriptions = new AtomicLong(0);

    private final Timer consumeLatency;

    public SubscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.consumeSuccess = Counter.builder("subscription.consume.cycles")
            .description("Consume cycles by outcome")
            .tag("outcome", "success")
            .register(registry);

        this.consumeFailure = Counter.builder("subscription.consume.cycles")
            .description("Consume cycles by outcome")
            .tag("outcome", "failure")
            .register(registry);

        this.queryAttempts = Counter.builder("subscription.query.attempts")
            .description("Query executions submitted to the engine")
            .register(registry);

        this.queryRetries = Counter.builder("subscription.query.retries")
            .description("Query executions that failed and forced a resync")
            .register(registry);

        this.syncSuccess = Counter.builder("subscription.sync")
            .description("Table synchronizations by outcome")
            .tag("outcome", "success")
            .register(registry);

        this.syncFailure = Counter.builder("subscription.sync")
            .description("Table synchronizations by outcome")
            .tag("outcome", "failure")
            .register(registry);

        this.progressSaved = Counter.builder("subscription.progress.saves")
            .description("Progress file writes by outcome")
            .tag("outcome", "success")
            .register(registry);

        this.progressSaveFailed = Counter.builder("subscription.progress.saves")
            .description("Progress file writes by outcome")
            .tag("outcome", "failure")
            .register(registry);

        this.callbackFailures = Counter.builder("subscription.callback.failures")
            .description("Push callbacks that threw")
            .register(registry);

        Gauge.builder("subscription.active", activeSubscriptions, AtomicLong::get)
            .description("Number of live subscriptions")
            .register(registry);

        this.consumeLatency = Timer.builder("subscription.consume.latency")
            .description("Time spent in a consume cycle, excluding pacing")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordConsume(boolean success, long durationNanos) {
        if (success) {
            consumeSuccess.increment();
        } else {
            consumeFailure.increment();
        }
        consumeLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordQueryAttempt() {
        queryAttempts.increment();
    }

    public void recordQueryRetry() {
        queryRetries.increment();
    }

    public void recordSync(boolean success) {
        if (success) {
            syncSuccess.increment();
        } else {
            syncFailure.increment();
        }
    }

    public void recordProgressSave(boolean success) {
        if (success) {
            progressSaved.increment();
        } else {
            progressSaveFailed.increment();
        }
    }

    public void recordProgressLoad(LoadOutcome outcome) {
        registry.counter("subscription.progress.loads", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordCallbackFailure() {
        callbackFailures.increment();
    }

    public void subscriptionOpened() {
        activeSubscriptions.incrementAndGet();
    }

    public void subscriptionClosed() {
        activeSubscriptions.decrementAndGet();
    }

    public long getActiveSubscriptions() {
        return activeSubscriptions.get();
    }
}
