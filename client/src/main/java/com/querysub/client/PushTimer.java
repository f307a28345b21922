package com.querysub.client;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Identity of one armed push timer. A firing whose timer is no longer the
 * subscription's current timer does nothing.
 *
 * Owns the subscription's worker thread: consume cycles block until the
 * engine completes, so they never run on the shared timer threads.
 */
final class PushTimer {
    private final ExecutorService worker;
    private volatile ScheduledFuture<?> pending;
    private volatile boolean cancelled;

    PushTimer(String topic) {
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("SubscriptionWorker-" + topic + "-" + t.getId());
            t.setDaemon(true);
            return t;
        });
    }

    void arm(ScheduledFuture<?> future) {
        this.pending = future;
        if (cancelled) {
            future.cancel(false);
        }
    }

    /**
     * Run a cycle on this timer's worker.
     *
     * @return false if the worker has been shut down
     */
    boolean dispatch(Runnable cycle) {
        try {
            worker.execute(cycle);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    /**
     * Prevent future firings. A cycle already running on the worker completes.
     */
    void cancel() {
        cancelled = true;
        ScheduledFuture<?> future = pending;
        if (future != null) {
            future.cancel(false);
        }
        worker.shutdown();
    }

    boolean isCancelled() {
        return cancelled;
    }
}
