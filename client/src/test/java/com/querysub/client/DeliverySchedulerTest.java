package com.querysub.client;

import com.querysub.client.fake.FakeQueryEngine;
import com.querysub.client.fake.FakeSession;
import com.querysub.client.fake.ListRowSequence;
import com.querysub.client.metrics.SubscriptionMetrics;
import com.querysub.common.api.RowSequence;
import com.querysub.common.model.Row;
import com.querysub.storage.progress.ProgressStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DeliverySchedulerTest {

    private static final String SQL = "select * from meters";

    private Path tempDir;
    private FakeSession session;
    private FakeQueryEngine engine;
    private ProgressStore progressStore;
    private SubscriptionMetrics metrics;
    private DeliveryScheduler deliveryScheduler;
    private SubscriptionManager manager;

    @BeforeEach
    void setUp() throws IOException {
        tempDir = Files.createTempDirectory("delivery-scheduler-test");
        session = new FakeSession("s1");
        engine = session.getEngine();
        engine.setEntityId(1L);
        engine.setRows(List.of(new Row(1L, 1000L, List.of(0.5))));

        SubscriptionConfiguration config = new SubscriptionConfiguration();
        progressStore = new ProgressStore(tempDir.toString());
        metrics = new SubscriptionMetrics(new SimpleMeterRegistry());
        deliveryScheduler = new DeliveryScheduler(config, metrics);
        manager = new SubscriptionManager(progressStore, new EntityResolver(), deliveryScheduler, config, metrics);
    }

    @AfterEach
    void tearDown() throws IOException {
        manager.shutdown();
        deliveryScheduler.shutdown();
        if (tempDir != null && Files.exists(tempDir)) {
            Files.walk(tempDir)
                    .sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            // Ignore
                        }
                    });
        }
    }

    private static void waitFor(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMs + "ms");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testCallbackReceivesRowsAndParam() throws Exception {
        Object param = new Object();
        CountDownLatch delivered = new CountDownLatch(1);
        List<Object> params = new CopyOnWriteArrayList<>();
        List<Integer> codes = new CopyOnWriteArrayList<>();
        List<Long> keys = new CopyOnWriteArrayList<>();

        manager.subscribe(session, false, "push", SQL, (sub, rows, p, code) -> {
            params.add(p);
            codes.add(code);
            Row row;
            while ((row = rows.fetchRow()) != null) {
                keys.add(row.getKey());
            }
            delivered.countDown();
        }, param, 30);

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertSame(param, params.get(0));
        assertEquals(0, codes.get(0));
        assertEquals(1000L, keys.get(0));
    }

    @Test
    void testFirstCycleWaitsOneInterval() throws Exception {
        long subscribedAt = System.currentTimeMillis();
        CountDownLatch delivered = new CountDownLatch(1);

        manager.subscribe(session, false, "push", SQL, (sub, rows, p, code) -> delivered.countDown(), null, 200);

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertTrue(engine.getSubmitTimes().get(0) - subscribedAt >= 190);
    }

    @Test
    void testAcknowledgedProgressIsPersistedByNextCycle() throws Exception {
        manager.subscribe(session, false, "push", SQL, (sub, rows, p, code) -> {
            Row row;
            while ((row = rows.fetchRow()) != null) {
                sub.updateProgress(row.getEntityId(), row.getKey());
            }
        }, null, 30);

        Path file = progressStore.getProgressFile("push");
        waitFor(() -> {
            try {
                return Files.exists(file)
                        && Files.readAllLines(file, StandardCharsets.UTF_8).equals(List.of(SQL, "1:1000"));
            } catch (IOException e) {
                return false;
            }
        }, 5000);
    }

    @Test
    void testRowsAreClosedAfterCallback() throws Exception {
        List<RowSequence> delivered = new CopyOnWriteArrayList<>();

        manager.subscribe(session, false, "push", SQL, (sub, rows, p, code) -> delivered.add(rows), null, 30);

        waitFor(() -> delivered.size() >= 2, 5000);
        assertTrue(((ListRowSequence) delivered.get(0)).isClosed());
    }

    @Test
    void testFailingCallbackDoesNotStopDelivery() throws Exception {
        List<Integer> calls = new CopyOnWriteArrayList<>();

        manager.subscribe(session, false, "push", SQL, (sub, rows, p, code) -> {
            calls.add(code);
            throw new IllegalStateException("consumer bug");
        }, null, 30);

        waitFor(() -> calls.size() >= 3, 5000);
        assertEquals(1, metrics.getActiveSubscriptions());
    }

    @Test
    void testFailedCycleSkipsCallbackAndKeepsTimer() throws Exception {
        engine.setAlwaysFail(true);
        List<Integer> calls = new CopyOnWriteArrayList<>();

        Subscription subscription = manager.subscribe(session, false, "push", SQL,
                (sub, rows, p, code) -> calls.add(code), null, 30);

        waitFor(() -> engine.getExecutions() >= 6, 5000);
        assertTrue(calls.isEmpty());
        assertTrue(subscription.isPushMode());
    }

    @Test
    void testUnsubscribeStopsDelivery() throws Exception {
        List<Integer> calls = new CopyOnWriteArrayList<>();
        Subscription subscription = manager.subscribe(session, false, "push", SQL,
                (sub, rows, p, code) -> calls.add(code), null, 20);
        waitFor(() -> calls.size() >= 2, 5000);

        manager.unsubscribe(subscription, true);
        int executions = engine.getExecutions();
        // a cycle that already returned rows may still be delivering
        Thread.sleep(100);
        int delivered = calls.size();
        Thread.sleep(200);

        assertEquals(executions, engine.getExecutions());
        assertEquals(delivered, calls.size());
    }

    @Test
    void testStaleTimerFiringIsIgnored() throws Exception {
        List<Integer> calls = new CopyOnWriteArrayList<>();
        Subscription subscription = manager.subscribe(session, false, "push", SQL,
                (sub, rows, p, code) -> calls.add(code), null, 60_000);

        PushTimer stale = new PushTimer("push");
        deliveryScheduler.fire(subscription, stale);
        stale.cancel();
        assertEquals(0, engine.getExecutions());

        deliveryScheduler.fire(subscription, subscription.getTimer());
        assertEquals(1, engine.getExecutions());
        assertEquals(1, calls.size());
    }

    @Test
    void testCancelledTimerDoesNotFire() throws Exception {
        Subscription subscription = manager.subscribe(session, false, "push", SQL,
                (sub, rows, p, code) -> { }, null, 60_000);
        PushTimer timer = subscription.getTimer();

        deliveryScheduler.cancel(subscription);
        deliveryScheduler.fire(subscription, timer);

        assertTrue(timer.isCancelled());
        assertFalse(timer.dispatch(() -> { }));
        assertFalse(subscription.isPushMode());
        assertEquals(0, engine.getExecutions());
    }

    @Test
    void testStuckBackendsDoNotStarveOtherTopics() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        FakeSession stuckA = new FakeSession("stuck-a");
        FakeSession stuckB = new FakeSession("stuck-b");
        for (FakeSession stuck : List.of(stuckA, stuckB)) {
            stuck.getEngine().setOnSubmit(q -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        try {
            manager.subscribe(stuckA, false, "stuck-a", SQL, (sub, rows, p, code) -> { }, null, 20);
            manager.subscribe(stuckB, false, "stuck-b", SQL, (sub, rows, p, code) -> { }, null, 20);
            waitFor(() -> stuckA.getEngine().getExecutions() == 1 && stuckB.getEngine().getExecutions() == 1, 5000);

            CountDownLatch delivered = new CountDownLatch(3);
            manager.subscribe(session, false, "healthy", SQL,
                    (sub, rows, p, code) -> delivered.countDown(), null, 20);

            assertTrue(delivered.await(2, TimeUnit.SECONDS));
            assertEquals(1, stuckA.getEngine().getExecutions());
            assertEquals(1, stuckB.getEngine().getExecutions());
        } finally {
            release.countDown();
        }
    }
}
