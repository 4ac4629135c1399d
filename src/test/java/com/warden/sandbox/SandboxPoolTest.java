package com.warden.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.model.ContentType;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.SecurityContext;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SandboxPoolTest {

    private final FakeSandboxBackend backend = new FakeSandboxBackend(IsolationLevel.CONTAINER);
    private final EventBus eventBus = new EventBus();
    private SandboxPool pool;

    private SandboxPool pool(int maxSize, long leaseGraceMillis, int target) {
        var properties = new GatewayProperties();
        properties.getPool().setTargetSize(new EnumMap<>(Map.of(IsolationLevel.CONTAINER, target)));
        var policyHolder = new PolicyHolder(properties, new ObjectMapper());
        pool = new SandboxPool(new BackendRegistry(List.of(backend)), policyHolder,
                new SandboxPool.Settings(maxSize, leaseGraceMillis, 250, 2, 60_000), eventBus, null);
        return pool;
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private static ExecutionRequest request() {
        var context = SecurityContext.builder("test").build();
        return new ExecutionRequest("print(1)", ContentType.CODE, context, null,
                Instant.now().plusSeconds(5), List.of(), null);
    }

    @Nested
    @DisplayName("Leasing")
    class Leasing {

        @Test
        @DisplayName("released instances are reset and reused")
        void reuse() {
            pool(2, 5_000, 0);

            String first;
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1")) {
                first = lease.sandboxId();
                assertEquals("req-1", lease.owner());
                assertTrue(lease.execute(request()).success());
            }
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-2")) {
                assertEquals(first, lease.sandboxId());
            }

            assertEquals(1, backend.created.get());
            assertEquals(2, backend.resets.get());
            assertEquals(0, backend.destroyed.get());
        }

        @Test
        @DisplayName("closing a lease twice is harmless")
        void doubleClose() {
            pool(2, 5_000, 0);
            SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1");

            lease.close();
            lease.close();

            assertEquals(1, backend.resets.get());
            assertTrue(lease.isFinished());
            assertThrows(IllegalStateException.class, () -> lease.execute(request()));
        }

        @Test
        @DisplayName("a lease executes at most once")
        void singleExecution() {
            pool(2, 5_000, 0);
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1")) {
                lease.execute(request());
                assertThrows(IllegalStateException.class, () -> lease.execute(request()));
            }
        }

        @Test
        @DisplayName("acquire fails with POOL_EXHAUSTED semantics when nothing frees up in time")
        void exhaustion() {
            pool(1, 5_000, 0);
            try (SandboxLease held = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "holder")) {
                long start = System.nanoTime();
                var error = assertThrows(PoolExhaustedException.class,
                        () -> pool.acquire(IsolationLevel.CONTAINER, Duration.ofMillis(100), "late"));
                long waitedMillis = (System.nanoTime() - start) / 1_000_000;

                assertEquals(IsolationLevel.CONTAINER, error.getLevel());
                assertTrue(waitedMillis >= 90, "waited " + waitedMillis + "ms");
                assertNotNull(held);
            }
            assertEquals(0, pool.snapshot().get(0).waiting());
        }

        @Test
        @DisplayName("slow creation times out at the deadline and the late instance joins the idle set")
        void slowCreation() throws Exception {
            pool(1, 5_000, 0);
            backend.createDelayMillis.set(500);

            long start = System.nanoTime();
            var error = assertThrows(SandboxCreationTimeoutException.class,
                    () -> pool.acquire(IsolationLevel.CONTAINER, Duration.ofMillis(100), "impatient"));
            long waitedMillis = (System.nanoTime() - start) / 1_000_000;

            assertEquals(IsolationLevel.CONTAINER, error.getLevel());
            assertTrue(waitedMillis < 400, "waited " + waitedMillis + "ms");

            backend.createDelayMillis.set(0);
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(2), "patient")) {
                assertEquals("fake-1", lease.sandboxId());
            }
            assertEquals(1, backend.created.get(), "cap of one held while the first creation was in flight");
        }

        @Test
        @DisplayName("abandon returns at once and tears the instance down in the background")
        void abandon() throws Exception {
            pool(2, 5_000, 0);
            SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1");

            lease.abandon();
            lease.close();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (backend.destroyed.get() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, backend.destroyed.get());
            assertEquals(0, backend.resets.get());
        }

        @Test
        @DisplayName("waiters are served first come, first served")
        void fifo() throws Exception {
            pool(1, 5_000, 0);
            List<String> order = new CopyOnWriteArrayList<>();
            ExecutorService executor = Executors.newFixedThreadPool(3);
            try {
                SandboxLease held = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "holder");
                var futures = new ArrayList<Future<?>>();
                for (String owner : List.of("first", "second", "third")) {
                    futures.add(executor.submit(() -> {
                        try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(5), owner)) {
                            order.add(lease.owner());
                            Thread.sleep(20);
                        }
                        return null;
                    }));
                    waitForWaiters(futures.size());
                }
                held.close();
                for (Future<?> f : futures) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(List.of("first", "second", "third"), order);
        }

        @Test
        @DisplayName("50 concurrent requests share 10 instances without exhaustion")
        void concurrentLoad() throws Exception {
            pool(10, 5_000, 0);
            int requests = 50;
            var start = new CountDownLatch(1);
            var succeeded = new AtomicInteger();
            var concurrent = new AtomicInteger();
            var maxConcurrent = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(requests);
            try {
                var futures = new ArrayList<Future<?>>();
                for (int i = 0; i < requests; i++) {
                    String owner = "req-" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(2), owner)) {
                            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                            Thread.sleep(20);
                            concurrent.decrementAndGet();
                            if (lease.execute(request()).success()) {
                                succeeded.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(requests, succeeded.get());
            assertTrue(maxConcurrent.get() <= 10);
            assertTrue(backend.created.get() <= 10);
        }

        private void waitForWaiters(int expected) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 2_000;
            while (pool.snapshot().get(0).waiting() < expected && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(expected, pool.snapshot().get(0).waiting());
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("an instance tainted by a breach is destroyed, never reused")
        void taintedDestroyed() {
            pool(2, 5_000, 0);
            backend.behaviour.set((instance, request) -> ExecutionResult.failure(ExitClassification.MEMORY_EXCEEDED,
                    "too much", IsolationLevel.CONTAINER, instance.id(), 5, 0, 137));
            var destroyedEvents = new CopyOnWriteArrayList<GatewayEvent>();
            eventBus.subscribe(GatewayEvents.SANDBOX_DESTROYED, destroyedEvents::add);

            String first;
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1")) {
                first = lease.sandboxId();
                assertEquals(ExitClassification.MEMORY_EXCEEDED, lease.execute(request()).classification());
            }

            assertEquals(1, backend.destroyed.get());
            assertEquals(0, backend.resets.get());
            assertEquals(1, destroyedEvents.size());
            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-2")) {
                assertNotEquals(first, lease.sandboxId());
            }
        }

        @Test
        @DisplayName("a failed reset destroys the instance")
        void resetFailure() {
            pool(2, 5_000, 0);
            backend.resetResult.set(false);

            pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1").close();

            assertEquals(1, backend.destroyed.get());
            assertEquals(0, pool.snapshot().get(0).total());
        }

        @Test
        @DisplayName("a backend exception during execution yields EXECUTION_FAILED and taints")
        void executeThrows() {
            pool(2, 5_000, 0);
            backend.behaviour.set((instance, request) -> {
                throw new IllegalStateException("daemon gone");
            });

            try (SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1")) {
                ExecutionResult result = lease.execute(request());
                assertEquals(ExitClassification.EXECUTION_FAILED, result.classification());
                assertEquals("daemon gone", result.failureReason());
            }
            assertEquals(1, backend.destroyed.get());
        }

        @Test
        @DisplayName("explicit destroy bypasses reset")
        void explicitDestroy() {
            pool(2, 5_000, 0);
            SandboxLease lease = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1");

            lease.destroy();
            lease.close();

            assertEquals(1, backend.destroyed.get());
            assertEquals(0, backend.resets.get());
        }

        @Test
        @DisplayName("leases that never start executing are reaped")
        void leakReaper() throws Exception {
            pool(2, 50, 0);
            SandboxLease leaked = pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "forgetful");

            Thread.sleep(100);
            pool.maintain();

            assertEquals(1, backend.destroyed.get());
            assertEquals(1, backend.kills.get());
            assertThrows(IllegalStateException.class, () -> leaked.execute(request()));
            leaked.close();
            assertEquals(0, backend.resets.get());
        }

        @Test
        @DisplayName("shutdown destroys every instance")
        void shutdownDestroysAll() {
            pool(3, 5_000, 3);
            pool.maintain();

            pool.shutdown();

            assertEquals(3, backend.destroyed.get());
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        @DisplayName("instances are pre-created up to the target size")
        void prewarm() {
            pool(5, 5_000, 2);

            pool.maintain();

            PoolStats stats = pool.snapshot().get(0);
            assertEquals(IsolationLevel.CONTAINER, stats.level());
            assertEquals(2, stats.idle());
            assertEquals(2, stats.total());
            assertEquals(2, stats.targetSize());
            assertTrue(stats.backendAvailable());
        }

        @Test
        @DisplayName("pre-creation stops quietly when the backend fails")
        void prewarmFailure() {
            pool(5, 5_000, 2);
            backend.failCreate.set(true);

            pool.maintain();

            assertEquals(0, pool.snapshot().get(0).total());
        }

        @Test
        @DisplayName("only levels with a backend are reported")
        void snapshotLevels() {
            pool(5, 5_000, 0);

            assertEquals(1, pool.snapshot().size());
        }

        @Test
        @DisplayName("P99 is taken from the sorted samples")
        void percentile() {
            long[] samples = new long[100];
            for (int i = 0; i < 100; i++) {
                samples[i] = 100 - i;
            }
            assertEquals(99, SandboxPool.percentile99(samples));
            assertEquals(7, SandboxPool.percentile99(new long[] {7}));
        }
    }

    @Nested
    @DisplayName("Unavailable backends")
    class Unavailable {

        @Test
        @DisplayName("acquire surfaces creation failure when the backend is down")
        void backendDown() {
            pool(2, 5_000, 0);
            backend.available.set(false);

            var error = assertThrows(SandboxCreationException.class,
                    () -> pool.acquire(IsolationLevel.CONTAINER, Duration.ofSeconds(1), "req-1"));
            assertEquals(IsolationLevel.CONTAINER, error.getLevel());
            assertFalse(pool.snapshot().get(0).backendAvailable());
        }

        @Test
        @DisplayName("levels without a backend cannot be acquired")
        void noBackend() {
            pool(2, 5_000, 0);

            assertThrows(SandboxCreationException.class,
                    () -> pool.acquire(IsolationLevel.MICRO_VM, Duration.ofSeconds(1), "req-1"));
        }

        @Test
        @DisplayName("two backends for one level are refused")
        void duplicateBackends() {
            assertThrows(IllegalStateException.class, () -> new BackendRegistry(List.of(
                    new FakeSandboxBackend(IsolationLevel.CONTAINER), new FakeSandboxBackend(IsolationLevel.CONTAINER))));
        }
    }
}
