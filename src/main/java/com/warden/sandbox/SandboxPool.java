package com.warden.sandbox;

import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.metrics.GatewayMetrics;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.IsolationLevel;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.policy.PolicySnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of pre-created sandbox instances, one sub-pool per isolation level.
 *
 * <p>Waiters are served strictly first come, first served. Each level's lock guards only its
 * instance table and wait queue; backend calls (create, reset, execute, destroy) always happen
 * outside it. Creation on behalf of a waiter and teardown of abandoned leases run on a lifecycle
 * executor so a slow backend never holds a caller past its deadline. A background task reaps
 * leaked leases, adapts the target size to observed acquire latency and pre-creates idle
 * instances up to that target.
 */
@Service
public class SandboxPool {

    private static final Logger log = LoggerFactory.getLogger(SandboxPool.class);

    private static final String COMPONENT = "sandbox-pool";
    private static final int LATENCY_SAMPLES = 512;

    private final BackendRegistry registry;
    private final EventBus eventBus;
    private final GatewayMetrics metrics;
    private final Settings settings;
    private final Map<IsolationLevel, LevelPool> pools = new EnumMap<>(IsolationLevel.class);
    private final ExecutorService lifecycle;

    private ScheduledExecutorService maintenance;
    private volatile boolean closed;

    /**
     * Pool tuning.
     *
     * @param maxSize                   hard cap of instances per level
     * @param leaseGraceMillis          a lease that has not started executing after this long is a leak
     * @param acquireP99ThresholdMillis grow the target when P99 acquire latency exceeds this
     * @param idleShrinkTicks           maintenance ticks without demand before shrinking
     * @param maintenanceIntervalMillis period of the maintenance task
     */
    public record Settings(int maxSize, long leaseGraceMillis, long acquireP99ThresholdMillis,
                           int idleShrinkTicks, long maintenanceIntervalMillis) {

        static Settings from(GatewayProperties.Pool pool) {
            return new Settings(pool.getMaxSize(), pool.getLeaseGraceMillis(), pool.getAcquireP99ThresholdMillis(),
                    pool.getIdleShrinkTicks(), pool.getMaintenanceIntervalMillis());
        }
    }

    @Autowired
    public SandboxPool(BackendRegistry registry, PolicyHolder policyHolder, GatewayProperties properties,
                       EventBus eventBus, @Autowired(required = false) GatewayMetrics metrics) {
        this(registry, policyHolder, Settings.from(properties.getPool()), eventBus, metrics);
    }

    public SandboxPool(BackendRegistry registry, PolicyHolder policyHolder, Settings settings,
                       EventBus eventBus, GatewayMetrics metrics) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        for (IsolationLevel level : IsolationLevel.values()) {
            pools.put(level, new LevelPool(level));
        }
        var counter = new AtomicInteger();
        this.lifecycle = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sandbox-lifecycle-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        applyTargets(policyHolder.current());
        policyHolder.addListener(this::applyTargets);
    }

    @PostConstruct
    public void start() {
        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sandbox-pool-maintenance");
            t.setDaemon(true);
            return t;
        });
        maintenance.scheduleWithFixedDelay(this::maintainSafely, 0,
                settings.maintenanceIntervalMillis(), TimeUnit.MILLISECONDS);
        log.info("Sandbox pool started (max {} per level)", settings.maxSize());
    }

    @PreDestroy
    public void shutdown() {
        closed = true;
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        for (LevelPool pool : pools.values()) {
            List<SandboxInstance> instances;
            pool.lock.lock();
            try {
                instances = new ArrayList<>(pool.all.values());
            } finally {
                pool.lock.unlock();
            }
            instances.forEach(instance -> destroyInstance(pool, instance, "pool shutdown"));
        }
        lifecycle.shutdown();
    }

    /**
     * Leases an instance of {@code level}, creating one if the level is below its cap.
     *
     * @throws PoolExhaustedException          if nothing became available within {@code timeout}
     * @throws SandboxCreationException        if the backend could not create a needed instance
     * @throws SandboxCreationTimeoutException if a needed instance was still being created at {@code timeout}
     */
    public SandboxLease acquire(IsolationLevel level, Duration timeout, String owner) {
        SandboxBackend backend = backendFor(level);
        LevelPool pool = pools.get(level);
        long startNanos = System.nanoTime();
        long deadline = startNanos + Math.max(0, timeout.toNanos());

        pool.lock.lock();
        long ticket = pool.nextTicket++;
        pool.waiters.addLast(ticket);
        try {
            while (true) {
                boolean head = pool.waiters.peekFirst() == ticket;
                if (head && !pool.idle.isEmpty()) {
                    pool.waiters.pollFirst();
                    pool.changed.signalAll();
                    return leased(pool, pool.idle.pollFirst(), owner, startNanos);
                }
                if (head && pool.all.size() + pool.creating < settings.maxSize()) {
                    pool.waiters.pollFirst();
                    pool.creating++;
                    pool.changed.signalAll();
                    SandboxInstance created = awaitCreation(pool, backend, deadline, timeout);
                    pool.all.put(created.id(), created);
                    return leased(pool, created, owner, startNanos);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    pool.waiters.remove(ticket);
                    pool.changed.signalAll();
                    if (metrics != null) {
                        metrics.recordAcquire(level.name(), false, System.nanoTime() - startNanos);
                    }
                    throw new PoolExhaustedException(level,
                            "No " + level + " sandbox available within " + timeout.toMillis() + "ms");
                }
                pool.changed.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.waiters.remove(ticket);
            pool.changed.signalAll();
            throw new PoolExhaustedException(level, "Interrupted while waiting for a " + level + " sandbox");
        } finally {
            pool.lock.unlock();
        }
    }

    /**
     * Runs a creation counted in {@code pool.creating} on the lifecycle executor and waits for it
     * until {@code deadline}. Entered and left with the level lock held. A creation that outlives
     * the wait is handed to {@link #adoptLate}, which owns its {@code creating} slot from then on.
     */
    private SandboxInstance awaitCreation(LevelPool pool, SandboxBackend backend, long deadline, Duration timeout)
            throws InterruptedException {
        boolean handedOff = false;
        pool.lock.unlock();
        try {
            CompletableFuture<SandboxInstance> creation;
            try {
                creation = CompletableFuture.supplyAsync(() -> createInstance(backend), lifecycle);
            } catch (RejectedExecutionException e) {
                throw new SandboxCreationException(pool.level, "Sandbox pool is shut down", e);
            }
            try {
                return creation.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                handedOff = true;
                creation.whenComplete((instance, error) -> adoptLate(pool, instance, error));
                if (metrics != null) {
                    metrics.recordAcquire(pool.level.name(), false, timeout.toNanos());
                }
                throw new SandboxCreationTimeoutException(pool.level, "Creating a " + pool.level
                        + " sandbox did not finish within " + timeout.toMillis() + "ms");
            } catch (InterruptedException e) {
                handedOff = true;
                creation.whenComplete((instance, error) -> adoptLate(pool, instance, error));
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof SandboxCreationException creationFailure) {
                    throw creationFailure;
                }
                throw new SandboxCreationException(pool.level, "Backend create failed: " + cause.getMessage(), cause);
            }
        } finally {
            pool.lock.lock();
            if (!handedOff) {
                pool.creating--;
                pool.changed.signalAll();
            }
        }
    }

    /** Completion of a creation whose requester stopped waiting: keep the instance idle, or drop it on shutdown. */
    private void adoptLate(LevelPool pool, SandboxInstance instance, Throwable error) {
        boolean keep = instance != null && !closed;
        pool.lock.lock();
        try {
            pool.creating--;
            if (keep) {
                pool.all.put(instance.id(), instance);
                pool.idle.addLast(instance);
            }
            pool.changed.signalAll();
        } finally {
            pool.lock.unlock();
        }
        if (error != null) {
            Throwable cause = error.getCause() == null ? error : error.getCause();
            log.warn("Abandoned {} sandbox creation failed: {}", pool.level, cause.getMessage());
        } else if (keep) {
            log.info("Sandbox {} finished creating after its requester gave up; kept idle", instance.id());
        } else {
            destroyInstance(pool, instance, "pool shutdown");
        }
    }

    private SandboxLease leased(LevelPool pool, SandboxInstance instance, String owner, long startNanos) {
        if (!instance.lease(owner)) {
            throw new IllegalStateException("Instance " + instance + " handed out while not idle");
        }
        long waited = System.nanoTime() - startNanos;
        pool.latencies[pool.latencyCount++ % LATENCY_SAMPLES] = waited;
        if (metrics != null) {
            metrics.recordAcquire(pool.level.name(), true, waited);
        }
        log.debug("Leased {} to {}", instance.id(), owner);
        return new SandboxLease(this, instance, owner);
    }

    ExecutionResult execute(SandboxLease lease, ExecutionRequest request) {
        SandboxInstance instance = lease.instance();
        if (lease.isFinished() || !instance.startExecution()) {
            throw new IllegalStateException("Lease on " + instance.id() + " is no longer valid");
        }
        SandboxBackend backend = backendFor(instance.level());
        ExecutionResult result;
        try {
            result = backend.execute(instance, request);
        } catch (RuntimeException e) {
            log.error("Backend {} failed executing in {}", backend.level(), instance.id(), e);
            instance.taint();
            return ExecutionResult.failure(ExitClassification.EXECUTION_FAILED, e.getMessage(),
                    instance.level(), instance.id(), 0, 0, -1);
        }
        if (isBreach(result.classification())) {
            instance.taint();
        }
        return result;
    }

    private static boolean isBreach(ExitClassification classification) {
        return classification == ExitClassification.TIMEOUT_EXCEEDED
                || classification == ExitClassification.MEMORY_EXCEEDED
                || classification == ExitClassification.PROCESS_LIMIT_EXCEEDED
                || classification == ExitClassification.NETWORK_VIOLATION;
    }

    /** Resets the instance and returns it to the idle set, or destroys it if it cannot be reused. */
    void release(SandboxLease lease) {
        if (!lease.finish()) {
            return;
        }
        SandboxInstance instance = lease.instance();
        LevelPool pool = pools.get(instance.level());
        if (!instance.beginCleaning()) {
            // Already reaped or destroyed.
            return;
        }
        if (instance.isTainted()) {
            destroyInstance(pool, instance, "tainted by its last execution");
            return;
        }
        if (!resetSafely(instance)) {
            destroyInstance(pool, instance, "reset failed");
            return;
        }
        pool.lock.lock();
        try {
            instance.returnToIdle();
            pool.idle.addLast(instance);
            pool.changed.signalAll();
        } finally {
            pool.lock.unlock();
        }
    }

    void destroy(SandboxLease lease) {
        if (!lease.finish()) {
            return;
        }
        SandboxInstance instance = lease.instance();
        destroyInstance(pools.get(instance.level()), instance, "destroyed by lease holder");
    }

    /**
     * Ends the lease and tears the instance down on the lifecycle executor, for callers that must
     * return before a possibly slow kill and remove complete.
     */
    void abandon(SandboxLease lease) {
        if (!lease.finish()) {
            return;
        }
        SandboxInstance instance = lease.instance();
        instance.taint();
        LevelPool pool = pools.get(instance.level());
        try {
            lifecycle.execute(() -> destroyInstance(pool, instance, "abandoned by lease holder"));
        } catch (RejectedExecutionException e) {
            log.warn("Lifecycle executor closed; destroying {} inline", instance.id());
            destroyInstance(pool, instance, "abandoned by lease holder");
        }
    }

    private boolean resetSafely(SandboxInstance instance) {
        try {
            return backendFor(instance.level()).reset(instance);
        } catch (RuntimeException e) {
            log.warn("Reset of {} threw: {}", instance.id(), e.getMessage());
            return false;
        }
    }

    private SandboxInstance createInstance(SandboxBackend backend) {
        if (!backend.isAvailable()) {
            throw new SandboxCreationException(backend.level(), backend.level() + " backend is unavailable");
        }
        SandboxInstance instance;
        try {
            instance = backend.create();
        } catch (SandboxCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SandboxCreationException(backend.level(), "Backend create failed: " + e.getMessage(), e);
        }
        eventBus.publish(GatewayEvent.of(GatewayEvents.SANDBOX_CREATED, "", COMPONENT, Map.of(
                "sandboxId", instance.id(),
                "isolationLevel", instance.level().name(),
                "nativeId", instance.nativeId())));
        return instance;
    }

    private void destroyInstance(LevelPool pool, SandboxInstance instance, String reason) {
        if (!instance.markDestroyed()) {
            return;
        }
        SandboxBackend backend = backendFor(instance.level());
        try {
            backend.kill(instance);
        } catch (RuntimeException e) {
            log.warn("Kill of {} threw: {}", instance.id(), e.getMessage());
        }
        try {
            backend.destroy(instance);
        } catch (RuntimeException e) {
            log.warn("Destroy of {} threw: {}", instance.id(), e.getMessage());
        }
        pool.lock.lock();
        try {
            pool.all.remove(instance.id());
            pool.idle.remove(instance);
            pool.changed.signalAll();
        } finally {
            pool.lock.unlock();
        }
        log.info("Sandbox {} destroyed: {}", instance.id(), reason);
        eventBus.publish(GatewayEvent.of(GatewayEvents.SANDBOX_DESTROYED, "", COMPONENT, Map.of(
                "sandboxId", instance.id(),
                "isolationLevel", instance.level().name(),
                "reason", reason)));
    }

    private SandboxBackend backendFor(IsolationLevel level) {
        return registry.find(level).orElseThrow(() ->
                new SandboxCreationException(level, "No sandbox backend registered for " + level));
    }

    private void maintainSafely() {
        try {
            maintain();
        } catch (RuntimeException e) {
            log.error("Pool maintenance failed", e);
        }
    }

    /** One maintenance pass: reap leaked leases, resize targets, pre-create idle instances. */
    public void maintain() {
        for (LevelPool pool : pools.values()) {
            if (registry.find(pool.level).isEmpty()) {
                continue;
            }
            reapLeaks(pool);
            resize(pool);
            prewarm(pool);
        }
    }

    private void reapLeaks(LevelPool pool) {
        List<SandboxInstance> leaked = new ArrayList<>();
        pool.lock.lock();
        try {
            for (SandboxInstance instance : pool.all.values()) {
                if (instance.state() == SandboxState.LEASED && instance.leasedForMillis() > settings.leaseGraceMillis()) {
                    leaked.add(instance);
                }
            }
        } finally {
            pool.lock.unlock();
        }
        for (SandboxInstance instance : leaked) {
            if (instance.transition(SandboxState.LEASED, SandboxState.CLEANING)) {
                log.warn("Lease on {} held by {} never started executing; destroying", instance.id(), instance.leaseOwner());
                destroyInstance(pool, instance, "leaked lease");
            }
        }
    }

    private void resize(LevelPool pool) {
        SandboxInstance surplus = null;
        int newTarget;
        pool.lock.lock();
        try {
            int samples = Math.min(pool.latencyCount, LATENCY_SAMPLES);
            long p99Millis = samples == 0 ? 0 : percentile99(Arrays.copyOf(pool.latencies, samples)) / 1_000_000;
            pool.latencyCount = 0;
            int before = pool.target;
            if (samples > 0 && p99Millis > settings.acquireP99ThresholdMillis() && pool.target < settings.maxSize()) {
                pool.target++;
                pool.idleTicks = 0;
                log.info("{} acquire P99 {}ms above {}ms; target size {} -> {}", pool.level, p99Millis,
                        settings.acquireP99ThresholdMillis(), before, pool.target);
            } else if (samples == 0 && pool.waiters.isEmpty() && !pool.idle.isEmpty()) {
                if (++pool.idleTicks >= settings.idleShrinkTicks()) {
                    pool.idleTicks = 0;
                    if (pool.target > pool.baseTarget) {
                        pool.target--;
                        log.info("{} idle; target size {} -> {}", pool.level, before, pool.target);
                    }
                    if (pool.all.size() > pool.target) {
                        surplus = pool.idle.pollLast();
                    }
                }
            } else {
                pool.idleTicks = 0;
            }
            newTarget = pool.target;
            if (newTarget == before) {
                newTarget = -1;
            }
        } finally {
            pool.lock.unlock();
        }
        if (newTarget >= 0 && metrics != null) {
            metrics.recordPoolTarget(pool.level.name(), newTarget);
        }
        if (surplus != null) {
            destroyInstance(pool, surplus, "pool shrink");
        }
    }

    static long percentile99(long[] samples) {
        Arrays.sort(samples);
        int index = (int) Math.ceil(samples.length * 0.99) - 1;
        return samples[Math.max(0, index)];
    }

    private void prewarm(LevelPool pool) {
        SandboxBackend backend = backendFor(pool.level);
        int deficit;
        pool.lock.lock();
        try {
            deficit = Math.min(pool.target, settings.maxSize()) - (pool.all.size() + pool.creating);
            if (deficit <= 0) {
                return;
            }
            pool.creating += deficit;
        } finally {
            pool.lock.unlock();
        }
        int remaining = deficit;
        try {
            for (; remaining > 0; remaining--) {
                SandboxInstance instance = createInstance(backend);
                pool.lock.lock();
                try {
                    pool.creating--;
                    pool.all.put(instance.id(), instance);
                    pool.idle.addLast(instance);
                    pool.changed.signalAll();
                } finally {
                    pool.lock.unlock();
                }
            }
        } catch (SandboxCreationException e) {
            log.warn("Pre-creating {} sandbox failed: {}", pool.level, e.getMessage());
        } finally {
            if (remaining > 0) {
                pool.lock.lock();
                try {
                    pool.creating -= remaining;
                    pool.changed.signalAll();
                } finally {
                    pool.lock.unlock();
                }
            }
        }
    }

    private void applyTargets(PolicySnapshot snapshot) {
        for (LevelPool pool : pools.values()) {
            int base = Math.min(snapshot.poolTargetFor(pool.level), settings.maxSize());
            pool.lock.lock();
            try {
                pool.baseTarget = base;
                pool.target = Math.max(pool.target, base);
            } finally {
                pool.lock.unlock();
            }
        }
    }

    public List<PoolStats> snapshot() {
        List<PoolStats> stats = new ArrayList<>();
        for (LevelPool pool : pools.values()) {
            var backend = registry.find(pool.level);
            if (backend.isEmpty()) {
                continue;
            }
            int leased = 0;
            int executing = 0;
            int target;
            int total;
            int idle;
            int waiting;
            pool.lock.lock();
            try {
                for (SandboxInstance instance : pool.all.values()) {
                    if (instance.state() == SandboxState.LEASED) {
                        leased++;
                    } else if (instance.state() == SandboxState.EXECUTING) {
                        executing++;
                    }
                }
                target = pool.target;
                total = pool.all.size();
                idle = pool.idle.size();
                waiting = pool.waiters.size();
            } finally {
                pool.lock.unlock();
            }
            stats.add(new PoolStats(pool.level, target, total, idle, leased, executing, waiting,
                    backend.get().isAvailable()));
        }
        return stats;
    }

    private static final class LevelPool {
        final IsolationLevel level;
        final ReentrantLock lock = new ReentrantLock();
        final Condition changed = lock.newCondition();
        final ArrayDeque<SandboxInstance> idle = new ArrayDeque<>();
        final Map<String, SandboxInstance> all = new LinkedHashMap<>();
        final ArrayDeque<Long> waiters = new ArrayDeque<>();
        final long[] latencies = new long[LATENCY_SAMPLES];
        int latencyCount;
        long nextTicket;
        int creating;
        int baseTarget;
        int target;
        int idleTicks;

        LevelPool(IsolationLevel level) {
            this.level = level;
        }
    }
}
