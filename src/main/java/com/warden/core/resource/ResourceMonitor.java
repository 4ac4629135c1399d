package com.warden.core.resource;

import com.warden.core.model.ExitClassification;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Continuous breach detection for running executions. Each watched execution is sampled on a
 * fixed interval; the first breach of any dimension is recorded and handed to the backend's
 * kill hook exactly once.
 */
@Component
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final long intervalMillis;
    private final ScheduledExecutorService scheduler;

    public ResourceMonitor(@Value("${warden.sandbox.monitor-interval-millis:50}") long intervalMillis) {
        this.intervalMillis = intervalMillis;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "resource-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts watching an execution.
     *
     * @param probe    usage sampler of the execution
     * @param plan     limits to enforce
     * @param checks   extra conditions evaluated on every tick
     * @param onBreach invoked once, from the monitor thread, with the first breach
     */
    public Watch watch(ResourceProbe probe, EnforcementPlan plan, List<BreachCheck> checks, Consumer<Breach> onBreach) {
        var watch = new Watch(System.nanoTime());
        Runnable tick = () -> {
            if (watch.breach.get() != null) {
                return;
            }
            Optional<Breach> breach = evaluate(watch, probe, plan, checks);
            if (breach.isPresent() && watch.breach.compareAndSet(null, breach.get())) {
                log.warn("Resource breach: {} ({})", breach.get().classification(), breach.get().detail());
                try {
                    onBreach.accept(breach.get());
                } catch (Exception e) {
                    log.error("Breach handler failed: {}", e.getMessage(), e);
                }
                watch.close();
            }
        };
        watch.future = scheduler.scheduleAtFixedRate(tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        return watch;
    }

    private Optional<Breach> evaluate(Watch watch, ResourceProbe probe, EnforcementPlan plan, List<BreachCheck> checks) {
        long elapsedMillis = (System.nanoTime() - watch.startNanos) / 1_000_000;
        if (elapsedMillis > plan.wallTime().toMillis()) {
            return Optional.of(new Breach(ExitClassification.TIMEOUT_EXCEEDED,
                    "wall time " + elapsedMillis + "ms exceeded limit " + plan.wallTime().toMillis() + "ms"));
        }
        try {
            Optional<ResourceSample> sample = probe.sample();
            if (sample.isPresent()) {
                ResourceSample s = sample.get();
                watch.peakMemory.accumulateAndGet(s.memoryBytes(), Math::max);
                if (s.memoryBytes() >= plan.memoryBytes()) {
                    return Optional.of(new Breach(ExitClassification.MEMORY_EXCEEDED,
                            "memory " + s.memoryBytes() + " bytes reached limit " + plan.memoryBytes()));
                }
                if (s.processes() > plan.pidsLimit()) {
                    return Optional.of(new Breach(ExitClassification.PROCESS_LIMIT_EXCEEDED,
                            s.processes() + " processes exceeded limit " + plan.pidsLimit()));
                }
            }
        } catch (Exception e) {
            log.debug("Resource probe failed, retrying next tick: {}", e.getMessage());
        }
        for (BreachCheck check : checks) {
            Optional<Breach> extra = check.evaluate();
            if (extra.isPresent()) {
                return extra;
            }
        }
        return Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * Handle of one watched execution. Closing it stops sampling; the recorded breach and peak
     * remain readable.
     */
    public static final class Watch implements AutoCloseable {
        private final long startNanos;
        private final AtomicReference<Breach> breach = new AtomicReference<>();
        private final AtomicLong peakMemory = new AtomicLong();
        private volatile ScheduledFuture<?> future;

        private Watch(long startNanos) {
            this.startNanos = startNanos;
        }

        public Optional<Breach> breach() {
            return Optional.ofNullable(breach.get());
        }

        public long peakMemoryBytes() {
            return peakMemory.get();
        }

        /** Records a peak observed outside the monitor, e.g. from final container stats. */
        public void observeMemory(long bytes) {
            peakMemory.accumulateAndGet(bytes, Math::max);
        }

        @Override
        public void close() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
