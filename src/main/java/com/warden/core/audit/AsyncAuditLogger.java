package com.warden.core.audit;

import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.metrics.GatewayMetrics;
import com.warden.core.model.ViolationKind;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking {@link AuditLogger}: {@link #append} only enqueues, a single writer thread drains
 * the queue into the {@link AuditStore} in batches.
 * <p>
 * A batch that fails to persist stays at the head of the line and is retried until storage comes
 * back; nothing is dropped. After a configurable number of consecutive failures an
 * {@code alert.raised} event is published once per outage.
 */
public class AsyncAuditLogger implements AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditLogger.class);

    private final AuditStore store;
    private final EventBus eventBus;
    private final GatewayMetrics metrics;
    private final long retryIntervalMillis;
    private final int alertAfterFailures;
    private final int batchSize;

    private final LinkedBlockingQueue<AuditEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final List<AuditEvent> pending = new ArrayList<>();

    private volatile boolean running;
    private volatile boolean alertRaised;
    private int consecutiveFailures;
    private Thread writer;

    public AsyncAuditLogger(AuditStore store, EventBus eventBus, GatewayMetrics metrics,
                            long retryIntervalMillis, int alertAfterFailures, int batchSize) {
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.retryIntervalMillis = retryIntervalMillis;
        this.alertAfterFailures = alertAfterFailures;
        this.batchSize = Math.max(1, batchSize);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        writer = new Thread(this::drainLoop, "audit-writer");
        writer.setDaemon(true);
        writer.start();
        log.info("Audit writer started (retry={}ms, alertAfter={} failures)", retryIntervalMillis, alertAfterFailures);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        if (!flush(Duration.ofSeconds(5))) {
            log.error("Audit writer stopping with {} unpersisted events", outstanding.get());
        }
        running = false;
        writer.interrupt();
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Audit writer stopped");
    }

    @Override
    public void append(AuditEvent event) {
        Objects.requireNonNull(event, "event");
        outstanding.incrementAndGet();
        queue.offer(event);
        if (metrics != null) {
            metrics.setAuditBacklog(outstanding.get());
        }
    }

    @Override
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outstanding.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    @Override
    public int backlog() {
        return outstanding.get();
    }

    public boolean isAlertRaised() {
        return alertRaised;
    }

    private void drainLoop() {
        while (running || !pending.isEmpty() || !queue.isEmpty()) {
            try {
                if (pending.isEmpty()) {
                    AuditEvent first = queue.poll(200, TimeUnit.MILLISECONDS);
                    if (first == null) {
                        continue;
                    }
                    pending.add(first);
                    queue.drainTo(pending, batchSize - 1);
                }
                writePending();
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
            }
        }
    }

    private void writePending() throws InterruptedException {
        try {
            store.write(List.copyOf(pending));
            int written = pending.size();
            pending.clear();
            int left = outstanding.addAndGet(-written);
            if (metrics != null) {
                metrics.setAuditBacklog(left);
            }
            onSuccess();
        } catch (Exception e) {
            onFailure(e);
            Thread.sleep(retryIntervalMillis);
        }
    }

    private void onSuccess() {
        if (consecutiveFailures > 0) {
            log.info("Audit storage recovered after {} failed attempts", consecutiveFailures);
        }
        consecutiveFailures = 0;
        alertRaised = false;
    }

    private void onFailure(Exception e) {
        consecutiveFailures++;
        if (metrics != null) {
            metrics.recordAuditWriteFailure();
        }
        log.warn("Audit write failed (attempt {}, {} events buffered): {}",
                consecutiveFailures, outstanding.get(), e.getMessage());
        if (consecutiveFailures >= alertAfterFailures && !alertRaised) {
            alertRaised = true;
            log.error("Audit storage unreachable after {} attempts; {} events held in memory",
                    consecutiveFailures, outstanding.get());
            eventBus.publish(GatewayEvent.of(GatewayEvents.ALERT_RAISED, null, "audit-logger", Map.of(
                    "kind", ViolationKind.AUDIT_WRITE_FAILED.name(),
                    "consecutiveFailures", consecutiveFailures,
                    "backlog", outstanding.get(),
                    "error", String.valueOf(e.getMessage()))));
        }
    }
}
