package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for the security gateway.
 */
@Service
public class GatewayMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger auditBacklog = new AtomicInteger();

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("warden.audit.backlog", auditBacklog);
    }

    public void recordValidation(String contentType, boolean approved, long nanos) {
        Timer.builder("warden.validation.duration")
                .tag("contentType", contentType)
                .tag("result", approved ? "approved" : "rejected")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordExecution(String isolationLevel, String classification, long ms) {
        Timer.builder("warden.execution.duration")
                .tag("isolationLevel", isolationLevel)
                .tag("classification", classification)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAcquire(String isolationLevel, boolean acquired, long nanos) {
        Timer.builder("warden.pool.acquire.duration")
                .description("Time spent waiting for a sandbox lease")
                .tag("isolationLevel", isolationLevel)
                .tag("result", acquired ? "leased" : "exhausted")
                .publishPercentiles(0.99)
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordViolation(String kind) {
        Counter.builder("warden.violations.total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordDegradation(String from, String to) {
        Counter.builder("warden.degradations.total")
                .description("Degradation ladder transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordNetworkDecision(boolean allowed) {
        Counter.builder("warden.network.checks")
                .tag("result", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    public void recordRequest(String outcome, long ms) {
        Timer.builder("warden.requests.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the pool target size after a resize decision.
     */
    public void recordPoolTarget(String isolationLevel, int target) {
        DistributionSummary.builder("warden.pool.target_size")
                .tag("isolationLevel", isolationLevel)
                .register(registry)
                .record(target);
    }

    public void recordAuditWriteFailure() {
        Counter.builder("warden.audit.write_failures")
                .description("Failed attempts to flush audit events to storage")
                .register(registry)
                .increment();
    }

    public void setAuditBacklog(int size) {
        auditBacklog.set(size);
    }
}
