package com.warden.core.audit;

import com.warden.core.policy.PolicyHolder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Read side of the audit log plus the daily retention purge.
 */
@Service
public class AuditQueryService {

    private static final Logger log = LoggerFactory.getLogger(AuditQueryService.class);

    private final AuditStore store;
    private final PolicyHolder policyHolder;

    private final ScheduledExecutorService retentionScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "audit-retention");
        t.setDaemon(true);
        return t;
    });

    public AuditQueryService(AuditStore store, PolicyHolder policyHolder) {
        this.store = store;
        this.policyHolder = policyHolder;
    }

    @PostConstruct
    void startRetention() {
        retentionScheduler.scheduleAtFixedRate(this::purgeExpired, 1, 24 * 60, TimeUnit.MINUTES);
    }

    @PreDestroy
    void stopRetention() {
        retentionScheduler.shutdownNow();
    }

    public List<AuditEvent> recent(int count) {
        try {
            return store.recent(count);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    public List<AuditEvent> byType(AuditEventType type, int limit) {
        try {
            return store.eventsByType(type, limit);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    public List<AuditEvent> on(LocalDate date) {
        try {
            return store.eventsOn(date);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    public IntegrityReport verify(LocalDate date) {
        try {
            return store.verify(date == null ? LocalDate.now(ZoneOffset.UTC) : date);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    public int purgeExpired() {
        int days = policyHolder.current().auditRetentionDays();
        try {
            return store.purgeOlderThan(days);
        } catch (IOException e) {
            log.warn("Audit retention purge failed: {}", e.getMessage());
            return 0;
        }
    }
}
