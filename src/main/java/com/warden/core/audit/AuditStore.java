package com.warden.core.audit;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Durable, append-only storage for audit events.
 */
public interface AuditStore {

    /**
     * Persists a batch in order. On failure nothing is considered written and the caller retries
     * the whole batch.
     */
    void write(List<AuditEvent> batch) throws IOException;

    /** The last {@code count} events, oldest first. */
    List<AuditEvent> recent(int count) throws IOException;

    List<AuditEvent> eventsOn(LocalDate date) throws IOException;

    List<AuditEvent> eventsByType(AuditEventType type, int limit) throws IOException;

    IntegrityReport verify(LocalDate date) throws IOException;

    /** Deletes storage older than the retention period and returns how many units were removed. */
    int purgeOlderThan(int retentionDays) throws IOException;
}
