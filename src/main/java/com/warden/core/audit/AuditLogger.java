package com.warden.core.audit;

import java.time.Duration;

/**
 * Records every security-relevant decision. Implementations must never block the caller of
 * {@link #append} and must never drop an accepted event.
 */
public interface AuditLogger {

    void append(AuditEvent event);

    /**
     * Waits until every event appended so far has reached storage.
     *
     * @return false if the timeout elapsed first
     */
    boolean flush(Duration timeout);

    /** Events accepted but not yet persisted. */
    int backlog();
}
