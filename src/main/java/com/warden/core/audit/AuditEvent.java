package com.warden.core.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit record. Carries the content hash, never the content itself.
 *
 * @param eventId         unique id
 * @param timestamp       when the event was created
 * @param eventType       category
 * @param sourceComponent component that produced the event
 * @param requestId       request the event belongs to, empty for system events
 * @param context         snapshot of the security context (user, session, isolation level, budget)
 * @param contentHash     SHA-256 of the validated content, empty when not applicable
 * @param decision        e.g. APPROVED, REJECTED, EXECUTED, ALLOWED, DENIED
 * @param durationMillis  timing of the recorded operation
 * @param resourceUsage   e.g. wall time and peak memory of an execution
 * @param violations      violations in "KIND: detail" form
 * @param details         anything else worth keeping (degradation, layer results)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEvent(
    String eventId,
    Instant timestamp,
    AuditEventType eventType,
    String sourceComponent,
    String requestId,
    Map<String, Object> context,
    String contentHash,
    String decision,
    long durationMillis,
    Map<String, Object> resourceUsage,
    List<String> violations,
    Map<String, Object> details
) {

    public AuditEvent {
        eventId = eventId == null ? UUID.randomUUID().toString() : eventId;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        requestId = requestId == null ? "" : requestId;
        context = context == null ? Map.of() : Map.copyOf(context);
        contentHash = contentHash == null ? "" : contentHash;
        decision = decision == null ? "" : decision;
        resourceUsage = resourceUsage == null ? Map.of() : Map.copyOf(resourceUsage);
        violations = violations == null ? List.of() : List.copyOf(violations);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static Builder builder(AuditEventType type, String sourceComponent) {
        return new Builder(type, sourceComponent);
    }

    public static final class Builder {
        private final AuditEventType type;
        private final String sourceComponent;
        private String requestId;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private String contentHash;
        private String decision;
        private long durationMillis;
        private final Map<String, Object> resourceUsage = new LinkedHashMap<>();
        private List<String> violations = List.of();
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(AuditEventType type, String sourceComponent) {
            this.type = type;
            this.sourceComponent = sourceComponent;
        }

        public Builder requestId(String requestId) { this.requestId = requestId; return this; }
        public Builder context(String key, Object value) { putIfPresent(context, key, value); return this; }
        public Builder contentHash(String contentHash) { this.contentHash = contentHash; return this; }
        public Builder decision(String decision) { this.decision = decision; return this; }
        public Builder durationMillis(long durationMillis) { this.durationMillis = durationMillis; return this; }
        public Builder resource(String key, Object value) { putIfPresent(resourceUsage, key, value); return this; }
        public Builder violations(List<String> violations) { this.violations = violations; return this; }
        public Builder detail(String key, Object value) { putIfPresent(details, key, value); return this; }

        public AuditEvent build() {
            return new AuditEvent(null, Instant.now(), type, sourceComponent, requestId, context,
                    contentHash, decision, durationMillis, resourceUsage, violations, details);
        }

        private static void putIfPresent(Map<String, Object> map, String key, Object value) {
            if (value != null) {
                map.put(key, value);
            }
        }
    }
}
