package com.warden.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An outbound gateway event, consumed by monitoring and alerting subscribers.
 *
 * @param eventType one of the {@link GatewayEvents} constants
 * @param requestId the request this event relates to (nullable for pool or policy events)
 * @param component the calling or emitting component
 * @param payload   context needed to act on the event without re-deriving it
 * @param timestamp when the event occurred
 */
public record GatewayEvent(
    String eventType,
    String requestId,
    String component,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public GatewayEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static GatewayEvent of(String eventType, String requestId, String component, Map<String, Object> payload) {
        return new GatewayEvent(eventType, requestId, component, payload, Instant.now());
    }
}
