package com.warden.core.gateway;

import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditLogger;
import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.model.IsolationLevel;
import com.warden.core.policy.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-level finite state machine {@code HEALTHY -> DOWN}. A level goes down after a number of
 * consecutive creation failures and stays down for the life of the process unless an operator
 * resets it; nothing resets it automatically.
 */
@Component
public class DegradationLadder {

    private static final Logger log = LoggerFactory.getLogger(DegradationLadder.class);

    private final int failureThreshold;
    private final IsolationLevel floor;
    private final EventBus eventBus;
    private final AuditLogger auditLogger;
    private final Map<IsolationLevel, LevelState> states = new EnumMap<>(IsolationLevel.class);

    /** Health of one level as seen by the ladder. */
    public record LevelStatus(IsolationLevel level, int consecutiveFailures, boolean down) {}

    @Autowired
    public DegradationLadder(GatewayProperties properties, EventBus eventBus, AuditLogger auditLogger) {
        this(properties.getDegradation().getFailureThreshold(), properties.getDegradation().getFloor(),
                eventBus, auditLogger);
    }

    public DegradationLadder(int failureThreshold, IsolationLevel floor, EventBus eventBus, AuditLogger auditLogger) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.floor = floor;
        this.eventBus = eventBus;
        this.auditLogger = auditLogger;
        for (IsolationLevel level : IsolationLevel.values()) {
            states.put(level, new LevelState());
        }
    }

    public IsolationLevel floor() {
        return floor;
    }

    /**
     * The strongest level at or below {@code requested} that is not down, never going below the
     * floor. Empty when every candidate down to the floor is down.
     */
    public synchronized Optional<IsolationLevel> effectiveLevel(IsolationLevel requested) {
        IsolationLevel level = requested;
        while (states.get(level).down) {
            Optional<IsolationLevel> weaker = level.weaker();
            if (weaker.isEmpty() || !level.isStrongerThan(floor)) {
                return Optional.empty();
            }
            level = weaker.get();
        }
        return Optional.of(level);
    }

    /**
     * Counts a creation failure.
     *
     * @return true if this failure took the level down
     */
    public synchronized boolean recordFailure(IsolationLevel level) {
        LevelState state = states.get(level);
        if (state.down) {
            return false;
        }
        state.failures++;
        if (state.failures >= failureThreshold) {
            state.down = true;
            log.warn("{} marked down after {} consecutive creation failures", level, state.failures);
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess(IsolationLevel level) {
        LevelState state = states.get(level);
        if (!state.down) {
            state.failures = 0;
        }
    }

    public synchronized boolean isDown(IsolationLevel level) {
        return states.get(level).down;
    }

    /**
     * Administrative transition back to healthy, to be used once the backend is confirmed
     * healthy again.
     *
     * @return false if the level was not down
     */
    public boolean reset(IsolationLevel level, String operator) {
        synchronized (this) {
            LevelState state = states.get(level);
            if (!state.down) {
                state.failures = 0;
                return false;
            }
            state.down = false;
            state.failures = 0;
        }
        log.warn("{} reset to healthy by {}", level, operator);
        eventBus.publish(GatewayEvent.of(GatewayEvents.DEGRADATION_RESET, "", "degradation-ladder",
                Map.of("isolationLevel", level.name(), "operator", operator)));
        auditLogger.append(AuditEvent.builder(AuditEventType.DEGRADATION, "degradation-ladder")
                .decision("RESET")
                .detail("isolationLevel", level.name())
                .detail("operator", operator)
                .build());
        return true;
    }

    public synchronized List<LevelStatus> status() {
        var result = new ArrayList<LevelStatus>();
        states.forEach((level, state) -> result.add(new LevelStatus(level, state.failures, state.down)));
        return result;
    }

    private static final class LevelState {
        int failures;
        boolean down;
    }
}
