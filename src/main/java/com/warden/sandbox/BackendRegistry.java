package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each isolation level to the backend that implements it.
 */
@Component
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<IsolationLevel, SandboxBackend> backends = new EnumMap<>(IsolationLevel.class);

    public BackendRegistry(List<SandboxBackend> available) {
        for (SandboxBackend backend : available) {
            SandboxBackend previous = backends.putIfAbsent(backend.level(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two sandbox backends registered for " + backend.level()
                        + ": " + previous.getClass().getSimpleName() + " and " + backend.getClass().getSimpleName());
            }
        }
        log.info("Sandbox backends: {}", backends.keySet());
    }

    public Optional<SandboxBackend> find(IsolationLevel level) {
        return Optional.ofNullable(backends.get(level));
    }

    public Set<IsolationLevel> levels() {
        return Collections.unmodifiableSet(backends.keySet());
    }
}
