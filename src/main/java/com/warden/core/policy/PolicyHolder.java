package com.warden.core.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Holds the active {@link PolicySnapshot}. Readers take the current reference once per request;
 * updates build a new snapshot and swap it atomically, so no reader ever sees a partial policy.
 */
@Component
public class PolicyHolder {

    private static final Logger log = LoggerFactory.getLogger(PolicyHolder.class);

    private final AtomicReference<PolicySnapshot> current;
    private final ObjectMapper objectMapper;
    private final List<Consumer<PolicySnapshot>> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public PolicyHolder(GatewayProperties properties, ObjectMapper objectMapper) {
        this(properties.toSnapshot(), objectMapper);
    }

    public PolicyHolder(PolicySnapshot initial, ObjectMapper objectMapper) {
        this.current = new AtomicReference<>(initial);
        this.objectMapper = objectMapper;
        log.info("Policy version {} active", initial.version());
    }

    public PolicySnapshot current() {
        return current.get();
    }

    /**
     * Parses and applies a JSON policy document.
     *
     * @throws PolicyConfigurationException if the document is malformed or inconsistent
     */
    public PolicySnapshot reload(String json) {
        PolicyDocument doc;
        try {
            doc = objectMapper.readValue(json, PolicyDocument.class);
        } catch (JsonProcessingException e) {
            throw new PolicyConfigurationException("Malformed policy document: " + e.getOriginalMessage(), e);
        }
        if (doc == null || doc.version() == null || doc.version().isBlank()) {
            throw new PolicyConfigurationException("policy document must carry a version");
        }
        return update(snapshot -> snapshot.apply(doc));
    }

    /**
     * Derives a new snapshot from the current one and activates it. If the function throws, the
     * active snapshot is left untouched.
     */
    public PolicySnapshot update(UnaryOperator<PolicySnapshot> change) {
        PolicySnapshot previous;
        PolicySnapshot next;
        do {
            previous = current.get();
            next = change.apply(previous);
        } while (!current.compareAndSet(previous, next));
        log.info("Policy updated: version {} -> {}", previous.version(), next.version());
        for (Consumer<PolicySnapshot> listener : listeners) {
            try {
                listener.accept(next);
            } catch (Exception e) {
                log.warn("Policy listener failed: {}", e.getMessage(), e);
            }
        }
        return next;
    }

    public void addListener(Consumer<PolicySnapshot> listener) {
        listeners.add(listener);
    }
}
