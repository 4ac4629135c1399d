package com.warden.core.validation;

import com.warden.core.policy.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Operators that EXPRESSION content may call. Owned by the factor-expression subsystem and
 * versioned independently of the gateway policy; a replacement swaps the whole set at once.
 */
@Component
public class OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * One published version of the operator set.
     */
    public record OperatorSet(String version, Set<String> names) {
        public OperatorSet {
            if (version == null || version.isBlank()) {
                throw new IllegalArgumentException("operator set version is required");
            }
            names = Set.copyOf(names);
        }
    }

    private final AtomicReference<OperatorSet> current;

    @Autowired
    public OperatorRegistry(GatewayProperties properties) {
        this(properties.getOperators().getVersion(), properties.getOperators().getNames());
    }

    public OperatorRegistry(String version, Collection<String> names) {
        this.current = new AtomicReference<>(build(version, names));
    }

    public OperatorSet current() {
        return current.get();
    }

    public boolean contains(String name) {
        return current.get().names().contains(name);
    }

    /**
     * Publishes a new operator set.
     *
     * @throws IllegalArgumentException if a name is not a plain identifier
     */
    public OperatorSet replace(String version, Collection<String> names) {
        OperatorSet next = build(version, names);
        OperatorSet previous = current.getAndSet(next);
        log.info("Operator registry {} -> {} ({} operators)", previous.version(), next.version(), next.names().size());
        return next;
    }

    private static OperatorSet build(String version, Collection<String> names) {
        var cleaned = new LinkedHashSet<String>();
        for (String name : names) {
            String trimmed = name == null ? "" : name.trim();
            if (!IDENTIFIER.matcher(trimmed).matches()) {
                throw new IllegalArgumentException("Invalid operator name: " + name);
            }
            cleaned.add(trimmed);
        }
        return new OperatorSet(version, cleaned);
    }
}
