package com.warden.core.resource;

import java.util.Optional;

/**
 * Additional per-execution condition evaluated on every monitor tick, such as repeated denied
 * network attempts.
 */
@FunctionalInterface
public interface BreachCheck {

    Optional<Breach> evaluate();
}
