package com.warden.core.model;

import java.util.Optional;

/**
 * Strength of the sandbox technology used for a request, declared strongest to weakest.
 * The declaration order is the degradation ladder.
 */
public enum IsolationLevel {
    MICRO_VM,
    USERSPACE_KERNEL,
    CONTAINER,
    NAMESPACE_SANDBOX,
    NONE_AST_ONLY;

    /** The next weaker level, or empty if this is already the weakest. */
    public Optional<IsolationLevel> weaker() {
        IsolationLevel[] all = values();
        return ordinal() + 1 < all.length ? Optional.of(all[ordinal() + 1]) : Optional.empty();
    }

    public boolean isStrongerThan(IsolationLevel other) {
        return ordinal() < other.ordinal();
    }

    public boolean isWeakerThan(IsolationLevel other) {
        return ordinal() > other.ordinal();
    }

    /** NONE_AST_ONLY never runs anything. */
    public boolean executes() {
        return this != NONE_AST_ONLY;
    }
}
