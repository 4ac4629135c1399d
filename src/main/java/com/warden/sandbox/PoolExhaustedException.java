package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;

/**
 * No instance of the requested level became available before the caller's deadline.
 */
public class PoolExhaustedException extends RuntimeException {

    private final IsolationLevel level;

    public PoolExhaustedException(IsolationLevel level, String message) {
        super(message);
        this.level = level;
    }

    public IsolationLevel getLevel() {
        return level;
    }
}
