package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;

/**
 * A backend could not create an isolated environment.
 */
public class SandboxCreationException extends RuntimeException {

    private final IsolationLevel level;

    public SandboxCreationException(IsolationLevel level, String message) {
        super(message);
        this.level = level;
    }

    public SandboxCreationException(IsolationLevel level, String message, Throwable cause) {
        super(message, cause);
        this.level = level;
    }

    public IsolationLevel getLevel() {
        return level;
    }
}
