package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;

/**
 * Creating an instance did not finish before the caller's deadline. The creation keeps running
 * and the instance joins the pool's idle set when it completes.
 */
public class SandboxCreationTimeoutException extends RuntimeException {

    private final IsolationLevel level;

    public SandboxCreationTimeoutException(IsolationLevel level, String message) {
        super(message);
        this.level = level;
    }

    public IsolationLevel getLevel() {
        return level;
    }
}
