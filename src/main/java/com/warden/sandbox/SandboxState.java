package com.warden.sandbox;

/**
 * Lifecycle of a pooled instance: {@code IDLE -> LEASED -> EXECUTING -> CLEANING -> IDLE}, or
 * {@code -> DESTROYED} from any state.
 */
public enum SandboxState {
    IDLE,
    LEASED,
    EXECUTING,
    CLEANING,
    DESTROYED
}
