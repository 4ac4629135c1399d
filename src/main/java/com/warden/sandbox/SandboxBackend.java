package com.warden.sandbox;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.IsolationLevel;

/**
 * One isolation technology. The pool and the gateway depend only on this interface, so moving
 * down the degradation ladder is a matter of picking another implementation.
 */
public interface SandboxBackend {

    IsolationLevel level();

    /** Cheap health probe; false makes the pool refuse to create instances. */
    boolean isAvailable();

    /**
     * Creates an idle environment with network denied by default.
     *
     * @throws SandboxCreationException if the environment cannot be created
     */
    SandboxInstance create();

    /**
     * Runs content inside the instance, bounded by the request's deadline and plan. A breached
     * ceiling terminates the run immediately and taints the instance.
     */
    ExecutionResult execute(SandboxInstance instance, ExecutionRequest request);

    /**
     * Wipes ephemeral state after a run.
     *
     * @return false if the instance cannot be safely reused
     */
    boolean reset(SandboxInstance instance);

    /** Forcibly stops whatever runs inside the instance. */
    void kill(SandboxInstance instance);

    /** Releases every resource of the instance. Must tolerate repeated calls. */
    void destroy(SandboxInstance instance);
}
