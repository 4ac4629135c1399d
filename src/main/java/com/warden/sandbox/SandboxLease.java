package com.warden.sandbox;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.IsolationLevel;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive right to use one pooled instance. Must be closed on every exit path; closing more
 * than once is harmless.
 */
public final class SandboxLease implements AutoCloseable {

    private final SandboxPool pool;
    private final SandboxInstance instance;
    private final String owner;
    private final AtomicBoolean finished = new AtomicBoolean();

    SandboxLease(SandboxPool pool, SandboxInstance instance, String owner) {
        this.pool = pool;
        this.instance = instance;
        this.owner = owner;
    }

    public String sandboxId() {
        return instance.id();
    }

    public IsolationLevel level() {
        return instance.level();
    }

    public String owner() {
        return owner;
    }

    public boolean isFinished() {
        return finished.get();
    }

    public ExecutionResult execute(ExecutionRequest request) {
        return pool.execute(this, request);
    }

    /** Tears the instance down instead of returning it to the pool. */
    public void destroy() {
        pool.destroy(this);
    }

    /** Like {@link #destroy()}, but the teardown runs in the background and this returns at once. */
    public void abandon() {
        pool.abandon(this);
    }

    @Override
    public void close() {
        pool.release(this);
    }

    SandboxInstance instance() {
        return instance;
    }

    boolean finish() {
        return finished.compareAndSet(false, true);
    }
}
