package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One isolated execution environment. Owned by the {@link SandboxPool}; callers only ever see a
 * {@link SandboxLease}.
 */
public final class SandboxInstance {

    private final String id;
    private final IsolationLevel level;
    private final String nativeId;
    private final Instant createdAt;
    private final AtomicReference<SandboxState> state = new AtomicReference<>(SandboxState.IDLE);
    private final AtomicInteger executions = new AtomicInteger();

    private volatile String leaseOwner;
    private volatile long leasedAtNanos;
    private volatile boolean tainted;

    public SandboxInstance(IsolationLevel level, String nativeId) {
        this(newId(), level, nativeId);
    }

    static String newId() {
        return "sbx-" + UUID.randomUUID().toString().substring(0, 8);
    }

    SandboxInstance(String id, IsolationLevel level, String nativeId) {
        this.id = id;
        this.level = level;
        this.nativeId = nativeId;
        this.createdAt = Instant.now();
    }

    public String id() { return id; }
    public IsolationLevel level() { return level; }
    /** Backend handle: container id, work directory, ... */
    public String nativeId() { return nativeId; }
    public Instant createdAt() { return createdAt; }
    public SandboxState state() { return state.get(); }
    public String leaseOwner() { return leaseOwner; }
    public int executions() { return executions.get(); }
    public boolean isTainted() { return tainted; }

    /** Marks the instance unfit for reuse; it will be destroyed instead of reset. */
    public void taint() {
        this.tainted = true;
    }

    boolean transition(SandboxState from, SandboxState to) {
        return state.compareAndSet(from, to);
    }

    boolean lease(String owner) {
        if (!state.compareAndSet(SandboxState.IDLE, SandboxState.LEASED)) {
            return false;
        }
        leaseOwner = owner;
        leasedAtNanos = System.nanoTime();
        return true;
    }

    boolean startExecution() {
        if (state.compareAndSet(SandboxState.LEASED, SandboxState.EXECUTING)) {
            executions.incrementAndGet();
            return true;
        }
        return false;
    }

    /** Moves a leased or executing instance to CLEANING; false if something else got there first. */
    boolean beginCleaning() {
        return state.compareAndSet(SandboxState.EXECUTING, SandboxState.CLEANING)
                || state.compareAndSet(SandboxState.LEASED, SandboxState.CLEANING);
    }

    void returnToIdle() {
        leaseOwner = null;
        state.set(SandboxState.IDLE);
    }

    /** @return false if the instance was already destroyed */
    boolean markDestroyed() {
        leaseOwner = null;
        return state.getAndSet(SandboxState.DESTROYED) != SandboxState.DESTROYED;
    }

    long leasedForMillis() {
        return (System.nanoTime() - leasedAtNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return id + "[" + level + ", " + state.get() + "]";
    }
}
