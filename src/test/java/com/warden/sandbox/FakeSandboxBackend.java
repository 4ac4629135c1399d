package com.warden.sandbox;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.IsolationLevel;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * In-memory backend for pool and gateway tests.
 */
public class FakeSandboxBackend implements SandboxBackend {

    private final IsolationLevel level;

    public final AtomicBoolean available = new AtomicBoolean(true);
    public final AtomicBoolean failCreate = new AtomicBoolean();
    public final AtomicBoolean resetResult = new AtomicBoolean(true);
    public final AtomicLong createDelayMillis = new AtomicLong();
    public final AtomicInteger created = new AtomicInteger();
    public final AtomicInteger executed = new AtomicInteger();
    public final AtomicInteger resets = new AtomicInteger();
    public final AtomicInteger kills = new AtomicInteger();
    public final AtomicInteger destroyed = new AtomicInteger();
    public final AtomicReference<BiFunction<SandboxInstance, ExecutionRequest, ExecutionResult>> behaviour =
            new AtomicReference<>();

    public FakeSandboxBackend(IsolationLevel level) {
        this.level = level;
        behaviour.set((instance, request) -> ExecutionResult.success("ok", level, instance.id(), 1, 1024));
    }

    @Override
    public IsolationLevel level() {
        return level;
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public SandboxInstance create() {
        if (failCreate.get()) {
            throw new SandboxCreationException(level, "fake create failure");
        }
        long delay = createDelayMillis.get();
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SandboxCreationException(level, "interrupted while creating");
            }
        }
        created.incrementAndGet();
        return new SandboxInstance(level, "fake-" + created.get());
    }

    @Override
    public ExecutionResult execute(SandboxInstance instance, ExecutionRequest request) {
        executed.incrementAndGet();
        return behaviour.get().apply(instance, request);
    }

    @Override
    public boolean reset(SandboxInstance instance) {
        resets.incrementAndGet();
        return resetResult.get();
    }

    @Override
    public void kill(SandboxInstance instance) {
        kills.incrementAndGet();
    }

    @Override
    public void destroy(SandboxInstance instance) {
        destroyed.incrementAndGet();
    }
}
