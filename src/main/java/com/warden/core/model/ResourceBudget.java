package com.warden.core.model;

import java.time.Duration;

/**
 * Logical resource ceilings for one sandboxed execution.
 *
 * @param maxMemoryMb  memory ceiling in MB
 * @param maxCpuCores  CPU ceiling in (possibly fractional) cores
 * @param maxProcesses maximum number of live processes in the sandboxed tree
 * @param maxWallTime  wall-clock ceiling for the execution itself
 */
public record ResourceBudget(
    int maxMemoryMb,
    double maxCpuCores,
    int maxProcesses,
    Duration maxWallTime
) {

    public static final ResourceBudget DEFAULT =
            new ResourceBudget(512, 1.0, 64, Duration.ofSeconds(30));

    public ResourceBudget {
        if (maxMemoryMb <= 0) {
            throw new IllegalArgumentException("maxMemoryMb must be positive: " + maxMemoryMb);
        }
        if (maxCpuCores <= 0) {
            throw new IllegalArgumentException("maxCpuCores must be positive: " + maxCpuCores);
        }
        if (maxProcesses <= 0) {
            throw new IllegalArgumentException("maxProcesses must be positive: " + maxProcesses);
        }
        if (maxWallTime == null || maxWallTime.isNegative() || maxWallTime.isZero()) {
            throw new IllegalArgumentException("maxWallTime must be positive");
        }
    }

    public long maxMemoryBytes() {
        return (long) maxMemoryMb * 1024 * 1024;
    }

    /**
     * Clamps every dimension to the given ceiling.
     */
    public ResourceBudget capTo(ResourceBudget ceiling) {
        return new ResourceBudget(
                Math.min(maxMemoryMb, ceiling.maxMemoryMb),
                Math.min(maxCpuCores, ceiling.maxCpuCores),
                Math.min(maxProcesses, ceiling.maxProcesses),
                maxWallTime.compareTo(ceiling.maxWallTime) <= 0 ? maxWallTime : ceiling.maxWallTime);
    }
}
