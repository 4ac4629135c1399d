package com.warden.core.resource;

import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;

import java.time.Duration;
import java.util.List;

/**
 * Backend-ready enforcement directives derived from a {@link ResourceBudget} after it was capped
 * to the ceiling of the isolation level.
 *
 * @param budget           the effective (capped) budget
 * @param level            isolation level the plan was made for
 * @param memoryBytes      hard memory limit
 * @param nanoCpus         CPU limit in units of 10<sup>-9</sup> cores (docker {@code NanoCpus})
 * @param cpuPeriodMicros  CFS period
 * @param cpuQuotaMicros   CFS quota per period
 * @param pidsLimit        maximum live processes
 * @param wallTime         wall-clock limit
 * @param cpuSeconds       CPU-time rlimit, wall time rounded up plus one second of slack
 */
public record EnforcementPlan(
    ResourceBudget budget,
    IsolationLevel level,
    long memoryBytes,
    long nanoCpus,
    long cpuPeriodMicros,
    long cpuQuotaMicros,
    long pidsLimit,
    Duration wallTime,
    long cpuSeconds
) {

    /** Arguments for {@code prlimit} placed before the sandboxed command. */
    public List<String> prlimitArgs() {
        return List.of(
                "--data=" + memoryBytes,
                "--nproc=" + pidsLimit,
                "--cpu=" + cpuSeconds,
                "--core=0");
    }
}
