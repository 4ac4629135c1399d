package com.warden.sandbox;

import com.warden.core.model.IsolationLevel;

/**
 * Point-in-time view of one level's pool.
 */
public record PoolStats(
    IsolationLevel level,
    int targetSize,
    int total,
    int idle,
    int leased,
    int executing,
    int waiting,
    boolean backendAvailable
) {}
