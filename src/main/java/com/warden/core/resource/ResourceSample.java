package com.warden.core.resource;

import java.time.Instant;

/**
 * One observation of a running sandboxed process tree.
 *
 * @param memoryBytes resident memory of the whole tree
 * @param processes   live processes in the tree, -1 when the probe cannot tell
 * @param at          when the sample was taken
 */
public record ResourceSample(long memoryBytes, int processes, Instant at) {}
