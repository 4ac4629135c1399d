package com.warden.core.resource;

import java.util.Optional;

/**
 * Samples the resource usage of one running execution. Implemented per backend.
 */
@FunctionalInterface
public interface ResourceProbe {

    /**
     * @return the current usage, or empty when the execution has already ended
     * @throws Exception if the backend could not be queried; the monitor retries on the next tick
     */
    Optional<ResourceSample> sample() throws Exception;
}
