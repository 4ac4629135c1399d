package com.warden.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Statistics;
import com.warden.core.resource.ResourceProbe;
import com.warden.core.resource.ResourceSample;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Samples memory and live processes of a sandbox container from one-shot docker stats.
 */
class DockerResourceProbe implements ResourceProbe {

    private final DockerClient dockerClient;
    private final String containerId;

    DockerResourceProbe(DockerClient dockerClient, String containerId) {
        this.dockerClient = dockerClient;
        this.containerId = containerId;
    }

    @Override
    public Optional<ResourceSample> sample() throws Exception {
        var latest = new AtomicReference<Statistics>();
        try (var callback = dockerClient.statsCmd(containerId).withNoStream(true)
                .exec(new ResultCallback.Adapter<Statistics>() {
                    @Override
                    public void onNext(Statistics stats) {
                        latest.set(stats);
                    }
                })) {
            callback.awaitCompletion(2, TimeUnit.SECONDS);
        }
        Statistics stats = latest.get();
        if (stats == null || stats.getMemoryStats() == null || stats.getMemoryStats().getUsage() == null) {
            return Optional.empty();
        }
        int processes = -1;
        if (stats.getPidsStats() != null && stats.getPidsStats().getCurrent() != null) {
            // minus the idle "sleep infinity"
            processes = (int) Math.max(0, stats.getPidsStats().getCurrent() - 1);
        }
        return Optional.of(new ResourceSample(stats.getMemoryStats().getUsage(), processes, Instant.now()));
    }
}
