package com.warden.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.resource.Breach;
import com.warden.core.resource.EnforcementPlan;
import com.warden.core.resource.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based backend. One class serves three isolation levels; they differ only in the OCI
 * runtime the container is created with ({@code kata-fc} for MICRO_VM, {@code runsc} for
 * USERSPACE_KERNEL, the daemon default for CONTAINER).
 *
 * <p>Each instance is a long-lived container configured with:
 * <ul>
 *   <li>network mode {@code none}, or the egress network when one is configured</li>
 *   <li>a read-only root filesystem and a small tmpfs at {@code /tmp}</li>
 *   <li>all capabilities dropped and {@code no-new-privileges}</li>
 *   <li>an unprivileged user and the level's memory, CPU and pids ceiling</li>
 * </ul>
 * Content runs through {@code docker exec} after the container's limits are tightened to the
 * request's plan.
 */
public class DockerSandboxBackend implements SandboxBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxBackend.class);

    static final String LABEL_SANDBOX = "warden.sandbox";
    static final String LABEL_LEVEL = "warden.level";

    private final DockerClient dockerClient;
    private final IsolationLevel level;
    private final String runtime;
    private final SandboxProperties properties;
    private final SandboxRuntime sandboxRuntime;
    private final ResourceMonitor monitor;
    private final PolicyHolder policyHolder;
    private final GatewayProperties.Proxy proxy;

    private volatile long availabilityCheckedAt;
    private volatile boolean available;

    public DockerSandboxBackend(DockerClient dockerClient, IsolationLevel level, String runtime,
                                SandboxProperties properties, SandboxRuntime sandboxRuntime,
                                ResourceMonitor monitor, PolicyHolder policyHolder,
                                GatewayProperties.Proxy proxy) {
        this.dockerClient = dockerClient;
        this.level = level;
        this.runtime = runtime == null ? "" : runtime;
        this.properties = properties;
        this.sandboxRuntime = sandboxRuntime;
        this.monitor = monitor;
        this.policyHolder = policyHolder;
        this.proxy = proxy;
    }

    @Override
    public IsolationLevel level() {
        return level;
    }

    @Override
    public boolean isAvailable() {
        long now = System.currentTimeMillis();
        if (now - availabilityCheckedAt < properties.getAvailabilityCacheMillis()) {
            return available;
        }
        try {
            dockerClient.pingCmd().exec();
            available = true;
        } catch (Exception e) {
            log.warn("Docker daemon unreachable for {}: {}", level, e.getMessage());
            available = false;
        }
        availabilityCheckedAt = now;
        return available;
    }

    @Override
    public SandboxInstance create() {
        ResourceBudget ceiling = policyHolder.current().ceilingFor(level);
        boolean egress = !properties.getEgressNetwork().isBlank();

        var hostConfig = HostConfig.newHostConfig()
                .withNetworkMode(egress ? properties.getEgressNetwork() : "none")
                .withReadonlyRootfs(true)
                .withTmpFs(Map.of("/tmp", "rw,noexec,nosuid,nodev,size=64m"))
                .withCapDrop(Capability.ALL)
                .withSecurityOpts(List.of("no-new-privileges"))
                .withMemory(ceiling.maxMemoryBytes())
                .withMemorySwap(ceiling.maxMemoryBytes())
                .withNanoCPUs(Math.round(ceiling.maxCpuCores() * 1_000_000_000L))
                .withPidsLimit((long) ceiling.maxProcesses() + 1);
        if (!runtime.isBlank()) {
            hostConfig.withRuntime(runtime);
        }

        String sandboxId = SandboxInstance.newId();
        String containerName = "warden-" + level.name().toLowerCase().replace('_', '-') + "-" + sandboxId;
        String containerId = null;
        try {
            var response = dockerClient.createContainerCmd(properties.getImage())
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withUser(properties.getContainerUser())
                    .withWorkingDir("/tmp")
                    .withNetworkDisabled(!egress)
                    .withLabels(Map.of(LABEL_SANDBOX, sandboxId, LABEL_LEVEL, level.name()))
                    .withCmd("sleep", "infinity")
                    .exec();
            containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
        } catch (DockerException | IllegalArgumentException e) {
            if (containerId != null) {
                removeQuietly(containerId);
            }
            throw new SandboxCreationException(level,
                    "Cannot create " + level + " container (runtime '" + runtime + "'): " + e.getMessage(), e);
        }
        log.info("Sandbox {} started as container {} ({})", sandboxId, shortId(containerId), level);
        return new SandboxInstance(sandboxId, level, containerId);
    }

    @Override
    public ExecutionResult execute(SandboxInstance instance, ExecutionRequest request) {
        String containerId = instance.nativeId();
        EnforcementPlan plan = request.plan();
        long start = System.nanoTime();

        applyPlan(containerId, plan);

        var cmd = new ArrayList<>(sandboxRuntime.command(properties.getContainerPython()));
        cmd.addAll(sandboxRuntime.payloadArguments(sandboxRuntime.payload(request)));
        var env = new ArrayList<String>();
        env.add("PYTHONDONTWRITEBYTECODE=1");
        String proxyUrl = properties.egressProxyUrl(request.requestId(), proxy.getAdvertisedHost(), proxy.getPort());
        if (!proxyUrl.isEmpty()) {
            env.add("HTTP_PROXY=" + proxyUrl);
            env.add("HTTPS_PROXY=" + proxyUrl);
        }

        ExecCreateCmdResponse exec;
        var output = new ExecOutput(sandboxRuntime.outputLimitBytes());
        try {
            exec = dockerClient.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withUser(properties.getContainerUser())
                    .withEnv(env)
                    .withCmd(cmd.toArray(new String[0]))
                    .exec();
            dockerClient.execStartCmd(exec.getId()).exec(output);
        } catch (DockerException e) {
            instance.taint();
            log.warn("Exec in sandbox {} failed to start: {}", instance.id(), e.getMessage());
            return ExecutionResult.failure(ExitClassification.EXECUTION_FAILED,
                    "cannot start execution: " + e.getMessage(), level, instance.id(),
                    elapsedMillis(start), 0, -1);
        }

        var watch = monitor.watch(new DockerResourceProbe(dockerClient, containerId), plan,
                request.checks(), breach -> kill(instance));
        boolean finished;
        try {
            finished = output.awaitCompletion(request.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = false;
        } finally {
            watch.close();
        }

        Breach breach = watch.breach().orElse(null);
        int exitCode = -1;
        if (!finished) {
            kill(instance);
        } else if (breach == null) {
            exitCode = exitCodeOf(exec.getId());
        }
        if (!finished || breach != null) {
            instance.taint();
        }
        return sandboxRuntime.interpret(new SandboxRuntime.RunOutcome(
                exitCode, output.stdout(), output.stderr(), breach, !finished,
                elapsedMillis(start), watch.peakMemoryBytes(), plan.memoryBytes(), level, instance.id()));
    }

    private void applyPlan(String containerId, EnforcementPlan plan) {
        try {
            dockerClient.updateContainerCmd(containerId)
                    .withMemory(plan.memoryBytes())
                    .withMemorySwap(plan.memoryBytes())
                    .withCpuPeriod((int) plan.cpuPeriodMicros())
                    .withCpuQuota((int) plan.cpuQuotaMicros())
                    .exec();
        } catch (DockerException e) {
            // The level ceiling set at creation and the monitor still apply.
            log.warn("Cannot tighten limits of container {}: {}", shortId(containerId), e.getMessage());
        }
    }

    private int exitCodeOf(String execId) {
        try {
            Long code = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return code == null ? -1 : code.intValue();
        } catch (DockerException e) {
            log.warn("Cannot read exit code of exec {}: {}", execId, e.getMessage());
            return -1;
        }
    }

    @Override
    public boolean reset(SandboxInstance instance) {
        String containerId = instance.nativeId();
        try {
            var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            if (state == null || !Boolean.TRUE.equals(state.getRunning())) {
                return false;
            }
            var exec = dockerClient.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withUser(properties.getContainerUser())
                    .withCmd("sh", "-c", "rm -rf /tmp/* /tmp/.[!.]* 2>/dev/null; true")
                    .exec();
            var output = new ExecOutput(4096);
            dockerClient.execStartCmd(exec.getId()).exec(output);
            if (!output.awaitCompletion(5, TimeUnit.SECONDS) || exitCodeOf(exec.getId()) != 0) {
                return false;
            }
            // Only the idle "sleep infinity" may survive a run.
            var top = dockerClient.topContainerCmd(containerId).exec();
            return top.getProcesses() == null || top.getProcesses().length <= 1;
        } catch (DockerException e) {
            log.warn("Reset of sandbox {} failed: {}", instance.id(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void kill(SandboxInstance instance) {
        try {
            dockerClient.killContainerCmd(instance.nativeId()).exec();
            log.info("Killed container of sandbox {}", instance.id());
        } catch (DockerException e) {
            log.debug("Container of sandbox {} may already be stopped: {}", instance.id(), e.getMessage());
        }
    }

    @Override
    public void destroy(SandboxInstance instance) {
        removeQuietly(instance.nativeId());
        log.info("Sandbox {} torn down", instance.id());
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).withRemoveVolumes(true).exec();
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", shortId(containerId));
        } catch (DockerException e) {
            log.warn("Failed to remove container {}", shortId(containerId), e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String shortId(String containerId) {
        return containerId == null || containerId.length() <= 12 ? String.valueOf(containerId) : containerId.substring(0, 12);
    }

    /** Collects demultiplexed exec output up to a byte limit per stream. */
    static class ExecOutput extends ResultCallback.Adapter<Frame> {
        private final int limit;
        private final StringBuilder stdout = new StringBuilder();
        private final StringBuilder stderr = new StringBuilder();

        ExecOutput(int limit) {
            this.limit = limit;
        }

        @Override
        public void onNext(Frame frame) {
            var target = frame.getStreamType() == StreamType.STDERR ? stderr : stdout;
            synchronized (this) {
                if (target.length() < limit) {
                    target.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                }
            }
        }

        synchronized String stdout() {
            return stdout.toString();
        }

        synchronized String stderr() {
            return stderr.toString();
        }
    }
}
