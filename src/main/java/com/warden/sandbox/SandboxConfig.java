package com.warden.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.warden.core.model.IsolationLevel;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.resource.ResourceMonitor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    public SandboxRuntime sandboxRuntime(ObjectMapper objectMapper, SandboxProperties properties) {
        return new SandboxRuntime(objectMapper, properties.getOutputLimitBytes());
    }

    @Bean
    @ConditionalOnProperty(name = "warden.sandbox.docker-enabled", havingValue = "true", matchIfMissing = true)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /** Firecracker microVMs through the Kata runtime. */
    @Bean
    @ConditionalOnProperty(name = "warden.sandbox.docker-enabled", havingValue = "true", matchIfMissing = true)
    public SandboxBackend microVmBackend(DockerClient dockerClient, SandboxProperties properties,
                                        SandboxRuntime runtime, ResourceMonitor monitor,
                                        PolicyHolder policyHolder, GatewayProperties gateway) {
        return new DockerSandboxBackend(dockerClient, IsolationLevel.MICRO_VM, properties.getMicroVmRuntime(),
                properties, runtime, monitor, policyHolder, gateway.getNetwork().getProxy());
    }

    /** gVisor. */
    @Bean
    @ConditionalOnProperty(name = "warden.sandbox.docker-enabled", havingValue = "true", matchIfMissing = true)
    public SandboxBackend userspaceKernelBackend(DockerClient dockerClient, SandboxProperties properties,
                                                SandboxRuntime runtime, ResourceMonitor monitor,
                                                PolicyHolder policyHolder, GatewayProperties gateway) {
        return new DockerSandboxBackend(dockerClient, IsolationLevel.USERSPACE_KERNEL,
                properties.getUserspaceKernelRuntime(), properties, runtime, monitor, policyHolder,
                gateway.getNetwork().getProxy());
    }

    @Bean
    @ConditionalOnProperty(name = "warden.sandbox.docker-enabled", havingValue = "true", matchIfMissing = true)
    public SandboxBackend containerBackend(DockerClient dockerClient, SandboxProperties properties,
                                          SandboxRuntime runtime, ResourceMonitor monitor,
                                          PolicyHolder policyHolder, GatewayProperties gateway) {
        return new DockerSandboxBackend(dockerClient, IsolationLevel.CONTAINER, properties.getContainerRuntime(),
                properties, runtime, monitor, policyHolder, gateway.getNetwork().getProxy());
    }

    @Bean
    @ConditionalOnProperty(name = "warden.sandbox.namespace-enabled", havingValue = "true", matchIfMissing = true)
    public SandboxBackend namespaceBackend(SandboxProperties properties, SandboxRuntime runtime,
                                          ResourceMonitor monitor) {
        return new NamespaceSandboxBackend(properties, runtime, monitor);
    }

    @Bean
    public SandboxBackend astOnlyBackend() {
        return new AstOnlySandboxBackend();
    }
}
