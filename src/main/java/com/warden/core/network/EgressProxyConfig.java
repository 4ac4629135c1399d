package com.warden.core.network;

import com.warden.core.policy.GatewayProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Starts the egress proxy when {@code warden.gateway.network.proxy.enabled=true}. Without it,
 * sandboxes have no network at all.
 */
@Configuration
@ConditionalOnProperty(prefix = "warden.gateway.network.proxy", name = "enabled", havingValue = "true")
public class EgressProxyConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public EgressProxy egressProxy(NetworkGuard networkGuard, GatewayProperties properties) {
        GatewayProperties.Proxy proxy = properties.getNetwork().getProxy();
        return new EgressProxy(networkGuard, proxy.getBindAddress(), proxy.getPort(),
                proxy.getConnectTimeoutMillis(), proxy.getMaxConnections());
    }
}
