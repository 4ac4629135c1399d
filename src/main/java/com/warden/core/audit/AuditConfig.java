package com.warden.core.audit;

import com.warden.core.events.EventBus;
import com.warden.core.metrics.GatewayMetrics;
import com.warden.core.policy.GatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the JSON-lines store behind the asynchronous audit logger.
 */
@Configuration
public class AuditConfig {

    @Bean
    public AuditStore auditStore(GatewayProperties properties) {
        return new JsonlAuditStore(Path.of(properties.getAudit().getDirectory()));
    }

    @Bean
    public AsyncAuditLogger auditLogger(AuditStore store, EventBus eventBus, GatewayMetrics metrics,
                                        GatewayProperties properties) {
        var audit = properties.getAudit();
        return new AsyncAuditLogger(store, eventBus, metrics,
                audit.getRetryIntervalMillis(), audit.getAlertAfterFailures(), audit.getBatchSize());
    }
}
