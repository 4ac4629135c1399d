package com.warden.core.gateway;

import com.warden.core.network.NetworkGuard;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.validation.OperatorRegistry;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the effective gateway configuration.
 */
@Service
public class GatewayConfigService {

    private final PolicyHolder policyHolder;
    private final NetworkGuard networkGuard;
    private final OperatorRegistry operatorRegistry;
    private final DegradationLadder ladder;

    public GatewayConfigService(PolicyHolder policyHolder, NetworkGuard networkGuard,
                                OperatorRegistry operatorRegistry, DegradationLadder ladder) {
        this.policyHolder = policyHolder;
        this.networkGuard = networkGuard;
        this.operatorRegistry = operatorRegistry;
        this.ladder = ladder;
    }

    public Map<String, Object> configuration() {
        var view = new LinkedHashMap<String, Object>();
        view.put("policy", policyHolder.current().describe());
        view.put("network", networkGuard.getConfig());
        var operators = operatorRegistry.current();
        view.put("operators", Map.of("version", operators.version(), "names", operators.names().stream().sorted().toList()));
        var degradation = new LinkedHashMap<String, Object>();
        degradation.put("floor", ladder.floor().name());
        ladder.status().forEach(s -> degradation.put(s.level().name(), s.down() ? "DOWN" : "HEALTHY"));
        view.put("degradation", degradation);
        return view;
    }
}
