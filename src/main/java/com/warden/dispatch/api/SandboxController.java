package com.warden.dispatch.api;

import com.warden.core.gateway.DegradationLadder;
import com.warden.core.gateway.SecurityGateway;
import com.warden.core.model.IsolationLevel;
import com.warden.sandbox.PoolStats;
import com.warden.sandbox.SandboxPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for sandbox pool occupancy and the degradation ladder.
 */
@RestController
@RequestMapping("/api/v1/sandboxes")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxPool pool;
    private final DegradationLadder ladder;
    private final SecurityGateway gateway;

    public SandboxController(SandboxPool pool, DegradationLadder ladder, SecurityGateway gateway) {
        this.pool = pool;
        this.ladder = ladder;
        this.gateway = gateway;
    }

    @GetMapping
    public Map<String, Object> listSandboxes() {
        Map<String, Object> body = new LinkedHashMap<>();
        List<PoolStats> pools = pool.snapshot();
        body.put("pools", pools);
        body.put("levels", ladder.status());
        return body;
    }

    /**
     * POST /api/v1/sandboxes/{level}/reset. Operator reset of a level marked down.
     */
    @PostMapping("/{level}/reset")
    public Map<String, Object> resetLevel(@PathVariable String level) {
        IsolationLevel parsed = IsolationLevel.valueOf(level.toUpperCase());
        boolean reset = gateway.resetLevel(parsed, "api");
        log.info("Reset of {} requested via API (was down: {})", parsed, reset);
        return Map.of("level", parsed.name(), "reset", reset);
    }
}
