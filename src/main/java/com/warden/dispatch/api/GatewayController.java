package com.warden.dispatch.api;

import com.warden.core.gateway.GatewayConfigService;
import com.warden.core.gateway.SecurityGateway;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST entry point for validating and executing untrusted content.
 */
@RestController
@RequestMapping("/api/v1/gateway")
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    private final SecurityGateway gateway;
    private final GatewayConfigService configService;

    public GatewayController(SecurityGateway gateway, GatewayConfigService configService) {
        this.gateway = gateway;
        this.configService = configService;
    }

    /**
     * POST /api/v1/gateway/validate. Static validation only, never executes.
     */
    @PostMapping("/validate")
    public GatewayResponse validate(@Valid @RequestBody GatewayRequest request) {
        var result = gateway.validateOnly(request.content(), request.contentType(), request.toContext());
        return GatewayResponse.from(result);
    }

    /**
     * POST /api/v1/gateway/execute. Full pipeline. A rejected or failed request
     * is still a 200; the body carries the decision and the remediation hint.
     */
    @PostMapping("/execute")
    public GatewayResponse execute(@Valid @RequestBody GatewayRequest request) {
        var result = gateway.validateAndExecute(request.content(), request.contentType(), request.toContext());
        log.debug("Request {} finished: {}", result.requestId(), result.reason());
        return GatewayResponse.from(result);
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        return configService.configuration();
    }

    /**
     * POST /api/v1/gateway/policy. Replaces the active policy with the posted document.
     * An invalid document leaves the previous policy in force and answers 422.
     */
    @PostMapping(value = "/policy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> reloadPolicy(@RequestBody String document) {
        var snapshot = gateway.reloadPolicy(document, "api");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "APPLIED");
        body.put("version", snapshot.version());
        return ResponseEntity.ok(body);
    }
}
