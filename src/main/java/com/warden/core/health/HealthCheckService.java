package com.warden.core.health;

import com.warden.core.audit.AsyncAuditLogger;
import com.warden.core.audit.AuditLogger;
import com.warden.core.gateway.DegradationLadder;
import com.warden.core.policy.PolicyHolder;
import com.warden.sandbox.PoolStats;
import com.warden.sandbox.SandboxPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxPool sandboxPool;
    private final DegradationLadder ladder;
    private final AuditLogger auditLogger;
    private final PolicyHolder policyHolder;

    public HealthCheckService(
            @Autowired(required = false) SandboxPool sandboxPool,
            @Autowired(required = false) DegradationLadder ladder,
            @Autowired(required = false) AuditLogger auditLogger,
            @Autowired(required = false) PolicyHolder policyHolder) {
        this.sandboxPool = sandboxPool;
        this.ladder = ladder;
        this.auditLogger = auditLogger;
        this.policyHolder = policyHolder;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPolicy());
        results.add(checkBackends());
        results.add(checkLadder());
        results.add(checkAudit());
        return results;
    }

    private HealthStatus checkPolicy() {
        if (policyHolder == null) {
            return HealthStatus.down("policy", "No policy loaded");
        }
        return new HealthStatus("policy", HealthStatus.Status.UP,
                "Policy version " + policyHolder.current().version() + " active",
                Map.of("version", policyHolder.current().version()));
    }

    private HealthStatus checkBackends() {
        if (sandboxPool == null) {
            return HealthStatus.down("sandboxes", "No sandbox pool configured");
        }
        try {
            Map<String, String> metadata = new LinkedHashMap<>();
            int executing = 0;
            int available = 0;
            List<PoolStats> stats = sandboxPool.snapshot();
            for (PoolStats s : stats) {
                metadata.put(s.level().name(), s.backendAvailable()
                        ? "available (" + s.idle() + "/" + s.total() + " idle)" : "unavailable");
                if (s.backendAvailable()) {
                    available++;
                    if (s.level().executes()) {
                        executing++;
                    }
                }
            }
            if (executing == 0) {
                return new HealthStatus("sandboxes", available > 0 ? HealthStatus.Status.DEGRADED : HealthStatus.Status.DOWN,
                        "No executing sandbox backend available", metadata);
            }
            return new HealthStatus("sandboxes", HealthStatus.Status.UP,
                    executing + " executing backend(s) available", metadata);
        } catch (Exception e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
            return HealthStatus.down("sandboxes", "Sandbox error: " + e.getMessage());
        }
    }

    private HealthStatus checkLadder() {
        if (ladder == null) {
            return HealthStatus.down("degradation", "No degradation ladder");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        List<String> down = new ArrayList<>();
        for (DegradationLadder.LevelStatus status : ladder.status()) {
            metadata.put(status.level().name(), status.down() ? "DOWN" : "failures=" + status.consecutiveFailures());
            if (status.down()) {
                down.add(status.level().name());
            }
        }
        if (down.isEmpty()) {
            return new HealthStatus("degradation", HealthStatus.Status.UP, "All isolation levels healthy", metadata);
        }
        return new HealthStatus("degradation", HealthStatus.Status.DEGRADED,
                "Levels down until reset: " + String.join(", ", down), metadata);
    }

    private HealthStatus checkAudit() {
        if (auditLogger == null) {
            return HealthStatus.down("audit", "No audit logger configured");
        }
        Map<String, String> metadata = Map.of("backlog", String.valueOf(auditLogger.backlog()));
        if (auditLogger instanceof AsyncAuditLogger async && async.isAlertRaised()) {
            return new HealthStatus("audit", HealthStatus.Status.DEGRADED,
                    "Audit storage failing; events buffered in memory", metadata);
        }
        return new HealthStatus("audit", HealthStatus.Status.UP, "Audit log writable", metadata);
    }
}
