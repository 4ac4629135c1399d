package com.warden.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.EventBus;
import com.warden.core.gateway.DegradationLadder;
import com.warden.core.model.IsolationLevel;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import com.warden.sandbox.PoolStats;
import com.warden.sandbox.SandboxPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null, null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("policy", "sandboxes", "degradation", "audit"),
                results.stream().map(HealthStatus::component).toList());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(), status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("Policy loaded -> policy UP with its version")
    void policyUp() {
        var holder = new PolicyHolder(new GatewayProperties(), new ObjectMapper());
        var service = new HealthCheckService(null, null, null, holder);

        var policy = component(service.checkAll(), "policy");
        assertEquals(HealthStatus.Status.UP, policy.status());
        assertEquals("1", policy.metadata().get("version"));
    }

    @Test
    @DisplayName("Only the AST-only backend available -> sandboxes DEGRADED")
    void astOnlyIsDegraded() {
        var pool = mock(SandboxPool.class);
        when(pool.snapshot()).thenReturn(List.of(
                new PoolStats(IsolationLevel.CONTAINER, 2, 0, 0, 0, 0, 0, false),
                new PoolStats(IsolationLevel.NONE_AST_ONLY, 0, 0, 0, 0, 0, 0, true)));
        var service = new HealthCheckService(pool, null, null, null);

        var sandboxes = component(service.checkAll(), "sandboxes");
        assertEquals(HealthStatus.Status.DEGRADED, sandboxes.status());
        assertEquals("unavailable", sandboxes.metadata().get("CONTAINER"));
    }

    @Test
    @DisplayName("An executing backend available -> sandboxes UP")
    void executingBackendUp() {
        var pool = mock(SandboxPool.class);
        when(pool.snapshot()).thenReturn(List.of(new PoolStats(IsolationLevel.CONTAINER, 2, 2, 1, 1, 0, 0, true)));
        var service = new HealthCheckService(pool, null, null, null);

        var sandboxes = component(service.checkAll(), "sandboxes");
        assertEquals(HealthStatus.Status.UP, sandboxes.status());
        assertEquals("available (1/2 idle)", sandboxes.metadata().get("CONTAINER"));
    }

    @Test
    @DisplayName("Pool failure -> sandboxes DOWN")
    void poolFailureDown() {
        var pool = mock(SandboxPool.class);
        when(pool.snapshot()).thenThrow(new IllegalStateException("boom"));
        var service = new HealthCheckService(pool, null, null, null);

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "sandboxes").status());
    }

    @Test
    @DisplayName("A level down -> degradation DEGRADED naming the level")
    void levelDownDegraded() {
        var ladder = new DegradationLadder(1, IsolationLevel.NONE_AST_ONLY, new EventBus(), null);
        ladder.recordFailure(IsolationLevel.MICRO_VM);
        var service = new HealthCheckService(null, ladder, null, null);

        var degradation = component(service.checkAll(), "degradation");
        assertEquals(HealthStatus.Status.DEGRADED, degradation.status());
        assertTrue(degradation.detail().contains("MICRO_VM"));
        assertEquals("DOWN", degradation.metadata().get("MICRO_VM"));
    }
}
