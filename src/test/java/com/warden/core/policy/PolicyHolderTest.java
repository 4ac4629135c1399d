package com.warden.core.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyHolderTest {

    private PolicyHolder holder;

    @BeforeEach
    void setUp() {
        holder = new PolicyHolder(new GatewayProperties(), new ObjectMapper());
    }

    @Test
    void defaultsProduceAUsableSnapshot() {
        PolicySnapshot snapshot = holder.current();

        assertEquals("1", snapshot.version());
        assertTrue(snapshot.capabilitiesFor(ContentType.CODE).deniedCalls().contains("eval"));
        assertTrue(snapshot.network().allowedDomains().contains("pypi.org"));
        assertEquals(Duration.ofSeconds(30), snapshot.defaultTimeout());
        for (IsolationLevel level : IsolationLevel.values()) {
            if (level.executes()) {
                assertNotNull(snapshot.ceilings().get(level), "ceiling for " + level);
            }
        }
    }

    @Test
    void reloadAppliesOnlyTheSectionsPresent() {
        var before = holder.current();

        var after = holder.reload("""
                {"version": "2024-06-01",
                 "network": {"allowedDomains": ["files.example.com"]},
                 "auditRetentionDays": 30}
                """);

        assertSame(after, holder.current());
        assertEquals("2024-06-01", after.version());
        assertEquals(java.util.Set.of("files.example.com"), after.network().allowedDomains());
        assertEquals(before.network().denyRanges(), after.network().denyRanges());
        assertEquals(30, after.auditRetentionDays());
        assertEquals(before.limits(), after.limits());
        assertEquals(before.capabilitiesFor(ContentType.CODE), after.capabilitiesFor(ContentType.CODE));
    }

    @Test
    void overlappingAllowAndDenyIsRejectedAndOldPolicyKept() {
        var before = holder.current();

        var error = assertThrows(PolicyConfigurationException.class, () -> holder.reload("""
                {"version": "bad",
                 "capabilities": {"CODE": {"allowedCalls": ["eval"], "deniedCalls": ["eval"]}}}
                """));

        assertTrue(error.getMessage().contains("eval"));
        assertSame(before, holder.current());
    }

    @Test
    void documentWithoutVersionIsRejected() {
        assertThrows(PolicyConfigurationException.class, () -> holder.reload("{\"auditRetentionDays\": 10}"));
        assertEquals("1", holder.current().version());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(PolicyConfigurationException.class, () -> holder.reload("{\"version\": "));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(PolicyConfigurationException.class,
                () -> holder.reload("{\"version\": \"3\", \"defaultTimeoutSeconds\": 0}"));
        assertThrows(PolicyConfigurationException.class,
                () -> holder.reload("{\"version\": \"3\", \"poolTargets\": {\"CONTAINER\": -1}}"));
    }

    @Test
    void listenersSeeEveryNewSnapshot() {
        List<String> seen = new ArrayList<>();
        holder.addListener(s -> seen.add(s.version()));
        holder.addListener(s -> {
            throw new IllegalStateException("listener failure");
        });

        holder.reload("{\"version\": \"2\"}");
        holder.reload("{\"version\": \"3\"}");

        assertEquals(List.of("2", "3"), seen);
    }

    @Test
    void inconsistentStartupConfigurationFails() {
        var properties = new GatewayProperties();
        var caps = properties.getCapabilities().get(ContentType.CODE);
        caps.getAllowedModules().add("subprocess");

        assertThrows(PolicyConfigurationException.class, () -> new PolicyHolder(properties, new ObjectMapper()));
    }
}
