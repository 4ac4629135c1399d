package com.warden.core.network;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditLogger;
import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NetworkGuardTest {

    private PolicyHolder policyHolder;
    private RecordingAuditLogger audit;
    private EventBus eventBus;
    private NetworkGuard guard;

    @BeforeEach
    void setUp() {
        policyHolder = new PolicyHolder(new GatewayProperties(), new ObjectMapper());
        audit = new RecordingAuditLogger();
        eventBus = new EventBus();
        guard = new NetworkGuard(policyHolder, audit, eventBus, null, 5);
    }

    @Nested
    @DisplayName("Domain allow-list")
    class AllowList {

        @Test
        @DisplayName("exact match is allowed")
        void exactMatch() {
            var decision = guard.check("pypi.org");

            assertTrue(decision.allowed());
            assertEquals(NetworkDecision.WHITELIST_EXACT, decision.ruleMatched());
        }

        @Test
        @DisplayName("subdomains of allowed domains are allowed")
        void subdomain() {
            var decision = guard.check("simple.pypi.org");

            assertTrue(decision.allowed());
            assertEquals(NetworkDecision.WHITELIST_SUBDOMAIN, decision.ruleMatched());
        }

        @Test
        @DisplayName("lookalike suffixes are not subdomains")
        void lookalike() {
            assertFalse(guard.check("evilpypi.org").allowed());
        }

        @ParameterizedTest
        @ValueSource(strings = {"https://PyPI.org/simple/numpy?x=1#top", "pypi.org:443", "http://user@pypi.org/", "PYPI.ORG."})
        @DisplayName("URLs, ports, credentials and case are normalized away")
        void normalization(String target) {
            var decision = guard.check(target);

            assertTrue(decision.allowed(), decision.reason());
            assertEquals("pypi.org", decision.host());
        }

        @Test
        @DisplayName("everything else is denied by default")
        void defaultDeny() {
            var decision = guard.check("example.com");

            assertFalse(decision.allowed());
            assertEquals(NetworkDecision.DEFAULT_DENY, decision.ruleMatched());
        }

        @Test
        @DisplayName("blank targets are rejected")
        void blankTarget() {
            assertThrows(IllegalArgumentException.class, () -> guard.check(" "));
            assertThrows(IllegalArgumentException.class, () -> guard.check(null));
        }
    }

    @Nested
    @DisplayName("Deny ranges")
    class DenyRanges {

        @ParameterizedTest
        @ValueSource(strings = {"10.1.2.3", "172.16.0.1", "192.168.1.1", "127.0.0.1", "169.254.169.254", "[::1]", "fd00::1"})
        @DisplayName("private, loopback, link-local and metadata addresses are denied")
        void privateAddresses(String target) {
            var decision = guard.check(target);

            assertFalse(decision.allowed());
            assertEquals(NetworkDecision.BLACKLIST_IP_RANGE, decision.ruleMatched());
        }

        @Test
        @DisplayName("public IP literals cannot be matched against the domain allow-list")
        void publicIpLiteral() {
            var decision = guard.check("8.8.8.8");

            assertFalse(decision.allowed());
            assertEquals(NetworkDecision.IP_LITERAL, decision.ruleMatched());
        }

        @Test
        @DisplayName("deny range wins over an allow-listed name that resolves into it")
        void resolvedAddressIsRechecked() throws Exception {
            var decision = guard.checkResolved("pypi.org", InetAddress.getByName("10.0.0.7"), "req-1");

            assertFalse(decision.allowed());
            assertEquals(NetworkDecision.BLACKLIST_IP_RANGE, decision.ruleMatched());
        }

        @Test
        @DisplayName("invalid configured ranges are skipped")
        void invalidRangesSkipped() {
            var properties = new GatewayProperties();
            properties.getNetwork().setDenyRanges(List.of("10.0.0.0/8", "not-a-range", "300.1.1.1/8"));
            var custom = new NetworkGuard(new PolicyHolder(properties, new ObjectMapper()), null, new EventBus(), null, 5);

            assertEquals(List.of("10.0.0.0/8"), custom.denyRanges());
        }
    }

    @Nested
    @DisplayName("Runtime updates")
    class RuntimeUpdates {

        @Test
        @DisplayName("added domains take effect through a new policy snapshot")
        void addDomain() {
            var before = policyHolder.current();
            guard.addAllowedDomain("Files.Example.com");

            assertTrue(guard.check("files.example.com").allowed());
            assertNotSame(before, policyHolder.current());
            assertFalse(before.network().allowedDomains().contains("files.example.com"));
        }

        @Test
        @DisplayName("removed domains are denied again")
        void removeDomain() {
            guard.removeAllowedDomain("pypi.org");

            assertFalse(guard.check("pypi.org").allowed());
            assertThrows(IllegalArgumentException.class, () -> guard.removeAllowedDomain("pypi.org"));
        }

        @Test
        @DisplayName("invalid domains are rejected")
        void invalidDomain() {
            assertThrows(IllegalArgumentException.class, () -> guard.addAllowedDomain("bad domain"));
        }

        @Test
        @DisplayName("deny ranges can be added and removed")
        void denyRanges() {
            guard.addDenyRange("203.0.113.0/24");
            assertTrue(guard.denyRanges().contains("203.0.113.0/24"));

            guard.removeDenyRange("203.0.113.0/24");
            assertFalse(guard.denyRanges().contains("203.0.113.0/24"));
            assertThrows(IllegalArgumentException.class, () -> guard.addDenyRange("nope"));
        }

        @Test
        @DisplayName("config view lists the effective settings")
        void config() {
            var config = guard.getConfig();

            assertEquals(List.of("files.pythonhosted.org", "pypi.org"), config.get("allowedDomains"));
            assertEquals(3, config.get("repeatedDenialThreshold"));
            assertEquals(true, config.get("auditEnabled"));
        }
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("every check is audited, allowed or not")
        void everyCheckAudited() {
            guard.check("pypi.org", "req-1");
            guard.check("example.com", "req-1");

            assertEquals(2, audit.events.size());
            assertTrue(audit.events.stream().allMatch(e -> e.eventType() == AuditEventType.NETWORK_ACCESS));
            assertEquals(List.of("ALLOWED", "DENIED"), audit.events.stream().map(AuditEvent::decision).toList());
        }

        @Test
        @DisplayName("evaluate does not record")
        void evaluateDoesNotRecord() {
            guard.evaluate("example.com", "validator");

            assertTrue(audit.events.isEmpty());
            assertTrue(guard.recentTraffic(10).isEmpty());
        }

        @Test
        @DisplayName("traffic log is bounded")
        void trafficLogBounded() {
            for (int i = 0; i < 8; i++) {
                guard.check("host" + i + ".example.com", "req-1");
            }
            var traffic = guard.recentTraffic(100);

            assertEquals(5, traffic.size());
            assertEquals("host7.example.com", traffic.get(4).host());
        }

        @Test
        @DisplayName("repeated denials raise a violation event once the threshold is reached")
        void repeatedDenials() {
            var published = new CopyOnWriteArrayList<GatewayEvent>();
            eventBus.subscribe(GatewayEvents.SECURITY_VIOLATION_DETECTED, published::add);
            var alerts = new CopyOnWriteArrayList<NetworkDecision>();
            guard.addAlertListener(alerts::add);

            guard.check("a.example.com", "req-9");
            guard.check("b.example.com", "req-9");
            assertFalse(guard.hasRepeatedDenials("req-9"));
            guard.check("c.example.com", "req-9");

            assertTrue(guard.hasRepeatedDenials("req-9"));
            assertEquals(3, guard.deniedAttempts("req-9"));
            assertEquals(3, alerts.size());
            assertEquals(1, published.size());
            assertEquals("NETWORK_VIOLATION", published.get(0).payload().get("kind"));

            guard.clearContext("req-9");
            assertEquals(0, guard.deniedAttempts("req-9"));
        }

        @Test
        @DisplayName("a failing alert listener does not break the check")
        void failingListener() {
            guard.addAlertListener(d -> {
                throw new IllegalStateException("boom");
            });

            assertFalse(guard.check("example.com").allowed());
        }
    }

    static class RecordingAuditLogger implements AuditLogger {
        final List<AuditEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void append(AuditEvent event) {
            events.add(event);
        }

        @Override
        public boolean flush(Duration timeout) {
            return true;
        }

        @Override
        public int backlog() {
            return 0;
        }
    }
}
