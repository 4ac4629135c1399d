package com.warden.core.network;

import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditLogger;
import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.metrics.GatewayMetrics;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.NetworkPolicy;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.policy.PolicySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Outbound connection policy: default deny, an explicit domain allow-list, and deny ranges that
 * always win. Consulted by the egress proxy for every connection attempt and by the validator for
 * destinations written into content.
 */
@Service
public class NetworkGuard {

    private static final Logger log = LoggerFactory.getLogger(NetworkGuard.class);

    private static final Pattern DOMAIN = Pattern.compile(
            "^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?(\\.[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?)*$");

    private final PolicyHolder policyHolder;
    private final AuditLogger auditLogger;
    private final EventBus eventBus;
    private final GatewayMetrics metrics;
    private final int trafficLogSize;

    private final Deque<NetworkDecision> trafficLog = new ArrayDeque<>();
    private final Map<String, AtomicInteger> deniedByContext = new ConcurrentHashMap<>();
    private final List<Consumer<NetworkDecision>> alertListeners = new CopyOnWriteArrayList<>();

    private volatile CompiledRanges compiled;

    @Autowired
    public NetworkGuard(PolicyHolder policyHolder, AuditLogger auditLogger, EventBus eventBus,
                        GatewayMetrics metrics, GatewayProperties properties) {
        this(policyHolder, auditLogger, eventBus, metrics, properties.getNetwork().getTrafficLogSize());
    }

    public NetworkGuard(PolicyHolder policyHolder, AuditLogger auditLogger, EventBus eventBus,
                        GatewayMetrics metrics, int trafficLogSize) {
        this.policyHolder = policyHolder;
        this.auditLogger = auditLogger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.trafficLogSize = trafficLogSize;
    }

    public NetworkDecision check(String target) {
        return check(target, null);
    }

    /**
     * Decides whether a connection to {@code target} may proceed and records the attempt.
     *
     * @param target  host, host:port or URL
     * @param context caller context used for auditing and repeated-denial tracking
     * @throws IllegalArgumentException if the target is blank
     */
    public NetworkDecision check(String target, String context) {
        NetworkDecision decision = evaluate(target, context);
        record(decision, ranges().snapshot().network().repeatedDenialThreshold());
        return decision;
    }

    /**
     * Computes the decision for {@code target} without recording it. Used for static checks of
     * destinations written into content.
     *
     * @throws IllegalArgumentException if the target is blank
     */
    public NetworkDecision evaluate(String target, String context) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Network target must not be blank");
        }
        String ctx = context == null || context.isBlank() ? "unknown" : context;
        String host = extractHost(target);
        CompiledRanges ranges = ranges();
        NetworkPolicy policy = ranges.snapshot().network();

        Optional<InetAddress> literal = IpRange.parseLiteral(host);
        if (literal.isPresent()) {
            return ranges.match(literal.get())
                    .map(r -> deny(target, host, "Address " + host + " is in deny range " + r.cidr(),
                            NetworkDecision.BLACKLIST_IP_RANGE, ctx))
                    .orElseGet(() -> deny(target, host,
                            "IP address " + host + " requires domain allow-list validation",
                            NetworkDecision.IP_LITERAL, ctx));
        }
        if (policy.allowedDomains().contains(host)) {
            return new NetworkDecision(target, host, true, "Domain " + host + " is on the allow-list",
                    NetworkDecision.WHITELIST_EXACT, ctx, Instant.now());
        }
        if (policy.allowedDomains().stream().anyMatch(d -> host.endsWith("." + d))) {
            return new NetworkDecision(target, host, true, "Subdomain of an allow-listed domain",
                    NetworkDecision.WHITELIST_SUBDOMAIN, ctx, Instant.now());
        }
        return deny(target, host, "Domain " + host + " is not on the allow-list (default deny)",
                NetworkDecision.DEFAULT_DENY, ctx);
    }

    /**
     * Re-checks the address a host actually resolved to. Catches allow-listed names that point into
     * a deny range.
     */
    public NetworkDecision checkResolved(String host, InetAddress address, String context) {
        String ctx = context == null || context.isBlank() ? "unknown" : context;
        CompiledRanges ranges = ranges();
        Optional<IpRange> hit = ranges.match(address);
        if (hit.isEmpty()) {
            return new NetworkDecision(host, host, true, "Resolved address " + address.getHostAddress() + " permitted",
                    NetworkDecision.WHITELIST_EXACT, ctx, Instant.now());
        }
        NetworkDecision decision = deny(host, host, "Host " + host + " resolved to " + address.getHostAddress()
                + " in deny range " + hit.get().cidr(), NetworkDecision.BLACKLIST_IP_RANGE, ctx);
        record(decision, ranges.snapshot().network().repeatedDenialThreshold());
        return decision;
    }

    public int deniedAttempts(String context) {
        AtomicInteger count = deniedByContext.get(context);
        return count == null ? 0 : count.get();
    }

    /** True once a context has reached the repeated-denial threshold. */
    public boolean hasRepeatedDenials(String context) {
        return deniedAttempts(context) >= ranges().snapshot().network().repeatedDenialThreshold();
    }

    /** Forgets the denial counter of a finished request. */
    public void clearContext(String context) {
        deniedByContext.remove(context);
    }

    public void addAlertListener(Consumer<NetworkDecision> listener) {
        alertListeners.add(listener);
    }

    public void addAllowedDomain(String domain) {
        String normalized = normalizeDomain(domain);
        policyHolder.update(s -> {
            var domains = new LinkedHashSet<>(s.network().allowedDomains());
            domains.add(normalized);
            return s.withNetwork(new NetworkPolicy(domains, s.network().denyRanges(),
                    s.network().repeatedDenialThreshold()));
        });
        log.info("Added {} to the domain allow-list", normalized);
    }

    public void removeAllowedDomain(String domain) {
        String normalized = normalizeDomain(domain);
        if (!policyHolder.current().network().allowedDomains().contains(normalized)) {
            throw new IllegalArgumentException("Domain " + normalized + " is not on the allow-list");
        }
        policyHolder.update(s -> {
            var domains = new LinkedHashSet<>(s.network().allowedDomains());
            domains.remove(normalized);
            return s.withNetwork(new NetworkPolicy(domains, s.network().denyRanges(),
                    s.network().repeatedDenialThreshold()));
        });
        log.info("Removed {} from the domain allow-list", normalized);
    }

    public void addDenyRange(String cidr) {
        IpRange range = IpRange.parse(cidr);
        policyHolder.update(s -> {
            var denied = new ArrayList<>(s.network().denyRanges());
            if (!denied.contains(cidr.trim())) {
                denied.add(cidr.trim());
            }
            return s.withNetwork(new NetworkPolicy(s.network().allowedDomains(), denied,
                    s.network().repeatedDenialThreshold()));
        });
        log.info("Added deny range {}", range.cidr());
    }

    public void removeDenyRange(String cidr) {
        if (!policyHolder.current().network().denyRanges().contains(cidr.trim())) {
            throw new IllegalArgumentException("Range " + cidr + " is not denied");
        }
        policyHolder.update(s -> {
            var denied = new ArrayList<>(s.network().denyRanges());
            denied.remove(cidr.trim());
            return s.withNetwork(new NetworkPolicy(s.network().allowedDomains(), denied,
                    s.network().repeatedDenialThreshold()));
        });
    }

    /** Effective deny ranges, invalid configured entries excluded. */
    public List<String> denyRanges() {
        return ranges().ranges().stream().map(IpRange::cidr).toList();
    }

    public Map<String, Object> getConfig() {
        CompiledRanges ranges = ranges();
        var config = new LinkedHashMap<String, Object>();
        config.put("allowedDomains", ranges.snapshot().network().allowedDomains().stream().sorted().toList());
        config.put("denyRanges", ranges.ranges().stream().map(IpRange::cidr).toList());
        config.put("repeatedDenialThreshold", ranges.snapshot().network().repeatedDenialThreshold());
        config.put("auditEnabled", auditLogger != null);
        config.put("alertListeners", alertListeners.size());
        config.put("trafficLogSize", trafficLogSize);
        return config;
    }

    /** Most recent decisions, oldest first. */
    public List<NetworkDecision> recentTraffic(int limit) {
        synchronized (trafficLog) {
            var all = new ArrayList<>(trafficLog);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    static String extractHost(String target) {
        String t = target.trim();
        String host;
        if (t.contains("://")) {
            try {
                URI uri = new URI(t);
                host = uri.getHost();
                if (host == null) {
                    host = hostPart(t.substring(t.indexOf("://") + 3));
                }
            } catch (URISyntaxException e) {
                host = hostPart(t.substring(t.indexOf("://") + 3));
            }
        } else {
            host = hostPart(t);
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    private static String hostPart(String s) {
        String host = s;
        for (char stop : new char[] {'/', '?', '#'}) {
            int i = host.indexOf(stop);
            if (i >= 0) {
                host = host.substring(0, i);
            }
        }
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            return close > 0 ? host.substring(0, close + 1) : host;
        }
        int colon = host.indexOf(':');
        if (colon >= 0 && host.indexOf(':', colon + 1) < 0) {
            host = host.substring(0, colon);
        }
        return host;
    }

    private static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain must not be blank");
        }
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        if (!DOMAIN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid domain: " + domain);
        }
        return normalized;
    }

    private NetworkDecision deny(String target, String host, String reason, String rule, String ctx) {
        return new NetworkDecision(target, host, false, reason, rule, ctx, Instant.now());
    }

    private void record(NetworkDecision decision, int repeatedDenialThreshold) {
        synchronized (trafficLog) {
            trafficLog.addLast(decision);
            while (trafficLog.size() > trafficLogSize) {
                trafficLog.removeFirst();
            }
        }
        if (metrics != null) {
            metrics.recordNetworkDecision(decision.allowed());
        }
        audit(decision);
        if (decision.allowed()) {
            log.debug("Network access allowed: {} ({})", decision.host(), decision.ruleMatched());
            return;
        }
        log.warn("Network access denied: {} ({}) context={}", decision.target(), decision.reason(), decision.context());
        for (Consumer<NetworkDecision> listener : alertListeners) {
            try {
                listener.accept(decision);
            } catch (Exception e) {
                log.warn("Network alert listener failed: {}", e.getMessage());
            }
        }
        int denied = deniedByContext.computeIfAbsent(decision.context(), k -> new AtomicInteger()).incrementAndGet();
        if (denied == repeatedDenialThreshold) {
            log.warn("Repeated denied connection attempts from {}", decision.context());
            eventBus.publish(GatewayEvent.of(GatewayEvents.SECURITY_VIOLATION_DETECTED, decision.context(),
                    "network-guard", Map.of(
                            "kind", ViolationKind.NETWORK_VIOLATION.name(),
                            "deniedAttempts", denied,
                            "lastTarget", decision.target())));
        }
    }

    private void audit(NetworkDecision decision) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.append(AuditEvent.builder(AuditEventType.NETWORK_ACCESS, "network-guard")
                    .requestId(decision.context())
                    .decision(decision.allowed() ? "ALLOWED" : "DENIED")
                    .detail("target", decision.target())
                    .detail("host", decision.host())
                    .detail("rule", decision.ruleMatched())
                    .detail("reason", decision.reason())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to audit network decision for {}: {}", decision.target(), e.getMessage());
        }
    }

    private CompiledRanges ranges() {
        PolicySnapshot snapshot = policyHolder.current();
        CompiledRanges cached = compiled;
        if (cached != null && cached.snapshot() == snapshot) {
            return cached;
        }
        var parsed = new ArrayList<IpRange>();
        for (String cidr : snapshot.network().denyRanges()) {
            try {
                parsed.add(IpRange.parse(cidr));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid deny range '{}': {}", cidr, e.getMessage());
            }
        }
        CompiledRanges fresh = new CompiledRanges(snapshot, List.copyOf(parsed));
        compiled = fresh;
        return fresh;
    }

    private record CompiledRanges(PolicySnapshot snapshot, List<IpRange> ranges) {
        Optional<IpRange> match(InetAddress address) {
            return ranges.stream().filter(r -> r.contains(address)).findFirst();
        }
    }
}
