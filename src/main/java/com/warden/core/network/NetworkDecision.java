package com.warden.core.network;

import java.time.Instant;

/**
 * Outcome of one outbound connection check. Every decision, allowed or not, is kept in the
 * traffic log.
 *
 * @param target      destination as requested (host, host:port or URL)
 * @param host        normalized host extracted from the target
 * @param allowed     whether the connection may proceed
 * @param reason      human-readable explanation
 * @param ruleMatched rule that decided: {@code whitelist_exact}, {@code whitelist_subdomain},
 *                    {@code blacklist_ip_range}, {@code ip_literal} or {@code default_deny}
 * @param context     caller context, usually the request id; "unknown" when not supplied
 * @param timestamp   when the check happened
 */
public record NetworkDecision(
    String target,
    String host,
    boolean allowed,
    String reason,
    String ruleMatched,
    String context,
    Instant timestamp
) {

    public static final String WHITELIST_EXACT = "whitelist_exact";
    public static final String WHITELIST_SUBDOMAIN = "whitelist_subdomain";
    public static final String BLACKLIST_IP_RANGE = "blacklist_ip_range";
    public static final String IP_LITERAL = "ip_literal";
    public static final String DEFAULT_DENY = "default_deny";
}
