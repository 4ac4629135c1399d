package com.warden.core.policy;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Allowed and denied calls and modules for one content type.
 * Calls may be bare builtins ({@code eval}) or dotted paths ({@code os.system}).
 */
public record CapabilitySet(
    Set<String> allowedCalls,
    Set<String> allowedModules,
    Set<String> deniedCalls,
    Set<String> deniedModules
) {

    public static final CapabilitySet EMPTY = new CapabilitySet(Set.of(), Set.of(), Set.of(), Set.of());

    public CapabilitySet {
        allowedCalls = Set.copyOf(allowedCalls);
        allowedModules = Set.copyOf(allowedModules);
        deniedCalls = Set.copyOf(deniedCalls);
        deniedModules = Set.copyOf(deniedModules);
    }

    /**
     * Identifiers present on both sides. A non-empty result makes the policy unusable.
     */
    public Set<String> overlaps() {
        var overlap = new TreeSet<String>();
        for (String call : allowedCalls) {
            if (deniedCalls.contains(call)) {
                overlap.add(call);
            }
        }
        for (String module : allowedModules) {
            if (deniedModules.contains(module) || deniedModules.contains(rootOf(module))) {
                overlap.add(module);
            }
        }
        return overlap;
    }

    public boolean isModuleDenied(String dotted) {
        String prefix = dotted;
        while (true) {
            if (deniedModules.contains(prefix)) {
                return true;
            }
            int dot = prefix.lastIndexOf('.');
            if (dot < 0) {
                return false;
            }
            prefix = prefix.substring(0, dot);
        }
    }

    public boolean isModuleAllowed(String dotted) {
        return allowedModules.contains(dotted) || allowedModules.contains(rootOf(dotted));
    }

    public CapabilitySet withAllowedCalls(Set<String> extra) {
        var calls = new LinkedHashSet<>(allowedCalls);
        calls.addAll(extra);
        return new CapabilitySet(calls, allowedModules, deniedCalls, deniedModules);
    }

    static String rootOf(String dotted) {
        int dot = dotted.indexOf('.');
        return dot < 0 ? dotted : dotted.substring(0, dot);
    }
}
