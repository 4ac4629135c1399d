package com.warden.core.validation;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.CapabilitySet;
import com.warden.core.policy.ValidationLimits;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Checks JSON configuration produced by a model: nesting depth, size, keys that reach into
 * interpreter internals, and string values that smuggle denied calls or imports.
 */
public class ConfigValidator {

    private final ObjectMapper objectMapper;
    private volatile CompiledRules rules;

    public ConfigValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Violation> validate(String content, CapabilitySet capabilities, ValidationLimits limits) {
        var violations = new ArrayList<Violation>();
        if (content.length() > limits.maxCodeChars()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Configuration length " + content.length() + " exceeds limit " + limits.maxCodeChars()));
            return violations;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            violations.add(new Violation(ViolationKind.VALIDATION_FAILED,
                    "Malformed configuration: " + e.getOriginalMessage(),
                    location == null ? 0 : Math.max(0, location.getLineNr()),
                    location == null ? 0 : Math.max(0, location.getColumnNr())));
            return violations;
        }
        CompiledRules compiled = rulesFor(capabilities);
        int depth = walk(root, "", 1, compiled, violations);
        if (depth > limits.maxConfigDepth()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Configuration depth " + depth + " exceeds limit " + limits.maxConfigDepth()));
        }
        return violations;
    }

    /** Returns the deepest nesting level below {@code node}. */
    private int walk(JsonNode node, String path, int depth, CompiledRules compiled, List<Violation> violations) {
        int deepest = depth;
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                if (key.startsWith("__")) {
                    violations.add(Violation.of(ViolationKind.BLACKLIST_DETECTED,
                            "Denied configuration key at " + path + "/" + key + ": " + key));
                }
                deepest = Math.max(deepest, walk(field.getValue(), path + "/" + key, depth + 1, compiled, violations));
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                deepest = Math.max(deepest, walk(node.get(i), path + "/" + i, depth + 1, compiled, violations));
            }
        } else if (node.isTextual()) {
            checkValue(node.asText(), path.isEmpty() ? "/" : path, compiled, violations);
        }
        return deepest;
    }

    private void checkValue(String value, String path, CompiledRules compiled, List<Violation> violations) {
        for (Map.Entry<String, Pattern> call : compiled.calls().entrySet()) {
            if (call.getValue().matcher(value).find()) {
                violations.add(Violation.of(ViolationKind.BLACKLIST_DETECTED,
                        "Denied call in configuration value at " + path + ": " + call.getKey()));
            }
        }
        for (Map.Entry<String, Pattern> module : compiled.modules().entrySet()) {
            if (module.getValue().matcher(value).find()) {
                violations.add(Violation.of(ViolationKind.BLACKLIST_DETECTED,
                        "Denied module in configuration value at " + path + ": " + module.getKey()));
            }
        }
    }

    private CompiledRules rulesFor(CapabilitySet capabilities) {
        CompiledRules cached = rules;
        if (cached != null && cached.source() == capabilities) {
            return cached;
        }
        var calls = new TreeMap<String, Pattern>();
        for (String call : capabilities.deniedCalls()) {
            calls.put(call, Pattern.compile("(?<![\\w.])" + Pattern.quote(call) + "\\s*\\("));
        }
        var modules = new TreeMap<String, Pattern>();
        for (String module : capabilities.deniedModules()) {
            modules.put(module, Pattern.compile("\\b(?:import|from)\\s+" + Pattern.quote(module) + "\\b"));
        }
        CompiledRules fresh = new CompiledRules(capabilities, calls, modules);
        rules = fresh;
        return fresh;
    }

    private record CompiledRules(CapabilitySet source, Map<String, Pattern> calls, Map<String, Pattern> modules) {}
}
