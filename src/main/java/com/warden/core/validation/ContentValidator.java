package com.warden.core.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.ContentType;
import com.warden.core.model.ValidationResult;
import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.network.NetworkDecision;
import com.warden.core.network.NetworkGuard;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.policy.PolicySnapshot;
import com.warden.core.policy.ValidationLimits;
import com.warden.core.validation.syntax.ContentParseException;
import com.warden.core.validation.syntax.Node;
import com.warden.core.validation.syntax.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Static validation of untrusted content against the active policy snapshot. Deterministic and
 * free of I/O: the same content, type and snapshot always produce the same violations.
 */
@Service
public class ContentValidator {

    private static final Logger log = LoggerFactory.getLogger(ContentValidator.class);

    private final PolicyHolder policyHolder;
    private final OperatorRegistry operatorRegistry;
    private final ConfigValidator configValidator;
    private final NetworkGuard networkGuard;

    /**
     * Validation outcome plus what the content-type detector saw.
     *
     * @param result       the validation result
     * @param detectedType heuristic type; null for empty content
     * @param escalated    true when provided prose or configuration looked like code and was also
     *                     scanned for denied calls and modules
     */
    public record Inspection(ValidationResult result, ContentType detectedType, boolean escalated) {}

    @Autowired
    public ContentValidator(PolicyHolder policyHolder, OperatorRegistry operatorRegistry, ObjectMapper objectMapper,
                            @Autowired(required = false) NetworkGuard networkGuard) {
        this.policyHolder = policyHolder;
        this.operatorRegistry = operatorRegistry;
        this.configValidator = new ConfigValidator(objectMapper);
        this.networkGuard = networkGuard;
    }

    public ValidationResult validate(String content, ContentType type) {
        return inspect(content, type).result();
    }

    /**
     * Validates {@code content} under the rules for {@code type}.
     *
     * @throws IllegalArgumentException if content or type is null
     */
    public Inspection inspect(String content, ContentType type) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("content type must not be null");
        }
        long start = System.nanoTime();
        PolicySnapshot policy = policyHolder.current();
        String hash = ContentHasher.sha256Hex(content);

        var violations = new ArrayList<Violation>();
        ContentType detected = null;
        boolean escalated = false;
        if (content.isBlank()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED, "Content is empty"));
        } else {
            detected = ContentTypeDetector.detect(content);
            switch (type) {
                case CODE -> violations.addAll(validateCode(content, policy));
                case EXPRESSION -> violations.addAll(validateExpression(content, policy));
                case PROMPT -> violations.addAll(PromptValidator.validate(content, policy.limits(),
                        policy.injectionMarkers()));
                case CONFIG -> violations.addAll(configValidator.validate(content,
                        policy.capabilitiesFor(ContentType.CONFIG), policy.limits()));
            }
            if ((type == ContentType.PROMPT || type == ContentType.CONFIG) && detected == ContentType.CODE) {
                Optional<List<Violation>> scan = denyOnlyScan(content, policy);
                escalated = scan.isPresent();
                scan.ifPresent(found -> found.stream().filter(v -> !violations.contains(v)).forEach(violations::add));
            }
            violations.addAll(maliciousPatterns(content, policy.maliciousPatterns()));
        }

        boolean approved = violations.isEmpty();
        var result = new ValidationResult(approved, type, violations, approved ? 0.0 : riskScore(violations),
                System.nanoTime() - start, hash);
        log.debug("Validated {} content {}: approved={} violations={}", type, hash, approved, violations.size());
        return new Inspection(result, detected, escalated);
    }

    private List<Violation> validateCode(String content, PolicySnapshot policy) {
        ValidationLimits limits = policy.limits();
        var violations = new ArrayList<Violation>();
        if (content.length() > limits.maxCodeChars()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Code length " + content.length() + " exceeds limit " + limits.maxCodeChars()));
        }
        long lines = content.lines().count();
        if (lines > limits.maxCodeLines()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Code has " + lines + " lines, limit is " + limits.maxCodeLines()));
        }
        if (!violations.isEmpty()) {
            return violations;
        }
        try {
            Node.Module module = Parser.parseModule(content);
            violations.addAll(CapabilityValidator.validate(module, policy.capabilitiesFor(ContentType.CODE),
                    limits, CapabilityValidator.Mode.FULL, this::destinationDenial));
        } catch (ContentParseException e) {
            violations.add(new Violation(ViolationKind.VALIDATION_FAILED, "Syntax error: " + e.getMessage(),
                    e.getLine(), e.getColumn()));
        }
        return violations;
    }

    private List<Violation> validateExpression(String content, PolicySnapshot policy) {
        ValidationLimits limits = policy.limits();
        if (content.length() > limits.maxCodeChars()) {
            return List.of(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Expression length " + content.length() + " exceeds limit " + limits.maxCodeChars()));
        }
        try {
            Node expression = Parser.parseExpression(content);
            return ExpressionValidator.validate(expression, operatorRegistry.current().names(),
                    policy.capabilitiesFor(ContentType.EXPRESSION), limits);
        } catch (ContentParseException e) {
            return List.of(new Violation(ViolationKind.VALIDATION_FAILED, "Syntax error: " + e.getMessage(),
                    e.getLine(), e.getColumn()));
        }
    }

    private Optional<List<Violation>> denyOnlyScan(String content, PolicySnapshot policy) {
        if (content.length() > policy.limits().maxCodeChars()) {
            return Optional.empty();
        }
        Node.Module module;
        try {
            module = Parser.parseModule(content);
        } catch (ContentParseException e) {
            log.debug("Content detected as code does not parse, skipping capability scan: {}", e.getMessage());
            return Optional.empty();
        }
        // Structural limits belong to the provided type, so only capability findings are kept.
        return Optional.of(CapabilityValidator.validate(module, policy.capabilitiesFor(ContentType.CODE),
                        policy.limits(), CapabilityValidator.Mode.DENY_ONLY, this::destinationDenial)
                .stream()
                .filter(v -> v.kind() != ViolationKind.VALIDATION_FAILED)
                .toList());
    }

    private Optional<String> destinationDenial(String destination) {
        if (networkGuard == null) {
            return Optional.empty();
        }
        NetworkDecision decision = networkGuard.evaluate(destination, "validator");
        return decision.allowed() ? Optional.empty() : Optional.of(decision.reason());
    }

    private static List<Violation> maliciousPatterns(String content, List<String> patterns) {
        var violations = new ArrayList<Violation>();
        for (String pattern : patterns) {
            int at = content.indexOf(pattern);
            if (at >= 0) {
                violations.add(new Violation(ViolationKind.VALIDATION_FAILED, "Malicious pattern: " + pattern,
                        PromptValidator.lineOf(content, at), PromptValidator.columnOf(content, at)));
            }
        }
        return violations;
    }

    static double riskScore(List<Violation> violations) {
        double score = 0;
        for (Violation v : violations) {
            score += switch (v.kind()) {
                case BLACKLIST_DETECTED -> 0.5;
                case NETWORK_VIOLATION -> 0.4;
                default -> 0.2;
            };
        }
        return Math.min(1.0, score);
    }
}
