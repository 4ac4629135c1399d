package com.warden.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of validating one piece of content. Created once per request; immutable.
 *
 * @param approved    true when no violation was found
 * @param contentType the rules that were applied
 * @param violations  every violation found, in source order
 * @param riskScore   0.0 (benign) to 1.0 (hostile)
 * @param elapsedNanos validation time
 * @param contentHash SHA-256 hex of the content
 */
public record ValidationResult(
    boolean approved,
    ContentType contentType,
    List<Violation> violations,
    double riskScore,
    long elapsedNanos,
    String contentHash
) implements Serializable {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (approved && !violations.isEmpty()) {
            throw new IllegalArgumentException("an approved result cannot carry violations");
        }
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public boolean hasViolation(ViolationKind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }

    /** Short reason suitable for the caller, derived from the first violation. */
    public String reason() {
        if (approved) {
            return "approved";
        }
        return violations.isEmpty() ? "rejected" : violations.get(0).kind() + ": " + violations.get(0).detail();
    }
}
