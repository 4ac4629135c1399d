package com.warden.core.policy;

/**
 * Structural limits applied during validation.
 */
public record ValidationLimits(
    int maxDepth,
    int maxNodes,
    int maxComplexity,
    int maxImports,
    int maxCodeChars,
    int maxCodeLines,
    int maxPromptChars,
    int maxConfigDepth
) {

    public static final ValidationLimits DEFAULT =
            new ValidationLimits(64, 5_000, 50, 20, 100_000, 1_000, 20_000, 16);

    public ValidationLimits {
        if (maxDepth <= 0 || maxNodes <= 0 || maxComplexity <= 0 || maxImports < 0
                || maxCodeChars <= 0 || maxCodeLines <= 0 || maxPromptChars <= 0 || maxConfigDepth <= 0) {
            throw new PolicyConfigurationException("validation limits must be positive");
        }
    }
}
