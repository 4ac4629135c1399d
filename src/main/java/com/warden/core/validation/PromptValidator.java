package com.warden.core.validation;

import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.ValidationLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prompts are prose: only the size bound and known injection markers are checked.
 */
public final class PromptValidator {

    private PromptValidator() {}

    public static List<Violation> validate(String content, ValidationLimits limits, List<String> injectionMarkers) {
        var violations = new ArrayList<Violation>();
        if (content.length() > limits.maxPromptChars()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Prompt length " + content.length() + " exceeds limit " + limits.maxPromptChars()));
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String marker : injectionMarkers) {
            int at = lower.indexOf(marker.toLowerCase(Locale.ROOT));
            if (at >= 0) {
                violations.add(new Violation(ViolationKind.VALIDATION_FAILED,
                        "Prompt injection marker: " + marker, lineOf(content, at), columnOf(content, at)));
            }
        }
        return violations;
    }

    static int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    static int columnOf(String content, int offset) {
        int lineStart = content.lastIndexOf('\n', offset - 1) + 1;
        return offset - lineStart + 1;
    }
}
