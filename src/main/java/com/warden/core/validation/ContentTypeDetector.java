package com.warden.core.validation;

import com.warden.core.model.ContentType;

import java.util.List;

/**
 * Keyword heuristics guessing what kind of content was submitted. The result is diagnostic:
 * the caller-provided type decides which rules apply.
 */
public final class ContentTypeDetector {

    private static final List<String> CODE_INDICATORS = List.of(
            "def ", "class ", "import ", "from ", "return ", "if ", "for ", "while ", "try:", "except:",
            "eval(", "exec(", "compile(", "print(", "=");

    private static final List<String> EXPRESSION_INDICATORS = List.of(
            "rank(", "delay(", "delta(", "ts_sum(", "ts_mean(", "close", "open", "high", "low", "volume");

    private static final List<String> CONFIG_INDICATORS = List.of("{", "}", ":", "config", "settings");

    private ContentTypeDetector() {}

    public static ContentType detect(String content) {
        if (containsAny(content, CODE_INDICATORS)) {
            return ContentType.CODE;
        }
        if (containsAny(content, EXPRESSION_INDICATORS)) {
            return ContentType.EXPRESSION;
        }
        if (containsAny(content, CONFIG_INDICATORS)) {
            return ContentType.CONFIG;
        }
        return ContentType.PROMPT;
    }

    private static boolean containsAny(String content, List<String> indicators) {
        for (String indicator : indicators) {
            if (content.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
