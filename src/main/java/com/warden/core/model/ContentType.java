package com.warden.core.model;

/**
 * Category of untrusted artifact submitted to the gateway. Determines which validation rules apply.
 */
public enum ContentType {
    CODE,
    PROMPT,
    CONFIG,
    EXPRESSION;

    /** True for content that is parsed into a syntax tree and may be executed. */
    public boolean isExecutable() {
        return this == CODE || this == EXPRESSION;
    }
}
