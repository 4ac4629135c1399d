package com.warden.core.model;

import java.io.Serializable;

/**
 * A single detected rule breach.
 *
 * @param kind   taxonomy entry
 * @param detail human-readable description, names the offending call/module where applicable
 * @param line   1-based source line, or 0 when not derivable
 * @param column 1-based source column, or 0 when not derivable
 */
public record Violation(
    ViolationKind kind,
    String detail,
    int line,
    int column
) implements Serializable {

    public static Violation of(ViolationKind kind, String detail) {
        return new Violation(kind, detail, 0, 0);
    }

    public boolean hasLocation() {
        return line > 0;
    }

    @Override
    public String toString() {
        return hasLocation()
                ? kind + " at " + line + ":" + column + ": " + detail
                : kind + ": " + detail;
    }
}
