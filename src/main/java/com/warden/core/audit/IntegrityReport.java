package com.warden.core.audit;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of re-computing the signature chain of one audit file.
 *
 * @param date         day covered by the file
 * @param file         file name
 * @param entries      number of entries read
 * @param invalidLines 1-based line numbers whose signature or chain link does not match
 */
public record IntegrityReport(
    LocalDate date,
    String file,
    int entries,
    List<Integer> invalidLines
) {

    public IntegrityReport {
        invalidLines = List.copyOf(invalidLines);
    }

    public boolean valid() {
        return invalidLines.isEmpty();
    }

    public IntegrityReport orThrow() {
        if (!valid()) {
            throw new AuditIntegrityException(this);
        }
        return this;
    }
}
