package com.warden.core.audit;

/**
 * Signals that stored audit entries no longer match their signatures.
 */
public class AuditIntegrityException extends RuntimeException {

    private final IntegrityReport report;

    public AuditIntegrityException(IntegrityReport report) {
        super("Audit log " + report.file() + " failed verification at lines " + report.invalidLines());
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
