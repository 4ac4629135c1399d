package com.warden.dispatch.api;

import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditQueryService;
import com.warden.core.audit.IntegrityReport;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to the audit trail.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditQueryService queryService;

    public AuditController(AuditQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/recent")
    public List<AuditEvent> recent(@RequestParam(defaultValue = "50") int count) {
        if (count <= 0 || count > 1000) {
            throw new IllegalArgumentException("count must be between 1 and 1000");
        }
        return queryService.recent(count);
    }

    @GetMapping("/type/{type}")
    public List<AuditEvent> byType(@PathVariable String type,
                                   @RequestParam(defaultValue = "50") int limit) {
        return queryService.byType(AuditEventType.valueOf(type.toUpperCase()), limit);
    }

    /**
     * GET /api/v1/audit/verify?date=yyyy-MM-dd. Defaults to today (UTC).
     * Answers 409 when the chain is broken.
     */
    @GetMapping("/verify")
    public ResponseEntity<IntegrityReport> verify(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        IntegrityReport report = queryService.verify(date);
        return report.valid() ? ResponseEntity.ok(report) : ResponseEntity.status(409).body(report);
    }
}
