package com.warden.dispatch.cli;

import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden audit
 */
@Command(name = "audit", mixinStandardHelpOptions = true,
        description = "Inspect and verify the audit trail",
        subcommands = {AuditCommand.Verify.class, AuditCommand.Recent.class})
@Component
public class AuditCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.info("Use 'audit verify' or 'audit recent'");
    }

    @Command(name = "verify", mixinStandardHelpOptions = true,
            description = "Re-compute the signature chain of one day's audit file")
    @Component
    public static class Verify implements Callable<Integer> {

        private final AuditQueryService queryService;

        @Option(names = {"-d", "--date"}, description = "Day to verify (yyyy-MM-dd), default today UTC")
        LocalDate date;

        public Verify(AuditQueryService queryService) {
            this.queryService = queryService;
        }

        @Override
        public Integer call() {
            var report = queryService.verify(date);
            if (report.valid()) {
                ConsoleOutput.success(report.file() + ": " + report.entries() + " entries, chain intact");
                return 0;
            }
            ConsoleOutput.error(report.file() + ": tampered lines " + report.invalidLines());
            return 1;
        }
    }

    @Command(name = "recent", mixinStandardHelpOptions = true, description = "Show the most recent audit events")
    @Component
    public static class Recent implements Runnable {

        private final AuditQueryService queryService;

        @Option(names = {"-n", "--count"}, defaultValue = "20", description = "Number of events")
        int count;

        @Option(names = "--type", description = "Only events of this type: ${COMPLETION-CANDIDATES}")
        AuditEventType type;

        public Recent(AuditQueryService queryService) {
            this.queryService = queryService;
        }

        @Override
        public void run() {
            List<AuditEvent> events = type == null ? queryService.recent(count) : queryService.byType(type, count);
            if (events.isEmpty()) {
                ConsoleOutput.info("No audit events");
                return;
            }
            for (AuditEvent event : events) {
                ConsoleOutput.info(event.timestamp() + " " + event.eventType() + " " + event.decision()
                        + (event.requestId().isEmpty() ? "" : " " + event.requestId())
                        + (event.violations().isEmpty() ? "" : " " + event.violations()));
            }
        }
    }
}
