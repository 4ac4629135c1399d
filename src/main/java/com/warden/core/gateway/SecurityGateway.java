package com.warden.core.gateway;

import com.warden.core.audit.AuditEvent;
import com.warden.core.audit.AuditEventType;
import com.warden.core.audit.AuditLogger;
import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.GatewayMetrics;
import com.warden.core.model.ContentType;
import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.GatewayResult;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.SecurityContext;
import com.warden.core.model.ValidationResult;
import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.network.NetworkGuard;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyConfigurationException;
import com.warden.core.policy.PolicyHolder;
import com.warden.core.policy.PolicySnapshot;
import com.warden.core.resource.Breach;
import com.warden.core.resource.BreachCheck;
import com.warden.core.resource.EnforcementPlan;
import com.warden.core.resource.ResourceLimiter;
import com.warden.core.validation.ContentHasher;
import com.warden.core.validation.ContentValidator;
import com.warden.sandbox.ExecutionRequest;
import com.warden.sandbox.PoolExhaustedException;
import com.warden.sandbox.SandboxCreationException;
import com.warden.sandbox.SandboxCreationTimeoutException;
import com.warden.sandbox.SandboxLease;
import com.warden.sandbox.SandboxPool;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for untrusted content: validate, then (only if approved) execute under the
 * requested or degraded isolation level, then audit once.
 *
 * <p>Every request carries one deadline that bounds the pool wait, sandbox creation, the execution
 * and the whole call. Any failure past validation is turned into a typed {@link ExecutionResult}; the only
 * exception callers see is {@link IllegalArgumentException} for missing arguments.
 */
@Service
public class SecurityGateway {

    private static final Logger log = LoggerFactory.getLogger(SecurityGateway.class);

    private static final String COMPONENT = "security-gateway";

    private final ContentValidator validator;
    private final SandboxPool pool;
    private final ResourceLimiter limiter;
    private final DegradationLadder ladder;
    private final NetworkGuard networkGuard;
    private final AuditLogger auditLogger;
    private final EventBus eventBus;
    private final PolicyHolder policyHolder;
    private final GatewayMetrics metrics;
    private final long latencyWarningMillis;
    private final ExecutorService executions;

    @Autowired
    public SecurityGateway(ContentValidator validator, SandboxPool pool, ResourceLimiter limiter,
                           DegradationLadder ladder, NetworkGuard networkGuard, AuditLogger auditLogger,
                           EventBus eventBus, PolicyHolder policyHolder, GatewayProperties properties,
                           @Autowired(required = false) GatewayMetrics metrics) {
        this(validator, pool, limiter, ladder, networkGuard, auditLogger, eventBus, policyHolder, metrics,
                properties.getLatencyWarningMillis());
    }

    public SecurityGateway(ContentValidator validator, SandboxPool pool, ResourceLimiter limiter,
                           DegradationLadder ladder, NetworkGuard networkGuard, AuditLogger auditLogger,
                           EventBus eventBus, PolicyHolder policyHolder, GatewayMetrics metrics,
                           long latencyWarningMillis) {
        this.validator = validator;
        this.pool = pool;
        this.limiter = limiter;
        this.ladder = ladder;
        this.networkGuard = networkGuard;
        this.auditLogger = auditLogger;
        this.eventBus = eventBus;
        this.policyHolder = policyHolder;
        this.metrics = metrics;
        this.latencyWarningMillis = latencyWarningMillis;
        var counter = new AtomicInteger();
        this.executions = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gateway-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executions.shutdownNow();
    }

    /**
     * Validates {@code content} and, if approved, executes it.
     *
     * @throws IllegalArgumentException if content is null or blank, or type or context is null
     */
    public GatewayResult validateAndExecute(String content, ContentType type, SecurityContext context) {
        return process(content, type, context, true);
    }

    /** Validation and audit only; nothing is executed. */
    public GatewayResult validateOnly(String content, ContentType type, SecurityContext context) {
        return process(content, type, context, false);
    }

    private GatewayResult process(String content, ContentType type, SecurityContext context, boolean execute) {
        requireArguments(content, type, context);
        long startNanos = System.nanoTime();
        Instant deadline = Instant.now().plus(context.timeout());
        String requestId = context.requestId();
        MdcContext.setRequest(context);
        try {
            eventBus.publish(GatewayEvent.of(GatewayEvents.VALIDATION_REQUESTED, requestId, context.componentName(),
                    Map.of("contentType", type.name(), "contentHash", ContentHasher.sha256Hex(content))));

            ContentValidator.Inspection inspection = inspect(content, type);
            ValidationResult validation = inspection.result();
            if (metrics != null) {
                metrics.recordValidation(type.name(), validation.approved(), validation.elapsedNanos());
            }
            eventBus.publish(GatewayEvent.of(GatewayEvents.VALIDATION_COMPLETED, requestId, context.componentName(),
                    Map.of("approved", validation.approved(),
                            "violations", validation.violations().size(),
                            "elapsedMillis", validation.elapsedMillis())));

            var layers = new LinkedHashMap<String, Object>();
            layers.put("contentTypeDetection", detectionLayer(type, inspection));
            layers.put("astValidation", validationLayer(validation));

            if (!validation.approved()) {
                reportViolations(context, validation.violations().stream().map(Violation::kind).toList(),
                        validation.riskScore());
                layers.put("sandboxExecution", Map.of("executed", false));
                var result = new GatewayResult(requestId, validation, null, validation.reason(), false, layers,
                        elapsedMillis(startNanos));
                audit(context, type, inspection, result, null);
                finish(result, startNanos, 0);
                return result;
            }
            if (!execute) {
                layers.put("sandboxExecution", Map.of("executed", false));
                var result = new GatewayResult(requestId, validation, null, "approved", false, layers,
                        elapsedMillis(startNanos));
                audit(context, type, inspection, result, null);
                finish(result, startNanos, 0);
                return result;
            }

            Attempt attempt = runGuarded(content, type, context, deadline);
            ExecutionResult execution = attempt.result();
            layers.put("sandboxExecution", executionLayer(execution));
            layers.put("degradation", degradationLayer(context.isolationLevel(), attempt));
            if (!execution.success() && execution.classification().toViolationKind() != null) {
                reportViolations(context, List.of(execution.classification().toViolationKind()), 1.0);
            }
            boolean degraded = attempt.level() != null && attempt.level() != context.isolationLevel();
            var result = new GatewayResult(requestId, validation, execution, reasonFor(execution), degraded,
                    layers, elapsedMillis(startNanos));
            audit(context, type, inspection, result, attempt);
            finish(result, startNanos, execution.wallTimeMs());
            return result;
        } finally {
            networkGuard.clearContext(requestId);
            MdcContext.clear();
        }
    }

    private ContentValidator.Inspection inspect(String content, ContentType type) {
        try {
            return validator.inspect(content, type);
        } catch (RuntimeException e) {
            log.error("Validator failed; rejecting content", e);
            var failed = new ValidationResult(false, type,
                    List.of(Violation.of(ViolationKind.VALIDATION_FAILED, "Internal validation error: " + e.getMessage())),
                    1.0, 0, ContentHasher.sha256Hex(content));
            return new ContentValidator.Inspection(failed, null, false);
        }
    }

    private Attempt runGuarded(String content, ContentType type, SecurityContext context, Instant deadline) {
        try {
            return run(content, type, context, deadline);
        } catch (RuntimeException e) {
            log.error("Execution phase failed unexpectedly", e);
            return new Attempt(ExecutionResult.failure(ExitClassification.EXECUTION_FAILED,
                    "internal error: " + e.getMessage(), context.isolationLevel(), "", 0, 0, -1), null, List.of());
        }
    }

    /**
     * Acquires a sandbox at the strongest level the ladder allows, walking down on creation
     * failures, and runs the content once.
     */
    private Attempt run(String content, ContentType type, SecurityContext context, Instant deadline) {
        IsolationLevel requested = context.isolationLevel();
        var steps = new ArrayList<Map<String, Object>>();
        Optional<IsolationLevel> candidate = ladder.effectiveLevel(requested);
        if (candidate.isPresent() && candidate.get() != requested) {
            steps.add(step(requested, candidate.get(), "level already down"));
        }
        while (true) {
            if (candidate.isEmpty()) {
                return new Attempt(ExecutionResult.failure(ExitClassification.SANDBOX_CREATION_FAILED,
                        "no isolation level from " + requested + " down to " + ladder.floor() + " is available",
                        requested, "", 0, 0, -1), null, steps);
            }
            IsolationLevel level = candidate.get();
            Duration remaining = remaining(deadline);
            if (remaining.isZero()) {
                return new Attempt(ExecutionResult.failure(ExitClassification.TIMEOUT_EXCEEDED,
                        "deadline expired before a sandbox was available", level, "", 0, 0, -1), level, steps);
            }
            SandboxLease lease;
            try {
                lease = pool.acquire(level, remaining, context.requestId());
            } catch (PoolExhaustedException e) {
                log.warn("Pool exhausted at {}: {}", level, e.getMessage());
                return new Attempt(ExecutionResult.failure(ExitClassification.POOL_EXHAUSTED, e.getMessage(),
                        level, "", 0, 0, -1), level, steps);
            } catch (SandboxCreationTimeoutException e) {
                log.warn("Sandbox creation at {} outlived the deadline: {}", level, e.getMessage());
                return new Attempt(ExecutionResult.failure(ExitClassification.TIMEOUT_EXCEEDED, e.getMessage(),
                        level, "", 0, 0, -1), level, steps);
            } catch (SandboxCreationException e) {
                log.warn("Sandbox creation failed at {}: {}", level, e.getMessage());
                boolean tripped = ladder.recordFailure(level);
                Optional<IsolationLevel> next = ladder.effectiveLevel(requested);
                if (tripped) {
                    degrade(context, level, next.orElse(null), e.getMessage());
                }
                if (next.isEmpty() || next.get() != level) {
                    steps.add(step(level, next.orElse(null), e.getMessage()));
                }
                candidate = next;
                continue;
            }
            ladder.recordSuccess(level);
            MdcContext.setIsolationLevel(level.name());
            return new Attempt(executeLeased(lease, content, type, context, level, deadline), level, steps);
        }
    }

    private ExecutionResult executeLeased(SandboxLease lease, String content, ContentType type,
                                          SecurityContext context, IsolationLevel level, Instant deadline) {
        String requestId = context.requestId();
        try {
            PolicySnapshot policy = policyHolder.current();
            EnforcementPlan plan = limiter.plan(context.budget(), level);
            BreachCheck networkCheck = () -> networkGuard.hasRepeatedDenials(requestId)
                    ? Optional.of(new Breach(ExitClassification.NETWORK_VIOLATION,
                            networkGuard.deniedAttempts(requestId) + " denied network attempts"))
                    : Optional.empty();
            var request = new ExecutionRequest(content, type, context.withIsolationLevel(level), plan, deadline,
                    List.of(networkCheck), policy.capabilitiesFor(type));

            Map<String, String> mdc = MDC.getCopyOfContextMap();
            Future<ExecutionResult> future = executions.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return lease.execute(request);
                } finally {
                    MDC.clear();
                }
            });
            long waitMillis = remaining(deadline).toMillis();
            try {
                return future.get(waitMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lease.abandon();
                log.warn("Execution in {} exceeded the deadline; sandbox teardown scheduled", lease.sandboxId());
                return ExecutionResult.failure(ExitClassification.TIMEOUT_EXCEEDED,
                        "execution exceeded the request deadline of " + context.timeout().toMillis() + "ms",
                        level, lease.sandboxId(), context.timeout().toMillis(), 0, -1);
            } catch (ExecutionException e) {
                lease.abandon();
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Execution in {} failed", lease.sandboxId(), cause);
                return ExecutionResult.failure(ExitClassification.EXECUTION_FAILED, String.valueOf(cause.getMessage()),
                        level, lease.sandboxId(), 0, 0, -1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                lease.abandon();
                return ExecutionResult.failure(ExitClassification.EXECUTION_FAILED, "interrupted while executing",
                        level, lease.sandboxId(), 0, 0, -1);
            }
        } finally {
            lease.close();
        }
    }

    private void degrade(SecurityContext context, IsolationLevel from, IsolationLevel to, String reason) {
        String target = to == null ? "none" : to.name();
        log.warn("Degrading from {} to {}: {}", from, target, reason);
        if (metrics != null) {
            metrics.recordDegradation(from.name(), target);
        }
        eventBus.publish(GatewayEvent.of(GatewayEvents.DEGRADATION_TRIGGERED, context.requestId(),
                context.componentName(), Map.of("from", from.name(), "to", target, "reason", reason)));
        eventBus.publish(GatewayEvent.of(GatewayEvents.ALERT_RAISED, context.requestId(), COMPONENT,
                Map.of("alert", "isolation level " + from + " is down", "reason", reason)));
        appendSafely(AuditEvent.builder(AuditEventType.DEGRADATION, COMPONENT)
                .requestId(context.requestId())
                .decision("DEGRADED")
                .detail("from", from.name())
                .detail("to", target)
                .detail("reason", reason)
                .build());
    }

    /**
     * Replaces the active policy from a JSON document and audits the change.
     *
     * @throws PolicyConfigurationException if the document is rejected; the old policy stays active
     */
    public PolicySnapshot reloadPolicy(String json, String actor) {
        String previous = policyHolder.current().version();
        try {
            PolicySnapshot next = policyHolder.reload(json);
            appendSafely(AuditEvent.builder(AuditEventType.POLICY_CHANGE, COMPONENT)
                    .decision("APPLIED")
                    .detail("previousVersion", previous)
                    .detail("version", next.version())
                    .detail("actor", actor)
                    .build());
            return next;
        } catch (PolicyConfigurationException e) {
            appendSafely(AuditEvent.builder(AuditEventType.POLICY_CHANGE, COMPONENT)
                    .decision("REJECTED")
                    .detail("activeVersion", previous)
                    .detail("actor", actor)
                    .detail("reason", e.getMessage())
                    .build());
            throw e;
        }
    }

    /** Administrative ladder reset; the only way back to a stronger level. */
    public boolean resetLevel(IsolationLevel level, String actor) {
        return ladder.reset(level, actor);
    }

    private void reportViolations(SecurityContext context, List<ViolationKind> kinds, double riskScore) {
        if (metrics != null) {
            kinds.forEach(kind -> metrics.recordViolation(kind.name()));
        }
        eventBus.publish(GatewayEvent.of(GatewayEvents.SECURITY_VIOLATION_DETECTED, context.requestId(),
                context.componentName(), Map.of(
                        "kinds", kinds.stream().map(Enum::name).distinct().toList(),
                        "riskScore", riskScore)));
    }

    private void audit(SecurityContext context, ContentType type, ContentValidator.Inspection inspection,
                       GatewayResult result, Attempt attempt) {
        ValidationResult validation = result.validation();
        var violations = new ArrayList<String>();
        validation.violations().forEach(v -> violations.add(v.kind() + ": " + v.detail()));
        var builder = AuditEvent.builder(AuditEventType.REQUEST, COMPONENT)
                .requestId(context.requestId())
                .context("component", context.componentName())
                .context("userId", context.userId())
                .context("sessionId", context.sessionId())
                .context("isolationLevel", context.isolationLevel().name())
                .context("budget", context.budget().toString())
                .contentHash(validation.contentHash())
                .durationMillis(result.totalMillis())
                .detail("contentType", type.name())
                .detail("detectedType", inspection.detectedType() == null ? null : inspection.detectedType().name())
                .detail("riskScore", validation.riskScore())
                .detail("reason", result.reason());
        ExecutionResult execution = result.execution();
        if (execution == null) {
            builder.decision(validation.approved() ? "APPROVED" : "REJECTED");
        } else {
            builder.decision(decisionFor(execution))
                    .resource("isolationLevel", execution.isolationLevel().name())
                    .resource("wallTimeMs", execution.wallTimeMs())
                    .resource("peakMemoryBytes", execution.peakMemoryBytes())
                    .detail("classification", execution.classification().name())
                    .detail("sandboxId", execution.sandboxId())
                    .detail("degraded", result.degraded());
            if (attempt != null && !attempt.steps().isEmpty()) {
                builder.detail("degradation", attempt.steps());
            }
            if (execution.classification().toViolationKind() != null) {
                violations.add(execution.classification().toViolationKind() + ": " + execution.failureReason());
            }
        }
        appendSafely(builder.violations(violations).build());
    }

    private void appendSafely(AuditEvent event) {
        try {
            auditLogger.append(event);
        } catch (RuntimeException e) {
            log.error("Audit append failed for {} event", event.eventType(), e);
        }
    }

    private void finish(GatewayResult result, long startNanos, long executionMillis) {
        long total = elapsedMillis(startNanos);
        long pipeline = total - executionMillis;
        if (pipeline > latencyWarningMillis) {
            log.warn("Gateway pipeline took {}ms (excluding execution), budget is {}ms", pipeline, latencyWarningMillis);
        }
        if (metrics != null) {
            metrics.recordRequest(outcomeOf(result), total);
            result.executionResult().ifPresent(e ->
                    metrics.recordExecution(e.isolationLevel().name(), e.classification().name(), e.wallTimeMs()));
        }
        log.info("Request finished: {} in {}ms", result.reason(), total);
    }

    private static String outcomeOf(GatewayResult result) {
        if (!result.approved()) {
            return "rejected";
        }
        return result.executionResult().map(e -> e.classification().name().toLowerCase()).orElse("approved");
    }

    private static String decisionFor(ExecutionResult execution) {
        if (execution.classification() == ExitClassification.NOT_EXECUTED) {
            return "NOT_EXECUTED";
        }
        return execution.success() ? "EXECUTED" : "FAILED";
    }

    private static String reasonFor(ExecutionResult execution) {
        if (execution.classification() == ExitClassification.NOT_EXECUTED) {
            return "approved; not executed at " + execution.isolationLevel();
        }
        if (execution.success()) {
            return "executed at " + execution.isolationLevel();
        }
        return execution.classification() + ": " + execution.failureReason();
    }

    private static Map<String, Object> detectionLayer(ContentType provided, ContentValidator.Inspection inspection) {
        var layer = new LinkedHashMap<String, Object>();
        layer.put("provided", provided.name());
        layer.put("detected", inspection.detectedType() == null ? "UNKNOWN" : inspection.detectedType().name());
        layer.put("mismatch", inspection.detectedType() != null && inspection.detectedType() != provided);
        layer.put("escalated", inspection.escalated());
        return layer;
    }

    private static Map<String, Object> validationLayer(ValidationResult validation) {
        var layer = new LinkedHashMap<String, Object>();
        layer.put("approved", validation.approved());
        layer.put("violations", validation.violations().size());
        layer.put("riskScore", validation.riskScore());
        layer.put("elapsedMillis", validation.elapsedMillis());
        return layer;
    }

    private static Map<String, Object> executionLayer(ExecutionResult execution) {
        var layer = new LinkedHashMap<String, Object>();
        layer.put("executed", execution.classification() != ExitClassification.NOT_EXECUTED
                && !execution.sandboxId().isEmpty());
        layer.put("isolationLevel", execution.isolationLevel().name());
        layer.put("sandboxId", execution.sandboxId());
        layer.put("classification", execution.classification().name());
        layer.put("wallTimeMs", execution.wallTimeMs());
        layer.put("peakMemoryBytes", execution.peakMemoryBytes());
        layer.put("exitCode", execution.exitCode());
        return layer;
    }

    private static Map<String, Object> degradationLayer(IsolationLevel requested, Attempt attempt) {
        var layer = new LinkedHashMap<String, Object>();
        layer.put("requested", requested.name());
        layer.put("effective", attempt.level() == null ? "none" : attempt.level().name());
        layer.put("degraded", attempt.level() != null && attempt.level() != requested);
        layer.put("steps", attempt.steps());
        return layer;
    }

    private static Map<String, Object> step(IsolationLevel from, IsolationLevel to, String reason) {
        var step = new LinkedHashMap<String, Object>();
        step.put("from", from.name());
        step.put("to", to == null ? "none" : to.name());
        step.put("reason", reason);
        return step;
    }

    private static void requireArguments(String content, ContentType type, SecurityContext context) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("content type must not be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("security context must not be null");
        }
    }

    private static Duration remaining(Instant deadline) {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Outcome of the execution phase: the result, the level it ran at (null if none) and degradation steps. */
    private record Attempt(ExecutionResult result, IsolationLevel level, List<Map<String, Object>> steps) {}
}
