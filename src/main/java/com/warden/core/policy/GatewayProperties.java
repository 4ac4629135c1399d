package com.warden.core.policy;

import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Startup policy and gateway tuning, bound from {@code warden.gateway.*}.
 * Converted once into a {@link PolicySnapshot}; nothing reads these setters at request time.
 */
@Component
@ConfigurationProperties(prefix = "warden.gateway")
public class GatewayProperties {

    private String policyVersion = "1";
    private int timeoutSeconds = 30;
    private long latencyWarningMillis = 150;
    private Map<ContentType, Capabilities> capabilities = defaultCapabilities();
    private Limits limits = new Limits();
    private List<String> maliciousPatterns = new ArrayList<>(DefaultPolicy.MALICIOUS_PATTERNS);
    private List<String> injectionMarkers = new ArrayList<>(DefaultPolicy.INJECTION_MARKERS);
    private Network network = new Network();
    private Map<IsolationLevel, Ceiling> ceilings = defaultCeilings();
    private Pool pool = new Pool();
    private Audit audit = new Audit();
    private Degradation degradation = new Degradation();
    private Operators operators = new Operators();

    /**
     * Builds the immutable snapshot. Fails with {@link PolicyConfigurationException} when the
     * configuration is inconsistent, which aborts startup.
     */
    public PolicySnapshot toSnapshot() {
        var caps = new EnumMap<ContentType, CapabilitySet>(ContentType.class);
        capabilities.forEach((type, c) -> caps.put(type, new CapabilitySet(
                new LinkedHashSet<>(c.getAllowedCalls()), new LinkedHashSet<>(c.getAllowedModules()),
                new LinkedHashSet<>(c.getDeniedCalls()), new LinkedHashSet<>(c.getDeniedModules()))));
        var budgetCeilings = new EnumMap<IsolationLevel, ResourceBudget>(IsolationLevel.class);
        ceilings.forEach((level, c) -> budgetCeilings.put(level, c.toBudget()));
        return new PolicySnapshot(
                policyVersion,
                caps,
                limits.toLimits(),
                maliciousPatterns,
                injectionMarkers,
                new NetworkPolicy(new LinkedHashSet<>(lowerCase(network.getAllowedDomains())),
                        network.getDenyRanges(), network.getRepeatedDenialThreshold()),
                budgetCeilings,
                pool.getTargetSize(),
                Duration.ofSeconds(timeoutSeconds),
                audit.getRetentionDays(),
                null);
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.trim().toLowerCase()).toList();
    }

    private static Map<ContentType, Capabilities> defaultCapabilities() {
        var map = new EnumMap<ContentType, Capabilities>(ContentType.class);
        var code = new Capabilities();
        code.setAllowedCalls(new ArrayList<>(DefaultPolicy.ALLOWED_BUILTINS));
        code.getAllowedCalls().addAll(DefaultPolicy.OPERATORS.stream()
                .filter(op -> !code.getAllowedCalls().contains(op)).toList());
        code.setAllowedModules(new ArrayList<>(DefaultPolicy.ALLOWED_MODULES));
        code.setDeniedCalls(new ArrayList<>(DefaultPolicy.DENIED_CALLS));
        code.setDeniedModules(new ArrayList<>(DefaultPolicy.DENIED_MODULES));
        map.put(ContentType.CODE, code);

        // EXPRESSION allowed calls come from the operator registry.
        var expression = new Capabilities();
        expression.setDeniedCalls(new ArrayList<>(DefaultPolicy.DENIED_CALLS));
        expression.setDeniedModules(new ArrayList<>(DefaultPolicy.DENIED_MODULES));
        map.put(ContentType.EXPRESSION, expression);

        var config = new Capabilities();
        config.setDeniedCalls(new ArrayList<>(DefaultPolicy.DENIED_CALLS));
        config.setDeniedModules(new ArrayList<>(DefaultPolicy.DENIED_MODULES));
        map.put(ContentType.CONFIG, config);
        map.put(ContentType.PROMPT, new Capabilities());
        return map;
    }

    private static Map<IsolationLevel, Ceiling> defaultCeilings() {
        var map = new EnumMap<IsolationLevel, Ceiling>(IsolationLevel.class);
        map.put(IsolationLevel.MICRO_VM, new Ceiling(2048, 2.0, 128, 120));
        map.put(IsolationLevel.USERSPACE_KERNEL, new Ceiling(2048, 2.0, 128, 120));
        map.put(IsolationLevel.CONTAINER, new Ceiling(1024, 2.0, 64, 60));
        map.put(IsolationLevel.NAMESPACE_SANDBOX, new Ceiling(512, 1.0, 32, 30));
        return map;
    }

    public String getPolicyVersion() { return policyVersion; }
    public void setPolicyVersion(String policyVersion) { this.policyVersion = policyVersion; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public long getLatencyWarningMillis() { return latencyWarningMillis; }
    public void setLatencyWarningMillis(long latencyWarningMillis) { this.latencyWarningMillis = latencyWarningMillis; }
    public Map<ContentType, Capabilities> getCapabilities() { return capabilities; }
    public void setCapabilities(Map<ContentType, Capabilities> capabilities) { this.capabilities = capabilities; }
    public Limits getLimits() { return limits; }
    public void setLimits(Limits limits) { this.limits = limits; }
    public List<String> getMaliciousPatterns() { return maliciousPatterns; }
    public void setMaliciousPatterns(List<String> maliciousPatterns) { this.maliciousPatterns = maliciousPatterns; }
    public List<String> getInjectionMarkers() { return injectionMarkers; }
    public void setInjectionMarkers(List<String> injectionMarkers) { this.injectionMarkers = injectionMarkers; }
    public Network getNetwork() { return network; }
    public void setNetwork(Network network) { this.network = network; }
    public Map<IsolationLevel, Ceiling> getCeilings() { return ceilings; }
    public void setCeilings(Map<IsolationLevel, Ceiling> ceilings) { this.ceilings = ceilings; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Degradation getDegradation() { return degradation; }
    public void setDegradation(Degradation degradation) { this.degradation = degradation; }
    public Operators getOperators() { return operators; }
    public void setOperators(Operators operators) { this.operators = operators; }

    public static class Capabilities {
        private List<String> allowedCalls = new ArrayList<>();
        private List<String> allowedModules = new ArrayList<>();
        private List<String> deniedCalls = new ArrayList<>();
        private List<String> deniedModules = new ArrayList<>();

        public List<String> getAllowedCalls() { return allowedCalls; }
        public void setAllowedCalls(List<String> allowedCalls) { this.allowedCalls = allowedCalls; }
        public List<String> getAllowedModules() { return allowedModules; }
        public void setAllowedModules(List<String> allowedModules) { this.allowedModules = allowedModules; }
        public List<String> getDeniedCalls() { return deniedCalls; }
        public void setDeniedCalls(List<String> deniedCalls) { this.deniedCalls = deniedCalls; }
        public List<String> getDeniedModules() { return deniedModules; }
        public void setDeniedModules(List<String> deniedModules) { this.deniedModules = deniedModules; }
    }

    public static class Limits {
        private int maxDepth = ValidationLimits.DEFAULT.maxDepth();
        private int maxNodes = ValidationLimits.DEFAULT.maxNodes();
        private int maxComplexity = ValidationLimits.DEFAULT.maxComplexity();
        private int maxImports = ValidationLimits.DEFAULT.maxImports();
        private int maxCodeChars = ValidationLimits.DEFAULT.maxCodeChars();
        private int maxCodeLines = ValidationLimits.DEFAULT.maxCodeLines();
        private int maxPromptChars = ValidationLimits.DEFAULT.maxPromptChars();
        private int maxConfigDepth = ValidationLimits.DEFAULT.maxConfigDepth();

        ValidationLimits toLimits() {
            return new ValidationLimits(maxDepth, maxNodes, maxComplexity, maxImports,
                    maxCodeChars, maxCodeLines, maxPromptChars, maxConfigDepth);
        }

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getMaxNodes() { return maxNodes; }
        public void setMaxNodes(int maxNodes) { this.maxNodes = maxNodes; }
        public int getMaxComplexity() { return maxComplexity; }
        public void setMaxComplexity(int maxComplexity) { this.maxComplexity = maxComplexity; }
        public int getMaxImports() { return maxImports; }
        public void setMaxImports(int maxImports) { this.maxImports = maxImports; }
        public int getMaxCodeChars() { return maxCodeChars; }
        public void setMaxCodeChars(int maxCodeChars) { this.maxCodeChars = maxCodeChars; }
        public int getMaxCodeLines() { return maxCodeLines; }
        public void setMaxCodeLines(int maxCodeLines) { this.maxCodeLines = maxCodeLines; }
        public int getMaxPromptChars() { return maxPromptChars; }
        public void setMaxPromptChars(int maxPromptChars) { this.maxPromptChars = maxPromptChars; }
        public int getMaxConfigDepth() { return maxConfigDepth; }
        public void setMaxConfigDepth(int maxConfigDepth) { this.maxConfigDepth = maxConfigDepth; }
    }

    public static class Network {
        private List<String> allowedDomains = new ArrayList<>(DefaultPolicy.ALLOWED_DOMAINS);
        private List<String> denyRanges = new ArrayList<>(DefaultPolicy.DENY_RANGES);
        private int repeatedDenialThreshold = 3;
        private int trafficLogSize = 10_000;
        private Proxy proxy = new Proxy();

        public List<String> getAllowedDomains() { return allowedDomains; }
        public void setAllowedDomains(List<String> allowedDomains) { this.allowedDomains = allowedDomains; }
        public List<String> getDenyRanges() { return denyRanges; }
        public void setDenyRanges(List<String> denyRanges) { this.denyRanges = denyRanges; }
        public int getRepeatedDenialThreshold() { return repeatedDenialThreshold; }
        public void setRepeatedDenialThreshold(int repeatedDenialThreshold) { this.repeatedDenialThreshold = repeatedDenialThreshold; }
        public int getTrafficLogSize() { return trafficLogSize; }
        public void setTrafficLogSize(int trafficLogSize) { this.trafficLogSize = trafficLogSize; }
        public Proxy getProxy() { return proxy; }
        public void setProxy(Proxy proxy) { this.proxy = proxy; }
    }

    public static class Proxy {
        private boolean enabled = false;
        private String bindAddress = "0.0.0.0";
        private int port = 3128;
        /** Address sandboxes use to reach the proxy, e.g. the docker bridge gateway. */
        private String advertisedHost = "172.17.0.1";
        private int connectTimeoutMillis = 5_000;
        private int maxConnections = 64;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBindAddress() { return bindAddress; }
        public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getAdvertisedHost() { return advertisedHost; }
        public void setAdvertisedHost(String advertisedHost) { this.advertisedHost = advertisedHost; }
        public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }
        public int getMaxConnections() { return maxConnections; }
        public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }
    }

    public static class Ceiling {
        private int memoryMb;
        private double cpuCores;
        private int processes;
        private int wallTimeSeconds;

        public Ceiling() {}

        public Ceiling(int memoryMb, double cpuCores, int processes, int wallTimeSeconds) {
            this.memoryMb = memoryMb;
            this.cpuCores = cpuCores;
            this.processes = processes;
            this.wallTimeSeconds = wallTimeSeconds;
        }

        ResourceBudget toBudget() {
            return new ResourceBudget(memoryMb, cpuCores, processes, Duration.ofSeconds(wallTimeSeconds));
        }

        public int getMemoryMb() { return memoryMb; }
        public void setMemoryMb(int memoryMb) { this.memoryMb = memoryMb; }
        public double getCpuCores() { return cpuCores; }
        public void setCpuCores(double cpuCores) { this.cpuCores = cpuCores; }
        public int getProcesses() { return processes; }
        public void setProcesses(int processes) { this.processes = processes; }
        public int getWallTimeSeconds() { return wallTimeSeconds; }
        public void setWallTimeSeconds(int wallTimeSeconds) { this.wallTimeSeconds = wallTimeSeconds; }
    }

    public static class Pool {
        private Map<IsolationLevel, Integer> targetSize = new EnumMap<>(Map.of(
                IsolationLevel.CONTAINER, 2, IsolationLevel.NAMESPACE_SANDBOX, 2));
        private int maxSize = 10;
        private long leaseGraceMillis = 5_000;
        private long acquireP99ThresholdMillis = 250;
        private int idleShrinkTicks = 12;
        private long maintenanceIntervalMillis = 5_000;

        public Map<IsolationLevel, Integer> getTargetSize() { return targetSize; }
        public void setTargetSize(Map<IsolationLevel, Integer> targetSize) { this.targetSize = targetSize; }
        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public long getLeaseGraceMillis() { return leaseGraceMillis; }
        public void setLeaseGraceMillis(long leaseGraceMillis) { this.leaseGraceMillis = leaseGraceMillis; }
        public long getAcquireP99ThresholdMillis() { return acquireP99ThresholdMillis; }
        public void setAcquireP99ThresholdMillis(long acquireP99ThresholdMillis) { this.acquireP99ThresholdMillis = acquireP99ThresholdMillis; }
        public int getIdleShrinkTicks() { return idleShrinkTicks; }
        public void setIdleShrinkTicks(int idleShrinkTicks) { this.idleShrinkTicks = idleShrinkTicks; }
        public long getMaintenanceIntervalMillis() { return maintenanceIntervalMillis; }
        public void setMaintenanceIntervalMillis(long maintenanceIntervalMillis) { this.maintenanceIntervalMillis = maintenanceIntervalMillis; }
    }

    public static class Audit {
        private String directory = "./audit-logs";
        private int retentionDays = 90;
        private long retryIntervalMillis = 500;
        private int alertAfterFailures = 5;
        private int batchSize = 256;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
        public long getRetryIntervalMillis() { return retryIntervalMillis; }
        public void setRetryIntervalMillis(long retryIntervalMillis) { this.retryIntervalMillis = retryIntervalMillis; }
        public int getAlertAfterFailures() { return alertAfterFailures; }
        public void setAlertAfterFailures(int alertAfterFailures) { this.alertAfterFailures = alertAfterFailures; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Degradation {
        private int failureThreshold = 3;
        private IsolationLevel floor = IsolationLevel.NONE_AST_ONLY;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public IsolationLevel getFloor() { return floor; }
        public void setFloor(IsolationLevel floor) { this.floor = floor; }
    }

    public static class Operators {
        private String version = "1";
        private List<String> names = new ArrayList<>(DefaultPolicy.OPERATORS);

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public List<String> getNames() { return names; }
        public void setNames(List<String> names) { this.names = names; }
    }
}
