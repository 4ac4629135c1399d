package com.warden.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "warden")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public boolean isDockerEnabled() { return sandbox.dockerEnabled; }
    public boolean isNamespaceEnabled() { return sandbox.namespaceEnabled; }
    public String getImage() { return sandbox.image; }
    public String getMicroVmRuntime() { return sandbox.microVmRuntime; }
    public String getUserspaceKernelRuntime() { return sandbox.userspaceKernelRuntime; }
    public String getContainerRuntime() { return sandbox.containerRuntime; }
    public String getContainerUser() { return sandbox.containerUser; }
    public String getEgressNetwork() { return sandbox.egressNetwork; }
    public String getContainerPython() { return sandbox.containerPython; }
    public String getHostPython() { return sandbox.hostPython; }
    public String getBwrapPath() { return sandbox.bwrapPath; }
    public String getPrlimitPath() { return sandbox.prlimitPath; }
    public boolean isUseBubblewrap() { return sandbox.useBubblewrap; }
    public boolean isUsePrlimit() { return sandbox.usePrlimit; }
    public Path getWorkRoot() { return Path.of(sandbox.workRoot); }
    public int getOutputLimitBytes() { return sandbox.outputLimitBytes; }
    public long getAvailabilityCacheMillis() { return sandbox.availabilityCacheMillis; }

    /**
     * Proxy URL handed to sandboxes attached to the egress network, or empty when sandboxes have
     * no network at all. The request id travels as the proxy user name so the Network Guard can
     * attribute every attempt to its request.
     */
    public String egressProxyUrl(String requestId, String advertisedHost, int port) {
        if (sandbox.egressNetwork == null || sandbox.egressNetwork.isBlank()) {
            return "";
        }
        return "http://" + requestId + "@" + advertisedHost + ":" + port;
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private boolean dockerEnabled = true;
        private boolean namespaceEnabled = true;
        private String image = "python:3.12-slim";
        private String microVmRuntime = "kata-fc";
        private String userspaceKernelRuntime = "runsc";
        /** Empty selects the daemon's default runtime. */
        private String containerRuntime = "";
        private String containerUser = "65534:65534";
        /** Docker network routed through the egress proxy; empty means network mode none. */
        private String egressNetwork = "";
        private String containerPython = "python3";
        private String hostPython = "python3";
        private String bwrapPath = "/usr/bin/bwrap";
        private String prlimitPath = "/usr/bin/prlimit";
        private boolean useBubblewrap = true;
        private boolean usePrlimit = true;
        private String workRoot = System.getProperty("java.io.tmpdir") + "/warden-sandboxes";
        private int outputLimitBytes = 1_048_576;
        private long availabilityCacheMillis = 5_000;
        private long monitorIntervalMillis = 50;

        public boolean isDockerEnabled() { return dockerEnabled; }
        public void setDockerEnabled(boolean dockerEnabled) { this.dockerEnabled = dockerEnabled; }
        public boolean isNamespaceEnabled() { return namespaceEnabled; }
        public void setNamespaceEnabled(boolean namespaceEnabled) { this.namespaceEnabled = namespaceEnabled; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getMicroVmRuntime() { return microVmRuntime; }
        public void setMicroVmRuntime(String microVmRuntime) { this.microVmRuntime = microVmRuntime; }
        public String getUserspaceKernelRuntime() { return userspaceKernelRuntime; }
        public void setUserspaceKernelRuntime(String userspaceKernelRuntime) { this.userspaceKernelRuntime = userspaceKernelRuntime; }
        public String getContainerRuntime() { return containerRuntime; }
        public void setContainerRuntime(String containerRuntime) { this.containerRuntime = containerRuntime; }
        public String getContainerUser() { return containerUser; }
        public void setContainerUser(String containerUser) { this.containerUser = containerUser; }
        public String getEgressNetwork() { return egressNetwork; }
        public void setEgressNetwork(String egressNetwork) { this.egressNetwork = egressNetwork; }
        public String getContainerPython() { return containerPython; }
        public void setContainerPython(String containerPython) { this.containerPython = containerPython; }
        public String getHostPython() { return hostPython; }
        public void setHostPython(String hostPython) { this.hostPython = hostPython; }
        public String getBwrapPath() { return bwrapPath; }
        public void setBwrapPath(String bwrapPath) { this.bwrapPath = bwrapPath; }
        public String getPrlimitPath() { return prlimitPath; }
        public void setPrlimitPath(String prlimitPath) { this.prlimitPath = prlimitPath; }
        public boolean isUseBubblewrap() { return useBubblewrap; }
        public void setUseBubblewrap(boolean useBubblewrap) { this.useBubblewrap = useBubblewrap; }
        public boolean isUsePrlimit() { return usePrlimit; }
        public void setUsePrlimit(boolean usePrlimit) { this.usePrlimit = usePrlimit; }
        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public int getOutputLimitBytes() { return outputLimitBytes; }
        public void setOutputLimitBytes(int outputLimitBytes) { this.outputLimitBytes = outputLimitBytes; }
        public long getAvailabilityCacheMillis() { return availabilityCacheMillis; }
        public void setAvailabilityCacheMillis(long availabilityCacheMillis) { this.availabilityCacheMillis = availabilityCacheMillis; }
        public long getMonitorIntervalMillis() { return monitorIntervalMillis; }
        public void setMonitorIntervalMillis(long monitorIntervalMillis) { this.monitorIntervalMillis = monitorIntervalMillis; }
    }
}
