package com.warden.sandbox;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.ExitClassification;
import com.warden.core.model.IsolationLevel;
import com.warden.core.resource.Breach;
import com.warden.core.resource.EnforcementPlan;
import com.warden.core.resource.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * NAMESPACE_SANDBOX backend: a fresh process per run under bubblewrap (all namespaces unshared,
 * so no network) with rlimits applied by prlimit. Each instance owns a private work directory.
 */
public class NamespaceSandboxBackend implements SandboxBackend {

    private static final Logger log = LoggerFactory.getLogger(NamespaceSandboxBackend.class);

    private final SandboxProperties properties;
    private final SandboxRuntime sandboxRuntime;
    private final ResourceMonitor monitor;
    private final List<String> runtimeCommand;
    private final Map<String, Process> running = new ConcurrentHashMap<>();
    private final ExecutorService streamReaders;

    public NamespaceSandboxBackend(SandboxProperties properties, SandboxRuntime sandboxRuntime, ResourceMonitor monitor) {
        this(properties, sandboxRuntime, monitor, sandboxRuntime.command(properties.getHostPython()));
    }

    /**
     * @param runtimeCommand command that reads the payload on stdin and prints the runner report
     */
    public NamespaceSandboxBackend(SandboxProperties properties, SandboxRuntime sandboxRuntime,
                                   ResourceMonitor monitor, List<String> runtimeCommand) {
        this.properties = properties;
        this.sandboxRuntime = sandboxRuntime;
        this.monitor = monitor;
        this.runtimeCommand = List.copyOf(runtimeCommand);
        var counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "namespace-sandbox-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public IsolationLevel level() {
        return IsolationLevel.NAMESPACE_SANDBOX;
    }

    @Override
    public boolean isAvailable() {
        if (!System.getProperty("os.name", "").toLowerCase().contains("linux")) {
            return false;
        }
        if (properties.isUseBubblewrap() && !Files.isExecutable(Path.of(properties.getBwrapPath()))) {
            return false;
        }
        return !properties.isUsePrlimit() || Files.isExecutable(Path.of(properties.getPrlimitPath()));
    }

    @Override
    public SandboxInstance create() {
        if (!isAvailable()) {
            throw new SandboxCreationException(level(), "bubblewrap/prlimit not available on this host");
        }
        try {
            Files.createDirectories(properties.getWorkRoot());
            Path workDir = Files.createTempDirectory(properties.getWorkRoot(), "ns-");
            var instance = new SandboxInstance(level(), workDir.toString());
            log.info("Sandbox {} created with work directory {}", instance.id(), workDir);
            return instance;
        } catch (IOException e) {
            throw new SandboxCreationException(level(), "Cannot create work directory: " + e.getMessage(), e);
        }
    }

    @Override
    public ExecutionResult execute(SandboxInstance instance, ExecutionRequest request) {
        EnforcementPlan plan = request.plan();
        Path workDir = Path.of(instance.nativeId());
        long start = System.nanoTime();

        Process process;
        try {
            var builder = new ProcessBuilder(buildCommand(plan, workDir)).directory(workDir.toFile());
            builder.environment().clear();
            builder.environment().put("PATH", "/usr/local/bin:/usr/bin:/bin");
            builder.environment().put("HOME", workDir.toString());
            builder.environment().put("PYTHONDONTWRITEBYTECODE", "1");
            process = builder.start();
        } catch (IOException e) {
            instance.taint();
            return ExecutionResult.failure(ExitClassification.EXECUTION_FAILED,
                    "cannot start sandboxed process: " + e.getMessage(), level(), instance.id(),
                    elapsedMillis(start), 0, -1);
        }
        running.put(instance.id(), process);

        int limit = sandboxRuntime.outputLimitBytes();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readBounded(process.getInputStream(), limit), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readBounded(process.getErrorStream(), limit), streamReaders);
        writePayload(process, sandboxRuntime.payload(request));

        var watch = monitor.watch(new ProcessResourceProbe(process.toHandle()), plan, request.checks(),
                breach -> killTree(process));
        boolean finished;
        try {
            finished = process.waitFor(request.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = false;
        } finally {
            watch.close();
            running.remove(instance.id());
        }

        Breach breach = watch.breach().orElse(null);
        if (!finished) {
            killTree(process);
        }
        if (!finished || breach != null) {
            instance.taint();
        }
        int exitCode = finished ? normalizedExitCode(process.exitValue()) : -1;
        return sandboxRuntime.interpret(new SandboxRuntime.RunOutcome(
                exitCode, await(stdout), await(stderr), breach, !finished,
                elapsedMillis(start), watch.peakMemoryBytes(), plan.memoryBytes(), level(), instance.id()));
    }

    List<String> buildCommand(EnforcementPlan plan, Path workDir) {
        var cmd = new ArrayList<String>();
        if (properties.isUsePrlimit()) {
            cmd.add(properties.getPrlimitPath());
            cmd.addAll(plan.prlimitArgs());
        }
        if (properties.isUseBubblewrap()) {
            cmd.addAll(List.of(properties.getBwrapPath(),
                    "--unshare-all",
                    "--die-with-parent",
                    "--new-session",
                    "--ro-bind", "/usr", "/usr",
                    "--ro-bind-try", "/lib", "/lib",
                    "--ro-bind-try", "/lib64", "/lib64",
                    "--ro-bind-try", "/bin", "/bin",
                    "--ro-bind-try", "/etc/alternatives", "/etc/alternatives",
                    "--proc", "/proc",
                    "--dev", "/dev",
                    "--tmpfs", "/tmp",
                    "--bind", workDir.toString(), "/work",
                    "--chdir", "/work",
                    "--"));
        }
        cmd.addAll(runtimeCommand);
        return cmd;
    }

    private void writePayload(Process process, byte[] payload) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
        } catch (IOException e) {
            // The process exited before reading everything; its exit code tells the rest.
            log.debug("Sandboxed process closed stdin early: {}", e.getMessage());
        }
    }

    private static String readBounded(InputStream in, int limit) {
        try (in) {
            byte[] kept = in.readNBytes(limit);
            in.transferTo(OutputStream.nullOutputStream());
            return new String(kept, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Sandboxed process stream closed: {}", e.getMessage());
            return "";
        }
    }

    private static String await(CompletableFuture<String> stream) {
        try {
            return stream.get(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Sandboxed process output not collected: {}", e.toString());
            return "";
        }
    }

    /** Processes killed by a signal report 128 + signal, as the shell does. */
    private static int normalizedExitCode(int exitValue) {
        return exitValue < 0 ? 128 - exitValue : exitValue;
    }

    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    @Override
    public boolean reset(SandboxInstance instance) {
        if (running.containsKey(instance.id())) {
            return false;
        }
        Path workDir = Path.of(instance.nativeId());
        try (Stream<Path> entries = Files.list(workDir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                deleteRecursively(entry);
            }
            return true;
        } catch (IOException e) {
            log.warn("Reset of sandbox {} failed: {}", instance.id(), e.getMessage());
            return false;
        }
    }

    @Override
    public void kill(SandboxInstance instance) {
        Process process = running.get(instance.id());
        if (process != null) {
            killTree(process);
            log.info("Killed process tree of sandbox {}", instance.id());
        }
    }

    @Override
    public void destroy(SandboxInstance instance) {
        kill(instance);
        try {
            deleteRecursively(Path.of(instance.nativeId()));
            log.info("Sandbox {} torn down", instance.id());
        } catch (IOException e) {
            log.warn("Failed to delete work directory of sandbox {}", instance.id(), e);
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
