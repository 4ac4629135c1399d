package com.warden.dispatch.cli;

import com.warden.core.model.ContentType;
import com.warden.core.model.IsolationLevel;
import com.warden.core.model.ResourceBudget;
import com.warden.core.model.SecurityContext;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options shared by the validate and execute commands.
 */
public class ContentOptions {

    @Parameters(index = "0", arity = "0..1", description = "File holding the content, '-' for stdin")
    String file;

    @Option(names = {"-e", "--content"}, description = "Inline content, instead of a file")
    String inline;

    @Option(names = {"-t", "--type"}, required = true,
            description = "Content type: ${COMPLETION-CANDIDATES}")
    ContentType type;

    @Option(names = {"-c", "--component"}, defaultValue = "cli", description = "Calling component name")
    String component;

    @Option(names = {"-l", "--level"}, description = "Requested isolation level: ${COMPLETION-CANDIDATES}")
    IsolationLevel level;

    @Option(names = "--user", description = "User id")
    String user;

    @Option(names = "--memory-mb", description = "Memory budget in MB")
    Integer memoryMb;

    @Option(names = "--cpus", description = "CPU budget in cores")
    Double cpus;

    @Option(names = "--max-processes", description = "Process budget")
    Integer maxProcesses;

    @Option(names = "--timeout", defaultValue = "30", description = "Request timeout in seconds")
    int timeoutSeconds;

    @Option(names = {"-i", "--input"}, description = "Named numeric series, e.g. close=1,2,3")
    Map<String, String> inputs = new LinkedHashMap<>();

    String content() throws IOException {
        if (inline != null) {
            if (file != null) {
                throw new IllegalArgumentException("Give either a file or --content, not both");
            }
            return inline;
        }
        if (file == null) {
            throw new IllegalArgumentException("No content: give a file, '-' for stdin, or --content");
        }
        if ("-".equals(file)) {
            InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file));
    }

    SecurityContext context() {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        var defaults = ResourceBudget.DEFAULT;
        var budget = new ResourceBudget(
                memoryMb != null ? memoryMb : defaults.maxMemoryMb(),
                cpus != null ? cpus : defaults.maxCpuCores(),
                maxProcesses != null ? maxProcesses : defaults.maxProcesses(),
                timeout);
        return SecurityContext.builder(component)
                .userId(user)
                .isolationLevel(level)
                .budget(budget)
                .timeout(timeout)
                .inputs(parseInputs(inputs))
                .build();
    }

    static Map<String, double[]> parseInputs(Map<String, String> raw) {
        Map<String, double[]> parsed = new LinkedHashMap<>();
        raw.forEach((name, csv) -> {
            String[] parts = csv.split(",");
            double[] values = new double[parts.length];
            for (int i = 0; i < parts.length; i++) {
                try {
                    values[i] = Double.parseDouble(parts[i].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Input '" + name + "' is not numeric: " + parts[i], e);
                }
            }
            parsed.put(name, values);
        });
        return parsed;
    }
}
