package com.warden.sandbox;

import com.warden.core.resource.ResourceProbe;
import com.warden.core.resource.ResourceSample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Samples a host process tree through {@code /proc/<pid>/status} (resident set size).
 */
class ProcessResourceProbe implements ResourceProbe {

    private final ProcessHandle root;

    ProcessResourceProbe(ProcessHandle root) {
        this.root = root;
    }

    @Override
    public Optional<ResourceSample> sample() throws IOException {
        if (!root.isAlive()) {
            return Optional.empty();
        }
        List<ProcessHandle> tree = Stream.concat(Stream.of(root), root.descendants())
                .filter(ProcessHandle::isAlive)
                .collect(Collectors.toList());
        long rss = 0;
        for (ProcessHandle handle : tree) {
            rss += residentBytes(handle.pid());
        }
        return Optional.of(new ResourceSample(rss, tree.size(), Instant.now()));
    }

    static long residentBytes(long pid) throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(Path.of("/proc", Long.toString(pid), "status"));
        } catch (NoSuchFileException e) {
            return 0;
        }
        for (String line : lines) {
            if (line.startsWith("VmRSS:")) {
                return parseKilobytes(line.substring("VmRSS:".length())) * 1024;
            }
        }
        return 0;
    }

    static long parseKilobytes(String value) {
        String digits = value.replace("kB", "").trim();
        return digits.isEmpty() ? 0 : Long.parseLong(digits);
    }
}
