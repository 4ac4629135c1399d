package com.warden.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.core.validation.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Daily JSON-lines audit files ({@code audit_yyyyMMdd.jsonl}, UTC days).
 *
 * <p>Each line is one event plus {@code prevSignature} and {@code signature}. The signature is the
 * SHA-256 of the previous signature followed by the canonical JSON of the event (keys sorted), so
 * editing, removing or reordering a line breaks the chain from that line on.
 */
public class JsonlAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JsonlAuditStore.class);

    static final String GENESIS = "0".repeat(64);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String PREFIX = "audit_";
    private static final String SUFFIX = ".jsonl";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Map<LocalDate, String> lastSignatures = new HashMap<>();

    public JsonlAuditStore(Path directory) {
        this.directory = directory;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized void write(List<AuditEvent> batch) throws IOException {
        if (batch.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        var linesByDate = new LinkedHashMap<LocalDate, StringBuilder>();
        var signatures = new HashMap<LocalDate, String>();
        for (AuditEvent event : batch) {
            LocalDate date = LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC);
            String prev = signatures.containsKey(date) ? signatures.get(date) : lastSignature(date);
            ObjectNode node = canonical(mapper.valueToTree(event));
            String signature = sign(prev, node);
            node.put("prevSignature", prev);
            node.put("signature", signature);
            linesByDate.computeIfAbsent(date, d -> new StringBuilder())
                    .append(mapper.writeValueAsString(node)).append('\n');
            signatures.put(date, signature);
        }
        // Original length of every file touched so far; -1 if it did not exist.
        var written = new LinkedHashMap<LocalDate, Long>();
        try {
            for (var entry : linesByDate.entrySet()) {
                Path file = fileFor(entry.getKey());
                written.put(entry.getKey(), Files.exists(file) ? Files.size(file) : -1L);
                Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
        } catch (IOException e) {
            rollBack(written, e);
            throw e;
        }
        lastSignatures.putAll(signatures);
    }

    /** Restores touched files to their length before a failed batch, so a retry cannot duplicate lines. */
    private void rollBack(Map<LocalDate, Long> written, IOException failure) {
        for (var entry : written.entrySet()) {
            Path file = fileFor(entry.getKey());
            long length = entry.getValue();
            try {
                if (length < 0) {
                    if (Files.isRegularFile(file)) {
                        Files.delete(file);
                    }
                } else if (Files.isRegularFile(file)) {
                    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
                        channel.truncate(length);
                    }
                }
            } catch (IOException e) {
                failure.addSuppressed(e);
                log.error("Could not roll back {} after a failed audit write; a retry may duplicate entries",
                        file.getFileName(), e);
                // The partial lines stay on disk, so later entries must chain from them.
                lastSignatures.remove(entry.getKey());
            }
        }
    }

    @Override
    public List<AuditEvent> recent(int count) throws IOException {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1: " + count);
        }
        var collected = new ArrayList<AuditEvent>();
        for (LocalDate date : datesDescending()) {
            List<AuditEvent> day = eventsOn(date);
            int from = Math.max(0, day.size() - (count - collected.size()));
            collected.addAll(0, day.subList(from, day.size()));
            if (collected.size() >= count) {
                break;
            }
        }
        return collected;
    }

    @Override
    public List<AuditEvent> eventsOn(LocalDate date) throws IOException {
        Path file = fileFor(date);
        if (!Files.exists(file)) {
            return List.of();
        }
        var events = new ArrayList<AuditEvent>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.treeToValue(mapper.readTree(line), AuditEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable audit line in {}: {}", file.getFileName(), e.getOriginalMessage());
            }
        }
        return events;
    }

    @Override
    public List<AuditEvent> eventsByType(AuditEventType type, int limit) throws IOException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        var matched = new ArrayList<AuditEvent>();
        for (LocalDate date : datesDescending()) {
            List<AuditEvent> day = eventsOn(date);
            for (int i = day.size() - 1; i >= 0 && matched.size() < limit; i--) {
                if (day.get(i).eventType() == type) {
                    matched.add(0, day.get(i));
                }
            }
            if (matched.size() >= limit) {
                break;
            }
        }
        return matched;
    }

    @Override
    public IntegrityReport verify(LocalDate date) throws IOException {
        Path file = fileFor(date);
        if (!Files.exists(file)) {
            return new IntegrityReport(date, file.getFileName().toString(), 0, List.of());
        }
        var invalid = new ArrayList<Integer>();
        String expectedPrev = GENESIS;
        int lineNo = 0;
        int entries = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            entries++;
            try {
                JsonNode parsed = mapper.readTree(line);
                if (!(parsed instanceof ObjectNode node)) {
                    invalid.add(lineNo);
                    continue;
                }
                String prev = node.path("prevSignature").asText("");
                String signature = node.path("signature").asText("");
                node.remove("prevSignature");
                node.remove("signature");
                if (!prev.equals(expectedPrev) || !sign(prev, canonical(node)).equals(signature)) {
                    invalid.add(lineNo);
                }
                expectedPrev = signature;
            } catch (JsonProcessingException e) {
                invalid.add(lineNo);
            }
        }
        return new IntegrityReport(date, file.getFileName().toString(), entries, invalid);
    }

    @Override
    public synchronized int purgeOlderThan(int retentionDays) throws IOException {
        LocalDate cutoff = LocalDate.now(ZoneOffset.UTC).minusDays(retentionDays);
        int removed = 0;
        for (LocalDate date : datesDescending()) {
            if (date.isBefore(cutoff)) {
                Files.deleteIfExists(fileFor(date));
                lastSignatures.remove(date);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} audit files older than {} days", removed, retentionDays);
        }
        return removed;
    }

    Path fileFor(LocalDate date) {
        return directory.resolve(PREFIX + FILE_DATE.format(date) + SUFFIX);
    }

    private String lastSignature(LocalDate date) throws IOException {
        String cached = lastSignatures.get(date);
        if (cached != null) {
            return cached;
        }
        Path file = fileFor(date);
        if (!Files.exists(file)) {
            return GENESIS;
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) {
                return mapper.readTree(lines.get(i)).path("signature").asText(GENESIS);
            }
        }
        return GENESIS;
    }

    private List<LocalDate> datesDescending() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var dates = new TreeSet<LocalDate>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(PREFIX) && n.endsWith(SUFFIX))
                    .forEach(n -> {
                        try {
                            dates.add(LocalDate.parse(n.substring(PREFIX.length(), n.length() - SUFFIX.length()), FILE_DATE));
                        } catch (RuntimeException e) {
                            log.debug("Ignoring non-audit file {}", n);
                        }
                    });
        }
        return new ArrayList<>(dates.descendingSet());
    }

    private String sign(String prev, ObjectNode canonicalEvent) throws JsonProcessingException {
        return ContentHasher.sha256Hex(prev + mapper.writeValueAsString(canonicalEvent));
    }

    /** Deep copy with object keys in sorted order. */
    static ObjectNode canonical(JsonNode node) {
        return (ObjectNode) canonicalValue(node);
    }

    private static JsonNode canonicalValue(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            var names = new TreeSet<String>();
            node.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, canonicalValue(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(child -> array.add(canonicalValue(child)));
            return array;
        }
        return node;
    }
}
