package com.threatsentinel.core.incident;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.threatsentinel.core.json.JsonSupport;
import com.threatsentinel.core.model.IncidentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Incident log kept as one JSON array in a file.
 *
 * <p>
 * Each entry is the report's JSON form with PII masked at the top level and
 * inside {@code data}, plus an {@code integrity_hash}: the SHA-256 of the
 * masked entry serialized with sorted keys. Appends read the whole array,
 * add the entry and replace the file, all under one lock. A missing, empty,
 * non-array or unparseable file is treated as an empty log and rewritten.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileIncidentLog implements IncidentLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileIncidentLog.class);

    static final String HASH_FIELD = "integrity_hash";

    private static final TypeReference<Map<String, Object>> ENTRY = new TypeReference<>() {
    };

    private final Path file;
    private final PiiMasker masker;
    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private final ObjectMapper canonical = JsonSupport.newObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param file   log file; created on first append
     * @param masker PII masker applied to every entry
     */
    public JsonFileIncidentLog(Path file, PiiMasker masker) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.masker = Objects.requireNonNull(masker, "masker must not be null");
    }

    @Override
    public void append(IncidentReport report) {
        Objects.requireNonNull(report, "report must not be null");
        Map<String, Object> entry = toEntry(report);
        lock.lock();
        try {
            List<Map<String, Object>> entries = readEntries();
            entries.add(entry);
            write(entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update incident log " + file
                    + ", incident " + report.getIncidentId() + " not written", e);
        } finally {
            lock.unlock();
        }
        LOG.debug("Logged incident {} to {}", report.getIncidentId(), file);
    }

    @Override
    public List<Map<String, Object>> readAll() {
        lock.lock();
        try {
            return readEntries();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read incident log " + file, e);
        } finally {
            lock.unlock();
        }
    }

    Map<String, Object> toEntry(IncidentReport report) {
        Map<String, Object> entry = mapper.convertValue(report, ENTRY);
        Object data = entry.get("data");
        if (data instanceof Map<?, ?>) {
            entry.put("data", masker.mask(mapper.convertValue(data, ENTRY)));
        }
        entry = masker.mask(entry);
        entry.put(HASH_FIELD, hash(entry));
        return entry;
    }

    /**
     * @param entry entry without its hash field
     * @return hex SHA-256 of the entry serialized with sorted keys
     */
    String hash(Map<String, Object> entry) {
        try {
            byte[] bytes = canonical.writeValueAsString(entry).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            LOG.error("Failed to compute integrity hash: {}", e.getMessage(), e);
            return "hash_error";
        }
    }

    /**
     * Malformed content resets the log; any other read failure propagates so
     * the existing history is never overwritten.
     */
    private List<Map<String, Object>> readEntries() throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return new ArrayList<>();
            }
            JsonNode root = mapper.readTree(content);
            if (!root.isArray()) {
                LOG.warn("Incident log {} is not a JSON array, resetting", file);
                return new ArrayList<>();
            }
            List<Map<String, Object>> entries = new ArrayList<>();
            for (JsonNode node : root) {
                if (node.isObject()) {
                    entries.add(mapper.convertValue(node, ENTRY));
                }
            }
            return entries;
        } catch (JsonProcessingException e) {
            LOG.warn("Incident log {} is corrupted, resetting: {}", file, e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    private void write(List<Map<String, Object>> entries) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    public Path getFile() {
        return file;
    }
}
