package io.enforcerlink.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.enforcerlink.security.SensitiveDataMasker;
import io.enforcerlink.util.Hashing;
import io.enforcerlink.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of transport and monitor events.
 *
 * <p>Each row carries the hash of the previous row so truncation or edits are
 * detectable with {@link #verifyChain()}. When a signing secret is configured
 * every row hash is also HMAC-signed.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String component;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String component, String signingSecret) {
        this.auditFile = auditFile;
        this.component = component == null || component.isBlank() ? "enforcerlink" : component.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("component", component);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized List<JsonNode> readAll() throws IOException {
        return Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                .filter(line -> !line.isBlank())
                .map(AuditLogger::parseRow)
                .toList();
    }

    @SuppressWarnings("unchecked")
    public synchronized ChainVerification verifyChain() throws IOException {
        String expectedPrev = "";
        int rows = 0;
        for (JsonNode node : readAll()) {
            rows++;
            String hash = node.path("hash").asText("");
            String prev = node.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new ChainVerification(false, rows, "prev_hash mismatch at row " + rows);
            }
            Map<String, Object> unsigned = Jsons.compact().convertValue(node, Map.class);
            unsigned.remove("hash");
            unsigned.remove("signature");
            if (!Hashing.sha256Hex(toCompactJson(unsigned)).equals(hash)) {
                return new ChainVerification(false, rows, "hash mismatch at row " + rows);
            }
            if (!signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret, hash).equals(node.path("signature").asText(""))) {
                return new ChainVerification(false, rows, "signature mismatch at row " + rows);
            }
            expectedPrev = hash;
        }
        return new ChainVerification(true, rows, "ok");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            // A torn last line starts a fresh chain rather than blocking startup.
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    private static JsonNode parseRow(String line) {
        try {
            return Jsons.compact().readTree(line);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt audit row", e);
        }
    }

    private static String toCompactJson(Map<String, Object> row) {
        try {
            return Jsons.compact().writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }

    public record ChainVerification(boolean valid, int rows, String message) {
    }
}
