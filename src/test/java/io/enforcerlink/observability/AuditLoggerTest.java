package io.enforcerlink.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsFormAVerifiableSignedChain() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "monitor", "audit-key");

            logger.log(AuditLogger.AuditEvent.of("monitor.start", "/run/m.sock", "ok", Map.of("replayed", 2)));
            logger.log(AuditLogger.AuditEvent.of("monitor.stop", "/run/m.sock", "ok", null));

            List<JsonNode> rows = logger.readAll();
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertFalse(rows.get(1).path("signature").asText().isEmpty());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), logger.currentHash());
            Assertions.assertEquals(new AuditLogger.ChainVerification(true, 2, "ok"), logger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chainContinuesAcrossReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-audit-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "monitor", "").log(AuditLogger.AuditEvent.of("a", "r", "ok", Map.of()));
            AuditLogger reopened = new AuditLogger(file, "monitor", "");
            reopened.log(AuditLogger.AuditEvent.of("b", "r", "ok", Map.of()));
            Assertions.assertTrue(reopened.verifyChain().valid());

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"action\":\"a\"", "\"action\":\"z\""), StandardCharsets.UTF_8);

            AuditLogger.ChainVerification broken = reopened.verifyChain();
            Assertions.assertFalse(broken.valid());
            Assertions.assertEquals(1, broken.rows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secretsInDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-audit-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), "transport", "");

            logger.log(AuditLogger.AuditEvent.of("transport.connect", "ctx-1", "ok",
                    Map.of("sharedSecret", "hunter2", "socket", "/run/a.sock")));

            String raw = Files.readString(logger.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertFalse(raw.contains("hunter2"));
            Assertions.assertTrue(raw.contains("/run/a.sock"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
