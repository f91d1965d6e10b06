package io.primemesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.primemesh.security.SensitiveDataMasker;
import io.primemesh.util.Hashing;
import io.primemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained JSON-lines trail of membership and leadership
 * transitions. Each row carries the hash of the previous row, and optionally an
 * HMAC signature, so a truncated or edited trail is detectable.
 */
public final class ClusterAuditLog {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final SensitiveDataMasker masker;
    private String previousHash;

    public ClusterAuditLog(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.masker = new SensitiveDataMasker(this.signingSecret);
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
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
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("node_id", event.nodeId());
        row.put("term", event.term());
        row.put("result", event.result());
        row.put("details", masker.maskDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
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

    public Path file() {
        return auditFile;
    }

    /**
     * Recomputes every row hash and checks the chain links and signatures.
     */
    public synchronized IntegrityOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            checked++;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new IntegrityOutcome(false, checked, "unparseable row " + checked);
            }
            String prev = node.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new IntegrityOutcome(false, checked, "broken chain at row " + checked);
            }
            String hash = node.path("hash").asText("");
            Map<String, Object> unsigned = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!"hash".equals(field.getKey()) && !"signature".equals(field.getKey())) {
                    unsigned.put(field.getKey(), field.getValue());
                }
            }
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unsigned)))) {
                return new IntegrityOutcome(false, checked, "hash mismatch at row " + checked);
            }
            if (!signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret, hash).equals(node.path("signature").asText(""))) {
                return new IntegrityOutcome(false, checked, "signature mismatch at row " + checked);
            }
            expectedPrev = hash;
        }
        return new IntegrityOutcome(true, checked, "");
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String nodeId,
            long term,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String nodeId, long term, Map<String, Object> details) {
            return new AuditEvent(action, nodeId, term, "ok", details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(boolean ok, int checkedRows, String error) {
    }
}
