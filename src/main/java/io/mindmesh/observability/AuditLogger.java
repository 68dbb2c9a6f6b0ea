package io.mindmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.mindmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Every row carries the hash of the previous row, so a
 * removed or edited line breaks the chain.
 */
public final class AuditLogger {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);
    public static final String FILE_NAME = "audit.jsonl";

    private final Path auditFile;
    private final String nodeId;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditDir, String nodeId, Clock clock) {
        this.auditFile = auditDir.resolve(FILE_NAME);
        this.nodeId = nodeId;
        this.clock = clock;
        try {
            Files.createDirectories(auditDir);
        } catch (IOException e) {
            throw new IllegalStateException("failed to create audit directory: " + auditDir, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return auditFile;
    }

    public synchronized void log(String action, String resource, String result, Map<String, Object> details) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("node", nodeId);
        row.put("action", action);
        row.put("resource", resource);
        row.put("result", result);
        row.put("details", details == null ? Map.of() : details);
        row.put("prev_hash", previousHash);
        String rowHash = sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("failed to write audit row to " + auditFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-computes the hash chain. Returns the 1-based line number of the first bad row, or 0
     * when the file is intact.
     */
    public synchronized int verify() throws IOException {
        if (!Files.exists(auditFile)) {
            return 0;
        }
        List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.mapper().readTree(line);
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return lineNo;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> {
                if (!"hash".equals(e.getKey())) {
                    body.put(e.getKey(), e.getValue());
                }
            });
            if (!hash.equals(sha256Hex(Jsons.toCompactJson(body)))) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
    }

    private String loadLastHash() {
        if (!Files.exists(auditFile)) {
            return "";
        }
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    last = line;
                }
            }
            return last.isBlank() ? "" : Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            logger.warn("cannot read previous audit hash from {}, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    static String sha256Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
