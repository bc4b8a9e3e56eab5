package io.authrelay.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.authrelay.util.Hashing;
import io.authrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
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
        row.put("actor", event.actor());
        row.put("chain_id", event.chainId());
        row.put("contract", event.contract());
        row.put("result", event.result());
        row.put("height", event.height());
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

    public synchronized List<String> tail(int lines) {
        List<String> all = readLines();
        int safe = Math.max(1, lines);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - safe), all.size()));
    }

    @SuppressWarnings("unchecked")
    public synchronized IntegrityReport verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            checked++;
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                Map<String, Object> row = COMPACT_MAPPER.convertValue(node, LinkedHashMap.class);
                String hash = String.valueOf(row.remove("hash"));
                String signature = row.containsKey("signature") ? String.valueOf(row.remove("signature")) : null;
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return new IntegrityReport(false, checked, "broken chain at row " + checked);
                }
                if (!hash.equals(Hashing.sha256Hex(toCompactJson(row)))) {
                    return new IntegrityReport(false, checked, "hash mismatch at row " + checked);
                }
                if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                    return new IntegrityReport(false, checked, "signature mismatch at row " + checked);
                }
                expectedPrev = hash;
            } catch (IOException | IllegalArgumentException e) {
                return new IntegrityReport(false, checked, "unreadable row " + checked + ": " + e.getMessage());
            }
        }
        return new IntegrityReport(true, checked, "ok");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            // verify() reports the broken row; new rows start a fresh chain
            LOG.warn("Last audit row in {} is unreadable, starting a new hash chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = COMPACT_MAPPER.valueToTree(input);
        return COMPACT_MAPPER.convertValue(PayloadRedactor.redacted(node), LinkedHashMap.class);
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record IntegrityReport(boolean valid, int rowsChecked, String message) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String chainId,
            String contract,
            String result,
            Long height,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String chainId,
                String contract,
                String result,
                Long height,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, chainId, contract, result, height, details == null ? Map.of() : details);
        }
    }
}
