package io.authrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.authrelay.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class PayloadRedactor {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "apikey", "api_key", "private_key", "mnemonic", "credential"
    );

    private PayloadRedactor() {
    }

    public static JsonNode redacted(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.wire().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.wire().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), redacted(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.wire().createArrayNode();
            for (JsonNode value : input) {
                out.add(redacted(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.wire().valueToTree(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        // permission_tokens is bookkeeping, not a credential
        if (key.startsWith("permission_token")) {
            return false;
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 64) {
            return false;
        }
        return v.matches("^(0x)?[A-Fa-f0-9]{64,}$");
    }
}
