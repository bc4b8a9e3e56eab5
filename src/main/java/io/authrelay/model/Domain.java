package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record Domain(String externalName) {
    public static final Domain MAIN = new Domain(null);

    // "main" must go through fromWire, not the String constructor
    @JsonCreator(mode = JsonCreator.Mode.DISABLED)
    public Domain {
    }

    public static Domain external(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("external domain name must not be blank");
        }
        return new Domain(name);
    }

    public boolean main() {
        return externalName == null;
    }

    @JsonValue
    public Object toWire() {
        return main() ? "main" : Map.of("external", externalName);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Domain fromWire(JsonNode node) {
        if (node.isTextual() && "main".equals(node.asText())) {
            return MAIN;
        }
        if (node.isObject() && node.size() == 1 && node.path("external").isTextual()) {
            return external(node.path("external").asText());
        }
        throw new IllegalArgumentException("Invalid domain: " + node);
    }

    public static Domain parse(String raw) {
        if (raw == null || raw.isBlank() || "main".equalsIgnoreCase(raw.trim())) {
            return MAIN;
        }
        return external(raw.trim());
    }

    @Override
    public String toString() {
        return main() ? "main" : "external:" + externalName;
    }
}
