package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.host.BlockInfo;

import java.util.Map;

public record AuthorizationDuration(String unit, long value) {
    public static final AuthorizationDuration FOREVER = new AuthorizationDuration("forever", 0L);

    public static AuthorizationDuration seconds(long seconds) {
        return new AuthorizationDuration("seconds", seconds);
    }

    public static AuthorizationDuration blocks(long blocks) {
        return new AuthorizationDuration("blocks", blocks);
    }

    public Expiration expirationFrom(BlockInfo block) {
        return switch (unit) {
            case "seconds" -> Expiration.atTime(block.time() + value);
            case "blocks" -> Expiration.atHeight(block.height() + value);
            default -> Expiration.NEVER;
        };
    }

    @JsonValue
    public Object toWire() {
        return "forever".equals(unit) ? "forever" : Map.of(unit, value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AuthorizationDuration fromWire(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && "forever".equals(node.asText()))) {
            return FOREVER;
        }
        if (node.isObject() && node.path("seconds").canConvertToLong()) {
            return seconds(node.path("seconds").asLong());
        }
        if (node.isObject() && node.path("blocks").canConvertToLong()) {
            return blocks(node.path("blocks").asLong());
        }
        throw new IllegalArgumentException("Invalid authorization duration: " + node);
    }
}
