package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.host.BlockInfo;

import java.util.Map;

public record Expiration(Kind kind, long value) {
    public static final Expiration NEVER = new Expiration(Kind.NEVER, 0L);

    public enum Kind {
        NEVER,
        AT_TIME,
        AT_HEIGHT
    }

    public static Expiration atTime(long seconds) {
        return new Expiration(Kind.AT_TIME, seconds);
    }

    public static Expiration atHeight(long height) {
        return new Expiration(Kind.AT_HEIGHT, height);
    }

    public boolean expired(BlockInfo block) {
        return switch (kind) {
            case NEVER -> false;
            case AT_TIME -> block.time() >= value;
            case AT_HEIGHT -> block.height() >= value;
        };
    }

    @JsonValue
    public Object toWire() {
        return switch (kind) {
            case NEVER -> "never";
            case AT_TIME -> Map.of("at_time", value);
            case AT_HEIGHT -> Map.of("at_height", value);
        };
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Expiration fromWire(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && "never".equals(node.asText()))) {
            return NEVER;
        }
        if (node.isObject() && node.has("never")) {
            return NEVER;
        }
        if (node.isObject() && node.path("at_time").canConvertToLong()) {
            return atTime(node.path("at_time").asLong());
        }
        if (node.isObject() && node.path("at_height").canConvertToLong()) {
            return atHeight(node.path("at_height").asLong());
        }
        throw new IllegalArgumentException("Invalid expiration: " + node);
    }
}
