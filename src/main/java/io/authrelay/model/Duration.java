package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.host.BlockInfo;

import java.util.Map;

public record Duration(boolean blocks, long value) {
    public static Duration seconds(long seconds) {
        return new Duration(false, seconds);
    }

    public static Duration height(long blocks) {
        return new Duration(true, blocks);
    }

    public Expiration after(BlockInfo block) {
        return blocks
                ? Expiration.atHeight(block.height() + value)
                : Expiration.atTime(block.time() + value);
    }

    @JsonValue
    public Map<String, Long> toWire() {
        return Map.of(blocks ? "height" : "time", value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Duration fromWire(JsonNode node) {
        if (node.isObject() && node.path("time").canConvertToLong()) {
            return seconds(node.path("time").asLong());
        }
        if (node.isObject() && node.path("height").canConvertToLong()) {
            return height(node.path("height").asLong());
        }
        throw new IllegalArgumentException("Invalid duration: " + node);
    }
}
