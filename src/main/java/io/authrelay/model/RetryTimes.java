package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record RetryTimes(Long amount) {
    public static final RetryTimes INDEFINITELY = new RetryTimes(null);

    @JsonCreator(mode = JsonCreator.Mode.DISABLED)
    public RetryTimes {
    }

    public static RetryTimes amount(long times) {
        if (times < 1) {
            throw new IllegalArgumentException("retry amount must be at least 1");
        }
        return new RetryTimes(times);
    }

    public boolean exhaustedAfter(long failures) {
        return amount != null && failures >= amount;
    }

    @JsonValue
    public Object toWire() {
        return amount == null ? "indefinitely" : Map.of("amount", amount);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RetryTimes fromWire(JsonNode node) {
        if (node.isTextual() && "indefinitely".equals(node.asText())) {
            return INDEFINITELY;
        }
        if (node.isObject() && node.path("amount").canConvertToLong()) {
            return amount(node.path("amount").asLong());
        }
        throw new IllegalArgumentException("Invalid retry times: " + node);
    }
}
