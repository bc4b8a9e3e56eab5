package io.authrelay.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class Wire {
    private Wire() {
    }

    public static byte[] encode(Object value) {
        try {
            return Jsons.wire().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public static byte[] encode(Object value, Class<?> asType) {
        try {
            return Jsons.wire().writerFor(asType).writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + asType.getSimpleName(), e);
        }
    }

    public static String encodeToString(Object value) {
        return new String(encode(value), StandardCharsets.UTF_8);
    }

    public static <T> T decode(byte[] raw, Class<T> type) throws ContractException {
        return decode(raw, Jsons.wire().constructType(type));
    }

    public static <T> T decode(byte[] raw, TypeReference<T> type) throws ContractException {
        return decode(raw, Jsons.wire().constructType(type));
    }

    public static <T> T decode(byte[] raw, JavaType type) throws ContractException {
        if (raw == null || raw.length == 0) {
            throw new ContractException("Error parsing into type " + type.getRawClass().getSimpleName() + ": empty message");
        }
        try {
            return Jsons.wire().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new ContractException("Error parsing into type " + type.getRawClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ContractException("Error parsing into type " + type.getRawClass().getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    public static JsonNode tree(byte[] raw) throws ContractException {
        try {
            return Jsons.wire().readTree(raw);
        } catch (IOException e) {
            throw new ContractException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    public static String text(byte[] raw) {
        return raw == null ? "" : new String(raw, StandardCharsets.UTF_8);
    }
}
