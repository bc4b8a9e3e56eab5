package io.authrelay.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import io.authrelay.util.Jsons;

final class StoredValues {
    private StoredValues() {
    }

    static <T> T read(String raw, JavaType type, String key) {
        try {
            return Jsons.wire().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt stored value at " + key, e);
        }
    }

    static <T> T read(String raw, Class<T> type, String key) {
        return read(raw, Jsons.wire().constructType(type), key);
    }

    static String write(Object value, String key) {
        try {
            return Jsons.wire().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to store value at " + key, e);
        }
    }
}
