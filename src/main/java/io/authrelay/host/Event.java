package io.authrelay.host;

import java.util.Map;

public record Event(String type, Map<String, String> attributes) {
    public Event {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
