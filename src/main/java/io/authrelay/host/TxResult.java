package io.authrelay.host;

import java.util.ArrayList;
import java.util.List;

public record TxResult(long height, byte[] data, List<Event> events) {
    public TxResult {
        events = List.copyOf(events);
    }

    public List<String> attributes(String key) {
        List<String> out = new ArrayList<>();
        for (Event event : events) {
            String value = event.attribute(key);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    public boolean hasAttribute(String key, String value) {
        return attributes(key).contains(value);
    }
}
