package io.authrelay.host;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Response {
    private final List<SubMsg> messages = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private byte[] data;

    public Response addMessage(CosmosMsg msg) {
        messages.add(SubMsg.of(msg));
        return this;
    }

    public Response addMessages(List<? extends CosmosMsg> msgs) {
        for (CosmosMsg msg : msgs) {
            addMessage(msg);
        }
        return this;
    }

    public Response addSubMessage(SubMsg msg) {
        messages.add(msg);
        return this;
    }

    public Response addAttribute(String key, Object value) {
        attributes.put(key, String.valueOf(value));
        return this;
    }

    public Response setData(byte[] data) {
        this.data = data;
        return this;
    }

    public List<SubMsg> messages() {
        return Collections.unmodifiableList(messages);
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public byte[] data() {
        return data;
    }
}
