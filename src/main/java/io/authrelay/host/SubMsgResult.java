package io.authrelay.host;

import java.util.List;

public record SubMsgResult(byte[] data, List<Event> events, String error) {
    public static SubMsgResult ok(byte[] data, List<Event> events) {
        return new SubMsgResult(data, List.copyOf(events), null);
    }

    public static SubMsgResult err(String error) {
        return new SubMsgResult(null, List.of(), error == null ? "" : error);
    }

    public boolean isOk() {
        return error == null;
    }
}
