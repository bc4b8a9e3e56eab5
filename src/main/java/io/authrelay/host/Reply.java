package io.authrelay.host;

public record Reply(long id, SubMsgResult result) {
}
