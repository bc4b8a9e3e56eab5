package io.authrelay.host;

public enum ReplyOn {
    NEVER,
    SUCCESS,
    ERROR,
    ALWAYS;

    boolean onSuccess() {
        return this == SUCCESS || this == ALWAYS;
    }

    boolean onError() {
        return this == ERROR || this == ALWAYS;
    }
}
