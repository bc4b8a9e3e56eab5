package io.authrelay.routing;

import io.authrelay.host.ContractException;

public class BridgeError extends ContractException {
    public enum Reason {
        PROXY_NOT_CREATED("Polytone proxy is not created"),
        PROXY_NOT_RETRIABLE("Polytone proxy state does not allow a retry"),
        RELAY_TIMEOUT("Relay timed out"),
        UNEXPECTED_RELAY_FAILURE("Unexpected relay failure"),
        INVALID_RELAY_ORIGIN("Message did not come from the configured bridge endpoint"),
        INVALID_BODY("Bridge message body could not be decoded");

        private final String text;

        Reason(String text) {
            this.text = text;
        }
    }

    private final Reason reason;

    public BridgeError(Reason reason, String detail) {
        super("Bridge error: " + reason.text + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
