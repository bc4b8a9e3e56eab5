package io.authrelay.model;

public record CallbackMessage(String initiator, byte[] initiatorMsg, PolytoneResult result) {
}
