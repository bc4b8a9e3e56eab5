package io.authrelay.model;

public record CallbackRequest(String receiver, byte[] msg) {
}
