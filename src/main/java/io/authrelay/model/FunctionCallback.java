package io.authrelay.model;

public record FunctionCallback(String contractAddress, byte[] callbackMessage) {
}
