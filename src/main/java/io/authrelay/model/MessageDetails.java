package io.authrelay.model;

public record MessageDetails(MessageType messageType, Message message) {
}
