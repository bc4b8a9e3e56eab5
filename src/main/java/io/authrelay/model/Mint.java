package io.authrelay.model;

public record Mint(String address, long amount) {
}
