package io.authrelay.host;

public record BlockInfo(long height, long time) {
}
