package io.authrelay.model;

public record CurrentRetry(long retryAmounts, Expiration retryCooldown) {
}
