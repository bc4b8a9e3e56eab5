package io.authrelay.model;

public record RetryLogic(RetryTimes times, Duration interval) {
}
