package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AuthorizationState {
    @JsonProperty("enabled")
    ENABLED,
    @JsonProperty("disabled")
    DISABLED
}
