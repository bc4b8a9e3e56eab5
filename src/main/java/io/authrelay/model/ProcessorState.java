package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProcessorState {
    @JsonProperty("active")
    ACTIVE,
    @JsonProperty("paused")
    PAUSED
}
