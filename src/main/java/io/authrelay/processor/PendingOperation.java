package io.authrelay.processor;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PendingOperation(long executionId, Kind kind, int functionIndex) {
    public enum Kind {
        @JsonProperty("atomic")
        ATOMIC,
        @JsonProperty("non_atomic_function")
        NON_ATOMIC_FUNCTION
    }
}
