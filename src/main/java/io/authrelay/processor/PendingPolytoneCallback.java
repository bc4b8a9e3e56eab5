package io.authrelay.processor;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.authrelay.model.RegistryMsg;

public record PendingPolytoneCallback(RegistryMsg.ProcessorCallback callback, Status status, String error) {
    public enum Status {
        @JsonProperty("pending")
        PENDING,
        @JsonProperty("timed_out")
        TIMED_OUT,
        @JsonProperty("failed")
        FAILED
    }

    public PendingPolytoneCallback withStatus(Status next, String nextError) {
        return new PendingPolytoneCallback(callback, next, nextError);
    }
}
