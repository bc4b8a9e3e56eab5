package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(PolytoneResult.Execute.class),
        @JsonSubTypes.Type(PolytoneResult.FatalError.class)
})
public interface PolytoneResult {
    String TIMEOUT = "timeout";

    String errorMessage();

    default boolean ok() {
        return errorMessage() == null;
    }

    default boolean timedOut() {
        return TIMEOUT.equals(errorMessage());
    }

    static PolytoneResult executed(String executedBy) {
        return new Execute(executedBy, null);
    }

    static PolytoneResult failed(String error) {
        return new Execute(null, error == null ? "unknown error" : error);
    }

    static PolytoneResult timeout() {
        return new Execute(null, TIMEOUT);
    }

    @JsonTypeName("execute")
    record Execute(String executedBy, String error) implements PolytoneResult {
        @Override
        public String errorMessage() {
            return error;
        }
    }

    @JsonTypeName("fatal_error")
    record FatalError(String reason) implements PolytoneResult {
        @Override
        public String errorMessage() {
            return reason == null ? "fatal error" : reason;
        }
    }
}
