package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ExecutionResult.InProcess.class),
        @JsonSubTypes.Type(ExecutionResult.Success.class),
        @JsonSubTypes.Type(ExecutionResult.Rejected.class),
        @JsonSubTypes.Type(ExecutionResult.PartiallyExecuted.class),
        @JsonSubTypes.Type(ExecutionResult.RemovedByOwner.class),
        @JsonSubTypes.Type(ExecutionResult.Expired.class),
        @JsonSubTypes.Type(ExecutionResult.Timeout.class),
        @JsonSubTypes.Type(ExecutionResult.UnexpectedError.class)
})
public interface ExecutionResult {

    // a call-limited token is spent once any function ran
    default boolean consumesToken() {
        return false;
    }

    default boolean open() {
        return false;
    }

    @JsonTypeName("in_process")
    record InProcess() implements ExecutionResult {
        @Override
        public boolean open() {
            return true;
        }
    }

    @JsonTypeName("success")
    record Success() implements ExecutionResult {
        @Override
        public boolean consumesToken() {
            return true;
        }
    }

    @JsonTypeName("rejected")
    record Rejected(String reason) implements ExecutionResult {
    }

    @JsonTypeName("partially_executed")
    record PartiallyExecuted(long executedCount, String reason) implements ExecutionResult {
        @Override
        public boolean consumesToken() {
            return executedCount > 0;
        }
    }

    @JsonTypeName("removed_by_owner")
    record RemovedByOwner() implements ExecutionResult {
    }

    @JsonTypeName("expired")
    record Expired(long executedCount) implements ExecutionResult {
        @Override
        public boolean consumesToken() {
            return executedCount > 0;
        }
    }

    @JsonTypeName("timeout")
    record Timeout(boolean retriable) implements ExecutionResult {
        @Override
        public boolean open() {
            return retriable;
        }
    }

    @JsonTypeName("unexpected_error")
    record UnexpectedError(String reason) implements ExecutionResult {
    }
}
