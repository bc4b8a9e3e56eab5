package io.authrelay.processor;

import io.authrelay.host.ContractException;

public class ProcessorError extends ContractException {
    public enum Reason {
        UNAUTHORIZED("Unauthorized"),
        PAUSED("Processor is paused"),
        UNKNOWN_REPLY_ID("Unknown reply id"),
        EMPTY_QUEUE("Queue is empty"),
        INVALID_QUEUE_POSITION("Invalid queue position"),
        BATCH_STARTED("Batch has started executing and can't be removed"),
        EXECUTION_NOT_FOUND("Execution id not found"),
        CALLBACK_NOT_RETRIABLE("Callback can't be retried");

        private final String text;

        Reason(String text) {
            this.text = text;
        }
    }

    private final Reason reason;

    public ProcessorError(Reason reason) {
        this(reason, null);
    }

    public ProcessorError(Reason reason, String detail) {
        super("Processor error: " + reason.text + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
