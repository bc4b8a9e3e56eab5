package io.authrelay.processor;

import io.authrelay.model.FunctionCallback;
import io.authrelay.model.MessageBatch;

public record PendingCallback(MessageBatch batch, int functionIndex, FunctionCallback confirmation) {
}
