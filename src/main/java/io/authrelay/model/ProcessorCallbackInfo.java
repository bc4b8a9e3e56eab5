package io.authrelay.model;

import java.util.List;

public record ProcessorCallbackInfo(
        long executionId,
        String processorCallbackAddress,
        Domain domain,
        String label,
        List<ProcessorMessage> messages,
        Expiration ttl,
        ExecutionResult executionResult,
        String initiator,
        boolean escrowedToken,
        long createdAt
) {
    public ProcessorCallbackInfo {
        messages = messages == null ? List.of() : List.copyOf(messages);
        ttl = ttl == null ? Expiration.NEVER : ttl;
    }

    public ProcessorCallbackInfo withResult(ExecutionResult result) {
        return new ProcessorCallbackInfo(executionId, processorCallbackAddress, domain, label, messages, ttl,
                result, initiator, escrowedToken, createdAt);
    }
}
