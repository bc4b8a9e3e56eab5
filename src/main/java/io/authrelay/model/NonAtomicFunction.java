package io.authrelay.model;

public record NonAtomicFunction(
        Domain domain,
        MessageDetails messageDetails,
        String contractAddress,
        RetryLogic retryLogic,
        FunctionCallback callbackConfirmation
) implements LibraryFunction {
}
