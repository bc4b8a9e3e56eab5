package io.authrelay.model;

public record AtomicFunction(
        Domain domain,
        MessageDetails messageDetails,
        String contractAddress
) implements LibraryFunction {
}
