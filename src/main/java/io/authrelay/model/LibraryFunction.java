package io.authrelay.model;

public interface LibraryFunction {
    Domain domain();

    MessageDetails messageDetails();

    String contractAddress();
}
