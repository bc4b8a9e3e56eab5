package io.authrelay;

import io.authrelay.cli.AuthRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AuthRelayCommand()).execute(args);
        System.exit(code);
    }
}
