package io.authrelay.cli;

import io.authrelay.config.AuthRelayConfig;
import io.authrelay.model.Domain;
import io.authrelay.model.ExecutionResult;
import io.authrelay.runtime.AuthRelayRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static io.authrelay.support.MainDomainHarness.nonAtomic;
import static io.authrelay.support.MainDomainHarness.nonAtomicCall;
import static io.authrelay.support.MainDomainHarness.permissionless;

final class AuthRelayCommandTest {

    @Test
    void commandsDriveTheRuntimeStoredUnderTheRoot() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init"));

            AuthRelayRuntime runtime = new AuthRelayRuntime(AuthRelayConfig.fromRoot(root.toString()));
            runtime.init();
            String echo = runtime.libraryAddress(Domain.MAIN, "echo");
            runtime.createAuthorizations(runtime.settings().owner(),
                    List.of(permissionless("echo", nonAtomic(nonAtomicCall(echo, null, null))))).requireSuccess();

            Assertions.assertEquals(0, run(root, "send", "--label", "echo", "--sender", "user",
                    "--msg", "{\"process_function\":{}}"));
            Assertions.assertEquals(1, run(root, "send", "--label", "unknown", "--sender", "user",
                    "--msg", "{\"process_function\":{}}"));
            Assertions.assertEquals(0, run(root, "tick"));
            Assertions.assertEquals(0, run(root, "callbacks", "--execution-id", "1"));
            Assertions.assertEquals(0, run(root, "tokens", "--label", "echo", "--address", "user"));
            Assertions.assertEquals(0, run(root, "disable", "--label", "echo"));
            Assertions.assertEquals(1, run(root, "send", "--label", "echo", "--sender", "user",
                    "--msg", "{\"process_function\":{}}"));
            Assertions.assertEquals(0, run(root, "enable", "--label", "echo"));
            Assertions.assertEquals(0, run(root, "audit-verify"));

            AuthRelayRuntime reopened = new AuthRelayRuntime(AuthRelayConfig.fromRoot(root.toString()));
            reopened.init();
            Assertions.assertInstanceOf(ExecutionResult.Success.class, reopened.callback(1).executionResult());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingRequiredOptionIsAUsageError() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-cli-usage-");
        try {
            Assertions.assertEquals(2, run(root, "send", "--label", "echo"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new AuthRelayCommand()).execute(full);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
