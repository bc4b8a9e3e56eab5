package io.authrelay.runtime;

import io.authrelay.config.AuthRelayConfig;
import io.authrelay.model.Authorization;
import io.authrelay.model.Domain;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Priority;
import io.authrelay.observability.AuditLogger;
import io.authrelay.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.stream.Stream;

import static io.authrelay.support.MainDomainHarness.USER;
import static io.authrelay.support.MainDomainHarness.nonAtomic;
import static io.authrelay.support.MainDomainHarness.nonAtomicCall;
import static io.authrelay.support.MainDomainHarness.permissionless;

final class AuthRelayRuntimeTest {

    @Test
    void initWritesDefaultSettingsAndRegistersTheMainChain() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-runtime-init-");
        try {
            AuthRelayConfig config = AuthRelayConfig.fromRoot(root.toString());
            AuthRelayRuntime runtime = new AuthRelayRuntime(config);
            runtime.init();

            Assertions.assertTrue(Files.exists(config.settingsFile()));
            Assertions.assertTrue(Files.exists(config.auditSigningKeyFile()));
            List<Database.ChainRow> chains = runtime.chains();
            Assertions.assertEquals(1, chains.size());
            Assertions.assertEquals("neutron-1", chains.get(0).chainId());
            Assertions.assertEquals("main", chains.get(0).role());
            Assertions.assertTrue(runtime.externalDomains().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void executionAndAuthorizationsSurviveARestart() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-runtime-restart-");
        try {
            AuthRelayRuntime first = new AuthRelayRuntime(AuthRelayConfig.fromRoot(root.toString()));
            first.init();
            String echo = first.libraryAddress(Domain.MAIN, "echo");
            first.createAuthorizations(first.settings().owner(),
                    List.of(permissionless("echo", nonAtomic(nonAtomicCall(echo, null, null))))).requireSuccess();

            String payload = Base64.getEncoder().encodeToString(
                    "{\"process_function\":{}}".getBytes(StandardCharsets.UTF_8));
            AuthRelayRuntime.TxOutcome sent = first.sendMsgs(USER, "echo",
                    "[{\"cosmwasm_execute_msg\":{\"msg\":\"" + payload + "\"}}]", null);
            Assertions.assertTrue(sent.success(), sent.error());
            long id = Long.parseLong(sent.attribute("execution_id").get(0));
            Assertions.assertEquals(1, first.queue(Domain.MAIN, Priority.MEDIUM).size());

            AuthRelayRuntime second = new AuthRelayRuntime(AuthRelayConfig.fromRoot(root.toString()));
            second.init();
            Assertions.assertEquals(first.registryAddress(), second.registryAddress());
            Assertions.assertEquals(List.of("echo"), second.authorizations().stream().map(Authorization::label).toList());
            Assertions.assertEquals(1, second.queue(Domain.MAIN, Priority.MEDIUM).size());

            second.tick(Domain.MAIN).requireSuccess();
            Assertions.assertInstanceOf(ExecutionResult.Success.class, second.callback(id).executionResult());
            Assertions.assertEquals(1, second.callbacks().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedTransactionsAreReportedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-runtime-audit-");
        try {
            AuthRelayConfig config = AuthRelayConfig.fromRoot(root.toString());
            AuthRelayRuntime runtime = new AuthRelayRuntime(config);
            runtime.init();

            AuthRelayRuntime.TxOutcome rejected = runtime.sendMsgs(USER, "missing", List.of(), null);
            Assertions.assertFalse(rejected.success());
            Assertions.assertNotNull(rejected.error());
            Assertions.assertTrue(rejected.attribute("execution_id").isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.sendMsgs(USER, "missing", "not json", null));

            String last = runtime.auditTail(1).get(0);
            Assertions.assertTrue(last.contains("\"registry.send_msgs\""), last);
            Assertions.assertTrue(last.contains("\"rejected\""), last);
            AuditLogger.IntegrityReport report = runtime.verifyAudit();
            Assertions.assertTrue(report.valid(), report.message());

            List<String> lines = Files.readAllLines(config.auditFile(), StandardCharsets.UTF_8);
            Files.write(config.auditFile(), lines.subList(1, lines.size()), StandardCharsets.UTF_8);
            Assertions.assertFalse(runtime.verifyAudit().valid());
        } finally {
            deleteRecursively(root);
        }
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
