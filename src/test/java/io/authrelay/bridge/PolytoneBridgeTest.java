package io.authrelay.bridge;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.config.AuthRelayConfig;
import io.authrelay.config.NetworkSettings;
import io.authrelay.model.Domain;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Expiration;
import io.authrelay.model.ExternalDomain;
import io.authrelay.model.NonAtomicFunction;
import io.authrelay.model.PolytoneProxyState;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorDomain;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.ProcessorQuery;
import io.authrelay.processor.PendingPolytoneCallback;
import io.authrelay.runtime.AuthRelayRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static io.authrelay.support.MainDomainHarness.USER;
import static io.authrelay.support.MainDomainHarness.execute;
import static io.authrelay.support.MainDomainHarness.nonAtomic;
import static io.authrelay.support.MainDomainHarness.permissionless;
import static io.authrelay.support.MainDomainHarness.processFunction;

final class PolytoneBridgeTest {
    private static final Domain OSMOSIS = Domain.external("osmosis");
    private static final long TIMEOUT = 600L;

    @Test
    void proxyIsCreatedOnFirstRelayAndGatesRouting() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-proxy-");
        try {
            AuthRelayRuntime runtime = start(root);
            Assertions.assertEquals(PolytoneProxyState.PENDING_RESPONSE, proxyState(runtime));
            createRemoteAuthorization(runtime);

            AuthRelayRuntime.TxOutcome early = runtime.sendMsgs(USER, "remote",
                    List.of(execute("{\"process_function\":{}}")), null);
            Assertions.assertFalse(early.success());
            Assertions.assertTrue(early.error().contains("proxy is not created"), early.error());

            RelayReport report = runtime.relay();
            Assertions.assertTrue(report.delivered() >= 1);
            Assertions.assertEquals(PolytoneProxyState.CREATED, proxyState(runtime));

            AuthRelayRuntime.TxOutcome retry = runtime.retryBridgeCreation(USER, "osmosis");
            Assertions.assertFalse(retry.success());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timedOutProxyCreationCanBeRetried() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-proxy-retry-");
        try {
            AuthRelayRuntime runtime = start(root);
            runtime.advanceTime(TIMEOUT + 1);
            RelayReport report = runtime.relay();

            Assertions.assertEquals(2, report.timedOut());
            Assertions.assertEquals(PolytoneProxyState.TIMED_OUT, proxyState(runtime));
            Assertions.assertEquals(PolytoneProxyState.TIMED_OUT, processorProxyState(runtime));

            runtime.retryBridgeCreation(USER, "osmosis").requireSuccess();
            runtime.execute(OSMOSIS, USER, runtime.processorAddress(OSMOSIS), new ProcessorMsg.RetryBridgeCreation())
                    .requireSuccess();
            Assertions.assertEquals(PolytoneProxyState.PENDING_RESPONSE, proxyState(runtime));
            runtime.relay();
            Assertions.assertEquals(PolytoneProxyState.CREATED, proxyState(runtime));
            Assertions.assertEquals(PolytoneProxyState.CREATED, processorProxyState(runtime));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void remoteExecutionReportsBackThroughTheBridge() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-e2e-");
        try {
            AuthRelayRuntime runtime = start(root);
            runtime.relay();
            createRemoteAuthorization(runtime);

            long id = executionId(runtime.sendMsgs(USER, "remote",
                    List.of(execute("{\"process_function\":{}}")), null).requireSuccess());
            Assertions.assertTrue(runtime.queue(OSMOSIS, Priority.MEDIUM).isEmpty());

            runtime.relay();
            Assertions.assertEquals(1, runtime.queue(OSMOSIS, Priority.MEDIUM).size());
            Assertions.assertInstanceOf(ExecutionResult.InProcess.class, runtime.callback(id).executionResult());

            runtime.tick(OSMOSIS).requireSuccess();
            runtime.relay();

            Assertions.assertInstanceOf(ExecutionResult.Success.class, runtime.callback(id).executionResult());
            Assertions.assertNull(pendingCallback(runtime, id));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timedOutDeliveryIsRetriableWhileTheTtlHolds() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-timeout-");
        try {
            AuthRelayRuntime runtime = start(root);
            runtime.relay();
            createRemoteAuthorization(runtime);

            long id = executionId(runtime.sendMsgs(USER, "remote",
                    List.of(execute("{\"process_function\":{}}")), null).requireSuccess());
            runtime.advanceTime(TIMEOUT + 1);
            runtime.relay();

            Assertions.assertEquals(new ExecutionResult.Timeout(true), runtime.callback(id).executionResult());
            AuthRelayRuntime.TxOutcome blocked = runtime.sendMsgs(USER, "remote",
                    List.of(execute("{\"process_function\":{}}")), null);
            Assertions.assertFalse(blocked.success());

            runtime.retryMsgs(USER, id).requireSuccess();
            runtime.relay();
            runtime.tick(OSMOSIS).requireSuccess();
            runtime.relay();

            Assertions.assertInstanceOf(ExecutionResult.Success.class, runtime.callback(id).executionResult());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredTtlMakesTheTimeoutFinal() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-ttl-");
        try {
            AuthRelayRuntime runtime = start(root);
            runtime.relay();
            createRemoteAuthorization(runtime);
            long now = runtime.chain(Domain.MAIN).block().time();

            long id = executionId(runtime.sendMsgs(USER, "remote", List.of(execute("{\"process_function\":{}}")),
                    Expiration.atTime(now + 60)).requireSuccess());
            runtime.advanceTime(TIMEOUT + 1);
            runtime.relay();

            Assertions.assertEquals(new ExecutionResult.Timeout(false), runtime.callback(id).executionResult());
            Assertions.assertFalse(runtime.retryMsgs(USER, id).success());
            runtime.sendMsgs(USER, "remote", List.of(execute("{\"process_function\":{}}")), null).requireSuccess();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lostCallbackIsResentFromTheProcessor() throws Exception {
        Path root = Files.createTempDirectory("authrelay-test-polytone-callback-");
        try {
            AuthRelayRuntime runtime = start(root);
            runtime.relay();
            createRemoteAuthorization(runtime);
            long id = executionId(runtime.sendMsgs(USER, "remote",
                    List.of(execute("{\"process_function\":{}}")), null).requireSuccess());
            runtime.relay();
            runtime.tick(OSMOSIS).requireSuccess();

            runtime.advanceTime(TIMEOUT + 1);
            runtime.relay();
            Assertions.assertEquals(PendingPolytoneCallback.Status.TIMED_OUT, pendingCallback(runtime, id).status());
            Assertions.assertInstanceOf(ExecutionResult.InProcess.class, runtime.callback(id).executionResult());

            String processor = runtime.processorAddress(OSMOSIS);
            runtime.execute(OSMOSIS, USER, processor, new ProcessorMsg.RetryCallback(id)).requireSuccess();
            runtime.relay();

            Assertions.assertInstanceOf(ExecutionResult.Success.class, runtime.callback(id).executionResult());
            Assertions.assertFalse(runtime.execute(OSMOSIS, USER, processor, new ProcessorMsg.RetryCallback(id)).success());
        } finally {
            deleteRecursively(root);
        }
    }

    private static AuthRelayRuntime start(Path root) {
        AuthRelayConfig config = AuthRelayConfig.fromRoot(root.toString());
        NetworkSettings.defaults()
                .withExternalDomain(new NetworkSettings.ExternalDomainSettings("osmosis", "osmosis-1", "polytone",
                        TIMEOUT, null))
                .save(config.settingsFile());
        AuthRelayRuntime runtime = new AuthRelayRuntime(config);
        runtime.init();
        return runtime;
    }

    private static void createRemoteAuthorization(AuthRelayRuntime runtime) throws Exception {
        String echo = runtime.libraryAddress(OSMOSIS, "echo");
        runtime.createAuthorizations(runtime.settings().owner(), List.of(permissionless("remote",
                nonAtomic(new NonAtomicFunction(OSMOSIS, processFunction(), echo, null, null))))).requireSuccess();
    }

    private static PolytoneProxyState proxyState(AuthRelayRuntime runtime) {
        ExternalDomain domain = runtime.externalDomains().get(0);
        return ((ExternalDomain.Cosmwasm) domain.executionEnvironment()).polytone().polytoneNote().state();
    }

    private static PolytoneProxyState processorProxyState(AuthRelayRuntime runtime) {
        ProcessorDomain domain = runtime.processorConfig(OSMOSIS).processorDomain();
        return ((ProcessorDomain.Polytone) domain).proxyOnMainDomainState();
    }

    private static PendingPolytoneCallback pendingCallback(AuthRelayRuntime runtime, long id) {
        return runtime.queryContract(OSMOSIS, runtime.processorAddress(OSMOSIS),
                new ProcessorQuery.PendingPolytoneCallback(id), new TypeReference<PendingPolytoneCallback>() {
                });
    }

    private static long executionId(AuthRelayRuntime.TxOutcome outcome) {
        return Long.parseLong(outcome.attribute("execution_id").get(0));
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
