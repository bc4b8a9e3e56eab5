package io.authrelay.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.host.TxResult;
import io.authrelay.model.Authorization;
import io.authrelay.model.AuthorizationDuration;
import io.authrelay.model.AuthorizationInfo;
import io.authrelay.model.AuthorizationMode;
import io.authrelay.model.Domain;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Expiration;
import io.authrelay.model.ExternalDomain;
import io.authrelay.model.ExternalDomainInfo;
import io.authrelay.model.Mint;
import io.authrelay.model.NonAtomicFunction;
import io.authrelay.model.ParamRestriction;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorCallbackInfo;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RegistryQuery;
import io.authrelay.model.Subroutine;
import io.authrelay.support.MainDomainHarness;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.Map;

import static io.authrelay.support.MainDomainHarness.OWNER;
import static io.authrelay.support.MainDomainHarness.SUB_OWNER;
import static io.authrelay.support.MainDomainHarness.USER;
import static io.authrelay.support.MainDomainHarness.atomic;
import static io.authrelay.support.MainDomainHarness.atomicCall;
import static io.authrelay.support.MainDomainHarness.execute;
import static io.authrelay.support.MainDomainHarness.executionId;
import static io.authrelay.support.MainDomainHarness.nonAtomic;
import static io.authrelay.support.MainDomainHarness.nonAtomicCall;
import static io.authrelay.support.MainDomainHarness.permissionless;
import static io.authrelay.support.MainDomainHarness.processFunction;
import static io.authrelay.support.MainDomainHarness.withCallLimit;

final class AuthorizationRegistryTest {

    @Test
    void onlyOwnerAndSubOwnersManageAuthorizations() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));

        main.chain().execute(SUB_OWNER, main.registry(),
                new RegistryMsg.CreateAuthorizations(List.of(permissionless("by-sub-owner", subroutine))));
        assertRejected(AuthorizationError.Reason.UNAUTHORIZED, () -> main.chain().execute(USER, main.registry(),
                new RegistryMsg.CreateAuthorizations(List.of(permissionless("by-user", subroutine)))));
        assertRejected(AuthorizationError.Reason.UNAUTHORIZED, () -> main.chain().execute(SUB_OWNER, main.registry(),
                new RegistryMsg.AddSubOwner(USER)));

        Assertions.assertEquals(List.of("by-sub-owner"), labels(main));
    }

    @Test
    void creationRejectsInvalidAuthorizations() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));
        main.create(permissionless("taken", subroutine));

        assertRejected(AuthorizationError.Reason.LABEL_ALREADY_EXISTS, () -> main.create(permissionless("taken", subroutine)));
        assertRejected(AuthorizationError.Reason.EMPTY_LABEL, () -> main.create(permissionless("", subroutine)));
        assertRejected(AuthorizationError.Reason.NO_FUNCTIONS, () -> main.create(permissionless("empty", atomic(null))));
        assertRejected(AuthorizationError.Reason.PERMISSIONLESS_WITH_HIGH_PRIORITY, () -> main.create(
                new AuthorizationInfo("loud", new AuthorizationMode.Permissionless(), null, null, null, subroutine,
                        Priority.HIGH)));
        assertRejected(AuthorizationError.Reason.INVALID_CONCURRENCY_LIMIT, () -> main.create(
                new AuthorizationInfo("stuck", new AuthorizationMode.Permissionless(), null, null, 0L, subroutine,
                        Priority.MEDIUM)));

        NonAtomicFunction remote = new NonAtomicFunction(Domain.external("osmosis"), processFunction(), "osmo1lib",
                null, null);
        assertRejected(AuthorizationError.Reason.DOMAIN_NOT_REGISTERED,
                () -> main.create(permissionless("remote", nonAtomic(remote))));
        assertRejected(AuthorizationError.Reason.DIFFERENT_FUNCTION_DOMAINS, () -> main.create(permissionless("mixed",
                nonAtomic(nonAtomicCall(main.echo(), null, null), new NonAtomicFunction(Domain.external("osmosis"),
                        processFunction(), "osmo1lib", null, null)))));

        Assertions.assertEquals(List.of("taken"), labels(main));
    }

    @Test
    void failedBatchCreatesNothing() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));
        assertRejected(AuthorizationError.Reason.LABEL_ALREADY_EXISTS,
                () -> main.create(permissionless("first", subroutine), permissionless("first", subroutine)));
        Assertions.assertTrue(labels(main).isEmpty());
    }

    @Test
    void sendChecksAuthorizationState() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));
        long now = main.chain().block().time();
        main.create(
                permissionless("plain", subroutine),
                new AuthorizationInfo("later", new AuthorizationMode.Permissionless(), Expiration.atTime(now + 100),
                        null, null, subroutine, Priority.MEDIUM),
                new AuthorizationInfo("brief", new AuthorizationMode.Permissionless(), null,
                        AuthorizationDuration.seconds(50), null, subroutine, Priority.MEDIUM));

        assertRejected(AuthorizationError.Reason.AUTHORIZATION_DOES_NOT_EXIST,
                () -> main.send(USER, "missing", execute("{\"process_function\":{}}")));
        assertRejected(AuthorizationError.Reason.NOT_YET_VALID,
                () -> main.send(USER, "later", execute("{\"process_function\":{}}")));

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.DisableAuthorization("plain"));
        assertRejected(AuthorizationError.Reason.AUTHORIZATION_DISABLED,
                () -> main.send(USER, "plain", execute("{\"process_function\":{}}")));
        main.chain().execute(OWNER, main.registry(), new RegistryMsg.EnableAuthorization("plain"));
        main.send(USER, "plain", execute("{\"process_function\":{}}"));

        main.chain().advanceSeconds(100);
        main.send(USER, "later", execute("{\"process_function\":{}}"));
        assertRejected(AuthorizationError.Reason.EXPIRED,
                () -> main.send(USER, "brief", execute("{\"process_function\":{}}")));
    }

    @Test
    void sendValidatesMessagesAgainstTheSubroutine() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine guarded = nonAtomic(new NonAtomicFunction(Domain.MAIN,
                processFunction(new ParamRestriction.MustBeIncluded(List.of("process_function", "transfer"))),
                main.ledger(), null, null));
        main.create(permissionless("guarded", guarded));

        assertRejected(AuthorizationError.Reason.INVALID_AMOUNT, () -> main.send(USER, "guarded"));
        assertRejected(AuthorizationError.Reason.INVALID_JSON, () -> main.send(USER, "guarded", execute("{not json")));
        assertRejected(AuthorizationError.Reason.DOES_NOT_MATCH,
                () -> main.send(USER, "guarded", execute("{\"update_config\":{\"transfer\":{}}}")));
        assertRejected(AuthorizationError.Reason.INVALID_MESSAGE_PARAMS,
                () -> main.send(USER, "guarded", execute("{\"process_function\":{\"mint\":{}}}")));

        long id = executionId(main.send(USER, "guarded",
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"bob\",\"amount\":1}}}")));
        Assertions.assertEquals(1L, id);
    }

    @Test
    void callLimitedTokensAreEscrowedThenBurnedOrRefunded() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(
                withCallLimit("works", atomic(null, atomicCall(main.echo())), Map.of(USER, 1L), Priority.MEDIUM),
                withCallLimit("breaks", atomic(null, atomicCall(main.fail())), Map.of(USER, 1L), Priority.MEDIUM));

        main.send(USER, "works", execute("{\"process_function\":{}}"));
        Assertions.assertEquals(0L, main.tokens("works", USER));
        assertRejected(AuthorizationError.Reason.NO_PERMISSION_TOKEN,
                () -> main.send(USER, "works", execute("{\"process_function\":{}}")));
        main.tick();
        Assertions.assertEquals(0L, main.tokens("works", USER));

        long failed = executionId(main.send(USER, "breaks", execute("{\"process_function\":{}}")));
        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Rejected.class, main.callback(failed).executionResult());
        Assertions.assertEquals(1L, main.tokens("breaks", USER));
    }

    @Test
    void tokensWithoutCallLimitAreNeverSpent() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(new AuthorizationInfo("members", new AuthorizationMode.Permissioned(
                new AuthorizationMode.PermissionType.WithoutCallLimit(List.of(USER))), null, null, 5L,
                atomic(null, atomicCall(main.echo())), Priority.HIGH));

        main.send(USER, "members", execute("{\"process_function\":{}}"));
        main.send(USER, "members", execute("{\"process_function\":{}}"));
        Assertions.assertEquals(1L, main.tokens("members", USER));
        assertRejected(AuthorizationError.Reason.NO_PERMISSION_TOKEN,
                () -> main.send("stranger", "members", execute("{\"process_function\":{}}")));
    }

    @Test
    void mintingIsOnlyForPermissionedAuthorizations() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));
        main.create(permissionless("open", subroutine),
                withCallLimit("closed", subroutine, Map.of(), Priority.MEDIUM));

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.MintAuthorizations("closed",
                List.of(new Mint(USER, 3L), new Mint("ignored", 0L))));
        Assertions.assertEquals(3L, main.tokens("closed", USER));
        Assertions.assertEquals(0L, main.tokens("closed", "ignored"));

        assertRejected(AuthorizationError.Reason.CANNOT_MINT_FOR_PERMISSIONLESS, () -> main.chain().execute(OWNER,
                main.registry(), new RegistryMsg.MintAuthorizations("open", List.of(new Mint(USER, 1L)))));
    }

    @Test
    void concurrencyLimitFreesUpWhenExecutionFinishes() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("single", atomic(null, atomicCall(main.echo()))));

        main.send(USER, "single", execute("{\"process_function\":{}}"));
        assertRejected(AuthorizationError.Reason.MAX_CONCURRENT_EXECUTIONS_REACHED,
                () -> main.send(USER, "single", execute("{\"process_function\":{}}")));

        main.chain().execute(OWNER, main.registry(),
                new RegistryMsg.ModifyAuthorization("single", null, null, 2L, null));
        main.send(USER, "single", execute("{\"process_function\":{}}"));
        Assertions.assertEquals(2L, main.currentExecutions("single"));

        main.tick();
        main.tick();
        Assertions.assertEquals(0L, main.currentExecutions("single"));
    }

    @Test
    void replayedCallbackChangesNothing() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("once", atomic(null, atomicCall(main.echo()))));
        long id = executionId(main.send(USER, "once", execute("{\"process_function\":{}}")));
        main.tick();

        TxResult replay = main.chain().execute(main.processor(), main.registry(),
                new RegistryMsg.ProcessorCallback(id, new ExecutionResult.RemovedByOwner()));

        Assertions.assertTrue(replay.hasAttribute("replay", "true"));
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(id).executionResult());
        Assertions.assertEquals(0L, main.currentExecutions("once"));
    }

    @Test
    void callbacksFromAnyoneButTheProcessorAreRejected() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("once", atomic(null, atomicCall(main.echo()))));
        long id = executionId(main.send(USER, "once", execute("{\"process_function\":{}}")));

        assertRejected(AuthorizationError.Reason.UNAUTHORIZED, () -> main.chain().execute(USER, main.registry(),
                new RegistryMsg.ProcessorCallback(id, new ExecutionResult.Success())));
        assertRejected(AuthorizationError.Reason.EXECUTION_NOT_FOUND, () -> main.chain().execute(main.processor(),
                main.registry(), new RegistryMsg.ProcessorCallback(99L, new ExecutionResult.Success())));
    }

    @Test
    void insertedBatchJumpsTheQueue() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("regular", atomic(null, atomicCall(main.echo()))),
                withCallLimit("urgent", atomic(null, atomicCall(main.echo())), Map.of(), Priority.MEDIUM));
        long regular = executionId(main.send(USER, "regular", execute("{\"process_function\":{}}")));

        long inserted = executionId(main.chain().execute(OWNER, main.registry(), new RegistryMsg.InsertMsgs("urgent", 0,
                Priority.MEDIUM, List.of(execute("{\"process_function\":{}}")))));
        Assertions.assertEquals(inserted, main.queue(Priority.MEDIUM).get(0).id());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(inserted).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(regular).executionResult());
    }

    @Test
    void ownershipTransferNeedsAcceptance() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.chain().execute(OWNER, main.registry(), new RegistryMsg.TransferOwnership("next-owner"));
        assertRejected(AuthorizationError.Reason.OWNERSHIP,
                () -> main.chain().execute(USER, main.registry(), new RegistryMsg.AcceptOwnership()));

        main.chain().execute("next-owner", main.registry(), new RegistryMsg.AcceptOwnership());
        RegistryQuery.OwnershipInfo ownership = main.chain().query(main.registry(), new RegistryQuery.Ownership(),
                RegistryQuery.OwnershipInfo.class);
        Assertions.assertEquals("next-owner", ownership.owner());
        Assertions.assertNull(ownership.pendingOwner());

        assertRejected(AuthorizationError.Reason.UNAUTHORIZED,
                () -> main.chain().execute(OWNER, main.registry(), new RegistryMsg.AddSubOwner(USER)));
        main.chain().execute("next-owner", main.registry(), new RegistryMsg.RenounceOwnership());
        Assertions.assertNull(main.chain().query(main.registry(), new RegistryQuery.Ownership(),
                RegistryQuery.OwnershipInfo.class).owner());
    }

    @Test
    void ownerManagesSubOwnersAndExternalDomains() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Assertions.assertEquals(main.processor(),
                main.chain().query(main.registry(), new RegistryQuery.Processor(), String.class));

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.RemoveSubOwner(SUB_OWNER));
        Assertions.assertEquals(List.of(), main.chain().query(main.registry(), new RegistryQuery.SubOwners(),
                new TypeReference<List<String>>() {
                }));
        assertRejected(AuthorizationError.Reason.UNAUTHORIZED, () -> main.chain().execute(SUB_OWNER, main.registry(),
                new RegistryMsg.CreateAuthorizations(List.of(permissionless("late",
                        atomic(null, atomicCall(main.echo())))))));

        ExternalDomainInfo ethereum = ExternalDomainInfo.hyperlane("ethereum", "mailbox", 1000, "remote-processor");
        main.chain().execute(OWNER, main.registry(), new RegistryMsg.AddExternalDomains(List.of(ethereum)));
        ExternalDomain stored = main.chain().query(main.registry(), new RegistryQuery.ExternalDomainByName("ethereum"),
                ExternalDomain.class);
        Assertions.assertEquals("remote-processor", stored.processor());
        Assertions.assertInstanceOf(ExternalDomain.Evm.class, stored.executionEnvironment());

        assertRejected(AuthorizationError.Reason.DOMAIN_ALREADY_REGISTERED, () -> main.chain().execute(OWNER,
                main.registry(), new RegistryMsg.AddExternalDomains(List.of(ethereum))));
    }

    @Test
    void listingsArePagedByKey() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Subroutine subroutine = atomic(null, atomicCall(main.echo()));
        main.create(permissionless("a", subroutine), permissionless("b", subroutine), permissionless("c", subroutine));
        for (String label : List.of("a", "b", "c")) {
            main.send(USER, label, execute("{\"process_function\":{}}"));
        }

        Assertions.assertEquals(List.of("a", "b"), labels(main.chain().query(main.registry(),
                new RegistryQuery.Authorizations(null, 2), new TypeReference<List<Authorization>>() {
                })));
        Assertions.assertEquals(List.of("c"), labels(main.chain().query(main.registry(),
                new RegistryQuery.Authorizations("b", 2), new TypeReference<List<Authorization>>() {
                })));

        List<ProcessorCallbackInfo> afterFirst = main.chain().query(main.registry(),
                new RegistryQuery.ProcessorCallbacks(1L, 10), new TypeReference<List<ProcessorCallbackInfo>>() {
                });
        Assertions.assertEquals(List.of(2L, 3L), afterFirst.stream().map(ProcessorCallbackInfo::executionId).toList());
    }

    private static List<String> labels(MainDomainHarness main) throws Exception {
        return labels(main.chain().query(main.registry(), new RegistryQuery.Authorizations(null, null),
                new TypeReference<List<Authorization>>() {
                }));
    }

    private static List<String> labels(List<Authorization> authorizations) {
        return authorizations.stream().map(Authorization::label).toList();
    }

    private static void assertRejected(AuthorizationError.Reason reason, Executable call) {
        AuthorizationError error = Assertions.assertThrows(AuthorizationError.class, call);
        Assertions.assertEquals(reason, error.reason());
    }
}
