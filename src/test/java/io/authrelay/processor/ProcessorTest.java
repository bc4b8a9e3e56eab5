package io.authrelay.processor;

import io.authrelay.host.ContractException;
import io.authrelay.host.TxResult;
import io.authrelay.model.CurrentRetry;
import io.authrelay.model.Domain;
import io.authrelay.model.Duration;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Expiration;
import io.authrelay.model.FunctionCallback;
import io.authrelay.model.MessageBatch;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorConfig;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.ProcessorQuery;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RetryLogic;
import io.authrelay.model.RetryTimes;
import io.authrelay.model.Subroutine;
import io.authrelay.support.MainDomainHarness;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static io.authrelay.support.MainDomainHarness.OWNER;
import static io.authrelay.support.MainDomainHarness.USER;
import static io.authrelay.support.MainDomainHarness.atomic;
import static io.authrelay.support.MainDomainHarness.atomicCall;
import static io.authrelay.support.MainDomainHarness.execute;
import static io.authrelay.support.MainDomainHarness.executionId;
import static io.authrelay.support.MainDomainHarness.nonAtomic;
import static io.authrelay.support.MainDomainHarness.nonAtomicCall;
import static io.authrelay.support.MainDomainHarness.permissionless;
import static io.authrelay.support.MainDomainHarness.withCallLimit;

final class ProcessorTest {

    @Test
    void atomicBatchRunsOnTickAndReportsSuccess() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("echo", atomic(null, atomicCall(main.echo()))));

        long id = executionId(main.send(USER, "echo", execute("{\"process_function\":{\"note\":\"hi\"}}")));
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(id).executionResult());
        Assertions.assertEquals(1, main.queue(Priority.MEDIUM).size());
        Assertions.assertEquals(1L, main.currentExecutions("echo"));

        TxResult tick = main.tick();

        Assertions.assertTrue(tick.hasAttribute("action", "execute_atomic"));
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(id).executionResult());
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
        Assertions.assertEquals(0L, main.currentExecutions("echo"));
    }

    @Test
    void callLimitedAtomicSubroutineRunsBothFunctionsInOneTick() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(withCallLimit("payout", atomic(null, atomicCall(main.ledger()), atomicCall(main.ledger())),
                Map.of(USER, 2L), Priority.MEDIUM));

        long id = executionId(main.send(USER, "payout",
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"bob\",\"amount\":40}}}"),
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"carol\",\"amount\":10}}}")));
        Assertions.assertEquals(1L, id);
        Assertions.assertEquals(1L, main.tokens("payout", USER));

        TxResult tick = main.tick();

        Assertions.assertTrue(tick.hasAttribute("action", "execute_atomic"));
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(1L).executionResult());
        Assertions.assertEquals(Map.of("alice", 50L, "bob", 40L, "carol", 10L), main.balances());
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
        Assertions.assertEquals(1L, main.tokens("payout", USER));
    }

    @Test
    void idleTickDoesNothing() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Assertions.assertTrue(main.tick().hasAttribute("action", "idle"));
    }

    @Test
    void failingFunctionIsRetriedUntilTheBudgetIsSpent() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        RetryLogic twiceEveryMinute = new RetryLogic(RetryTimes.amount(2), Duration.seconds(60));
        main.create(permissionless("flaky", nonAtomic(nonAtomicCall(main.fail(), twiceEveryMinute, null))));
        long id = executionId(main.send(USER, "flaky", execute("{\"process_function\":{}}")));
        long failedAt = main.chain().block().time();

        main.tick();
        MessageBatch waiting = main.queue(Priority.MEDIUM).get(0);
        Assertions.assertEquals(1L, waiting.retry().retryAmounts());
        Assertions.assertEquals(Expiration.atTime(failedAt + 60), waiting.retry().retryCooldown());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(id).executionResult());

        Assertions.assertTrue(main.tick().hasAttribute("action", "cooldown"));
        Assertions.assertEquals(1L, main.queue(Priority.MEDIUM).get(0).retry().retryAmounts());

        main.chain().advanceSeconds(60);
        main.tick();

        ExecutionResult result = main.callback(id).executionResult();
        ExecutionResult.PartiallyExecuted partial = Assertions.assertInstanceOf(ExecutionResult.PartiallyExecuted.class, result);
        Assertions.assertEquals(0L, partial.executedCount());
        Assertions.assertTrue(partial.reason().contains("intentional failure"));
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
    }

    @Test
    void queriesReportRetriesAndOwnerCanRepointTheRegistry() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        Assertions.assertTrue(main.chain().query(main.processor(), new ProcessorQuery.IsQueueEmpty(), Boolean.class));

        RetryLogic twiceEveryMinute = new RetryLogic(RetryTimes.amount(2), Duration.seconds(60));
        main.create(permissionless("flaky", nonAtomic(nonAtomicCall(main.fail(), twiceEveryMinute, null))),
                permissionless("echo", atomic(null, atomicCall(main.echo()))));
        long id = executionId(main.send(USER, "flaky", execute("{\"process_function\":{}}")));
        main.tick();

        CurrentRetry retry = main.chain().query(main.processor(), new ProcessorQuery.PendingRetry(id), CurrentRetry.class);
        Assertions.assertEquals(1L, retry.retryAmounts());
        Assertions.assertFalse(main.chain().query(main.processor(), new ProcessorQuery.IsQueueEmpty(), Boolean.class));

        ProcessorMsg.UpdateConfig repoint = new ProcessorMsg.UpdateConfig("elsewhere", null);
        Assertions.assertThrows(ContractException.class, () -> main.chain().execute(USER, main.processor(), repoint));
        main.chain().execute(OWNER, main.processor(), repoint);

        ProcessorConfig config = main.chain().query(main.processor(), new ProcessorQuery.Config(), ProcessorConfig.class);
        Assertions.assertEquals("elsewhere", config.authorizationContract());
        ContractException refused = Assertions.assertThrows(ContractException.class,
                () -> main.send(USER, "echo", execute("{\"process_function\":{}}")));
        Assertions.assertInstanceOf(ProcessorError.class, refused);
    }

    @Test
    void indefiniteRetryKeepsBatchUntilLibraryRecovers() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        RetryLogic forever = new RetryLogic(RetryTimes.INDEFINITELY, null);
        main.create(permissionless("stubborn", nonAtomic(nonAtomicCall(main.fail(), forever, null))));
        long id = executionId(main.send(USER, "stubborn", execute("{\"process_function\":{}}")));

        for (int i = 0; i < 3; i++) {
            main.tick();
        }
        Assertions.assertEquals(3L, main.queue(Priority.MEDIUM).get(0).retry().retryAmounts());

        main.chain().execute(OWNER, main.fail(), Map.of("update_config", Map.of("fail", false)));
        main.tick();

        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(id).executionResult());
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
    }

    @Test
    void atomicFailureRollsBackEveryFunction() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("payout", atomic(null, atomicCall(main.ledger()), atomicCall(main.ledger()))));

        long id = executionId(main.send(USER, "payout",
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"bob\",\"amount\":40}}}"),
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"carol\",\"amount\":100}}}")));
        main.tick();

        ExecutionResult.Rejected rejected = Assertions.assertInstanceOf(ExecutionResult.Rejected.class,
                main.callback(id).executionResult());
        Assertions.assertTrue(rejected.reason().contains("Insufficient funds"));
        Assertions.assertEquals(Map.of("alice", 100L), main.balances());
    }

    @Test
    void nonAtomicBatchKeepsCompletedFunctions() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("split", nonAtomic(
                nonAtomicCall(main.ledger(), null, null),
                nonAtomicCall(main.ledger(), null, null))));

        long id = executionId(main.send(USER, "split",
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"bob\",\"amount\":40}}}"),
                execute("{\"process_function\":{\"transfer\":{\"from\":\"alice\",\"to\":\"carol\",\"amount\":100}}}")));
        main.tick();
        Assertions.assertEquals(1, main.queue(Priority.MEDIUM).get(0).nextFunction());
        main.tick();

        ExecutionResult.PartiallyExecuted partial = Assertions.assertInstanceOf(ExecutionResult.PartiallyExecuted.class,
                main.callback(id).executionResult());
        Assertions.assertEquals(1L, partial.executedCount());
        Assertions.assertEquals(Map.of("alice", 60L, "bob", 40L), main.balances());
    }

    @Test
    void highPriorityLaneDrainsFirst() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(
                permissionless("medium", atomic(null, atomicCall(main.echo()))),
                withCallLimit("high", atomic(null, atomicCall(main.echo())), Map.of(USER, 5L), Priority.HIGH));

        long medium = executionId(main.send(USER, "medium", execute("{\"process_function\":{\"lane\":\"medium\"}}")));
        long high = executionId(main.send(USER, "high", execute("{\"process_function\":{\"lane\":\"high\"}}")));
        Assertions.assertEquals(1, main.queue(Priority.HIGH).size());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(high).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(medium).executionResult());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(medium).executionResult());
    }

    @Test
    void everyHighBatchRunsBeforeAnEarlierMediumOne() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(
                permissionless("medium", atomic(null, atomicCall(main.echo()))),
                withCallLimit("high-a", atomic(null, atomicCall(main.echo())), Map.of(USER, 1L), Priority.HIGH),
                withCallLimit("high-b", atomic(null, atomicCall(main.echo())), Map.of(USER, 1L), Priority.HIGH));

        long medium = executionId(main.send(USER, "medium", execute("{\"process_function\":{}}")));
        long first = executionId(main.send(USER, "high-a", execute("{\"process_function\":{}}")));
        long second = executionId(main.send(USER, "high-b", execute("{\"process_function\":{}}")));
        Assertions.assertEquals(2, main.queue(Priority.HIGH).size());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(first).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(second).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(medium).executionResult());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(second).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(medium).executionResult());
        Assertions.assertEquals(1, main.queue(Priority.MEDIUM).size());

        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(medium).executionResult());
    }

    @Test
    void expirationWinsOverPendingRetries() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        RetryLogic forever = new RetryLogic(RetryTimes.INDEFINITELY, Duration.seconds(10));
        Subroutine.NonAtomic subroutine = new Subroutine.NonAtomic(
                List.of(nonAtomicCall(main.fail(), forever, null)), 30L);
        main.create(permissionless("short-lived", subroutine));
        long id = executionId(main.send(USER, "short-lived", execute("{\"process_function\":{}}")));

        main.tick();
        main.chain().advanceSeconds(30);
        main.tick();

        ExecutionResult.Expired expired = Assertions.assertInstanceOf(ExecutionResult.Expired.class,
                main.callback(id).executionResult());
        Assertions.assertEquals(0L, expired.executedCount());
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
        Assertions.assertEquals(0L, main.currentExecutions("short-lived"));
    }

    @Test
    void ownerCanEvictQueuedBatchButNotAStartedOne() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        RetryLogic forever = new RetryLogic(RetryTimes.INDEFINITELY, Duration.seconds(10));
        Subroutine.NonAtomic flaky = nonAtomic(nonAtomicCall(main.fail(), forever, null));
        main.create(withCallLimit("queued", atomic(null, atomicCall(main.echo())), Map.of(USER, 1L), Priority.MEDIUM),
                permissionless("flaky", flaky));

        long started = executionId(main.send(USER, "flaky", execute("{\"process_function\":{}}")));
        main.tick();
        long queued = executionId(main.send(USER, "queued", execute("{\"process_function\":{}}")));
        Assertions.assertEquals(0L, main.tokens("queued", USER));

        ContractException refused = Assertions.assertThrows(ContractException.class, () -> main.chain().execute(OWNER,
                main.registry(), new RegistryMsg.EvictMsgs(Domain.MAIN, 0, Priority.MEDIUM)));
        Assertions.assertTrue(refused.getMessage().contains("started"));

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.EvictMsgs(Domain.MAIN, 1, Priority.MEDIUM));

        Assertions.assertInstanceOf(ExecutionResult.RemovedByOwner.class, main.callback(queued).executionResult());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(started).executionResult());
        Assertions.assertEquals(1L, main.tokens("queued", USER));
    }

    @Test
    void pausedProcessorRefusesTicks() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        main.create(permissionless("echo", atomic(null, atomicCall(main.echo()))));
        long id = executionId(main.send(USER, "echo", execute("{\"process_function\":{}}")));

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.PauseProcessor(Domain.MAIN));
        ProcessorError paused = Assertions.assertThrows(ProcessorError.class, main::tick);
        Assertions.assertEquals(ProcessorError.Reason.PAUSED, paused.reason());

        main.chain().execute(OWNER, main.registry(), new RegistryMsg.ResumeProcessor(Domain.MAIN));
        main.tick();
        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(id).executionResult());
    }

    @Test
    void functionWaitsForLibraryConfirmation() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        FunctionCallback confirmation = new FunctionCallback(main.echo(), "\"done\"".getBytes(StandardCharsets.UTF_8));
        main.create(permissionless("confirmed", nonAtomic(nonAtomicCall(main.echo(), null, confirmation))));
        long id = executionId(main.send(USER, "confirmed", execute("{\"process_function\":{\"confirm_with\":\"done\"}}")));

        TxResult tick = main.tick();
        Assertions.assertTrue(tick.hasAttribute("confirmation_pending", Long.toString(id)));
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(id).executionResult());

        main.chain().execute(USER, main.echo(), Map.of("confirm", Map.of("execution_id", id)));

        Assertions.assertInstanceOf(ExecutionResult.Success.class, main.callback(id).executionResult());
    }

    @Test
    void unexpectedConfirmationFailsTheFunction() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        FunctionCallback confirmation = new FunctionCallback(main.echo(), "\"done\"".getBytes(StandardCharsets.UTF_8));
        main.create(permissionless("confirmed", nonAtomic(nonAtomicCall(main.echo(), null, confirmation))));
        long id = executionId(main.send(USER, "confirmed", execute("{\"process_function\":{\"confirm_with\":\"nope\"}}")));

        main.tick();
        main.chain().execute(USER, main.echo(), Map.of("confirm", Map.of("execution_id", id)));

        ExecutionResult.PartiallyExecuted partial = Assertions.assertInstanceOf(ExecutionResult.PartiallyExecuted.class,
                main.callback(id).executionResult());
        Assertions.assertEquals(Processor.INVALID_CALLBACK, partial.reason());
    }

    @Test
    void wrongConfirmationsUseUpTheRetryBudget() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        RetryLogic twiceEveryMinute = new RetryLogic(RetryTimes.amount(2), Duration.seconds(60));
        FunctionCallback confirmation = new FunctionCallback(main.echo(), "\"done\"".getBytes(StandardCharsets.UTF_8));
        main.create(permissionless("confirmed", nonAtomic(nonAtomicCall(main.echo(), twiceEveryMinute, confirmation))));
        long id = executionId(main.send(USER, "confirmed", execute("{\"process_function\":{\"confirm_with\":\"nope\"}}")));

        main.tick();
        main.chain().execute(USER, main.echo(), Map.of("confirm", Map.of("execution_id", id)));
        Assertions.assertEquals(1L, main.queue(Priority.MEDIUM).get(0).retry().retryAmounts());
        Assertions.assertInstanceOf(ExecutionResult.InProcess.class, main.callback(id).executionResult());

        main.chain().advanceSeconds(60);
        main.tick();
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
        main.chain().execute(USER, main.echo(), Map.of("confirm", Map.of("execution_id", id)));

        ExecutionResult.PartiallyExecuted partial = Assertions.assertInstanceOf(ExecutionResult.PartiallyExecuted.class,
                main.callback(id).executionResult());
        Assertions.assertEquals(0L, partial.executedCount());
        Assertions.assertEquals("Invalid callback message received", partial.reason());
        Assertions.assertTrue(main.queue(Priority.MEDIUM).isEmpty());
    }

    @Test
    void onlyTheRegistryMayControlTheQueue() throws Exception {
        MainDomainHarness main = new MainDomainHarness();
        ProcessorError error = Assertions.assertThrows(ProcessorError.class, () -> main.chain().execute(USER,
                main.processor(), new ProcessorMsg.Pause()));
        Assertions.assertEquals(ProcessorError.Reason.UNAUTHORIZED, error.reason());
    }

    @Test
    void executionIdIsAppendedUnderTheTopLevelKey() {
        byte[] out = Processor.withExecutionId("{\"process_function\":{\"a\":1}}".getBytes(StandardCharsets.UTF_8), 7L);
        Assertions.assertEquals("{\"process_function\":{\"a\":1,\"execution_id\":7}}",
                new String(out, StandardCharsets.UTF_8));
    }
}
