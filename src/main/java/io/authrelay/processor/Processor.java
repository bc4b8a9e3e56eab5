package io.authrelay.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.Contract;
import io.authrelay.host.CosmosMsg;
import io.authrelay.host.Item;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Reply;
import io.authrelay.host.Response;
import io.authrelay.host.StateDeque;
import io.authrelay.host.StateMap;
import io.authrelay.host.Storage;
import io.authrelay.host.SubMsg;
import io.authrelay.host.Wire;
import io.authrelay.model.CurrentRetry;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Expiration;
import io.authrelay.model.FunctionCallback;
import io.authrelay.model.LibraryFunction;
import io.authrelay.model.MessageBatch;
import io.authrelay.model.NonAtomicFunction;
import io.authrelay.model.PolytoneCallbackTag;
import io.authrelay.model.PolytoneProxyState;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorConfig;
import io.authrelay.model.ProcessorDomain;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.ProcessorQuery;
import io.authrelay.model.ProcessorState;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RetryLogic;
import io.authrelay.model.Subroutine;
import io.authrelay.routing.BridgeError;
import io.authrelay.routing.DomainRouter;
import io.authrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class Processor implements Contract {
    private static final Logger LOG = LoggerFactory.getLogger(Processor.class);
    static final String INVALID_CALLBACK = "Invalid callback message received";

    static final Item<String> OWNER = Item.of("owner", String.class);
    static final Item<ProcessorConfig> CONFIG = Item.of("config", ProcessorConfig.class);
    static final StateDeque<MessageBatch> HIGH_QUEUE = StateDeque.of("queue_high", MessageBatch.class);
    static final StateDeque<MessageBatch> MEDIUM_QUEUE = StateDeque.of("queue_medium", MessageBatch.class);
    static final Item<Long> NEXT_REPLY_ID = Item.of("next_reply_id", Long.class);
    static final StateMap<Long, PendingOperation> PENDING_OPERATIONS =
            StateMap.of("pending_operations", KeyCodec.U64, PendingOperation.class);
    static final StateMap<Long, PendingCallback> PENDING_CALLBACKS =
            StateMap.of("pending_callbacks", KeyCodec.U64, PendingCallback.class);
    static final StateMap<Long, PendingPolytoneCallback> PENDING_POLYTONE_CALLBACKS =
            StateMap.of("pending_polytone_callbacks", KeyCodec.U64, PendingPolytoneCallback.class);

    private final DomainRouter router;

    public Processor(DomainRouter router) {
        this.router = router;
    }

    public record InstantiateMsg(String owner, String authorizationContract, ProcessorDomain processorDomain) {
    }

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) throws ContractException {
        InstantiateMsg msg = Wire.decode(raw, InstantiateMsg.class);
        Storage storage = ctx.storage();
        OWNER.save(storage, msg.owner() == null || msg.owner().isBlank() ? ctx.sender() : msg.owner());
        ProcessorDomain domain = msg.processorDomain() == null ? new ProcessorDomain.Main() : msg.processorDomain();
        Response response = new Response().addAttribute("method", "instantiate");
        if (domain instanceof ProcessorDomain.Polytone polytone) {
            domain = polytone.withProxyState(PolytoneProxyState.PENDING_RESPONSE);
            response.addMessage(router.createProxy(polytone.note(), polytone.timeoutSeconds(), ctx.self(), null));
        }
        CONFIG.save(storage, new ProcessorConfig(msg.authorizationContract(), domain, ProcessorState.ACTIVE));
        NEXT_REPLY_ID.save(storage, 0L);
        return response.addAttribute("authorization_contract", msg.authorizationContract());
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        ProcessorMsg msg = Wire.decode(raw, ProcessorMsg.class);
        if (msg instanceof ProcessorMsg.OwnerAction action) {
            return ownerAction(ctx, action);
        }
        if (msg instanceof ProcessorMsg.AuthorizationModuleAction action) {
            assertFromAuthorizationModule(ctx);
            return moduleAction(ctx, action);
        }
        if (msg instanceof ProcessorMsg.PermissionlessAction action) {
            return permissionlessAction(ctx, action);
        }
        return internalAction(ctx, (ProcessorMsg.InternalAction) msg);
    }

    private Response ownerAction(ContractContext ctx, ProcessorMsg.OwnerAction action) throws ContractException {
        Storage storage = ctx.storage();
        if (!OWNER.load(storage).equals(ctx.sender())) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED, "not the owner: " + ctx.sender());
        }
        ProcessorMsg.UpdateConfig update = (ProcessorMsg.UpdateConfig) action;
        ProcessorConfig config = CONFIG.load(storage);
        if (update.authorizationContract() != null) {
            config = config.withAuthorizationContract(update.authorizationContract());
        }
        if (update.processorDomain() != null) {
            config = config.withDomain(update.processorDomain());
        }
        CONFIG.save(storage, config);
        return new Response().addAttribute("method", "update_config");
    }

    private void assertFromAuthorizationModule(ContractContext ctx) throws ContractException {
        ProcessorConfig config = CONFIG.load(ctx.storage());
        String expected;
        if (config.processorDomain() instanceof ProcessorDomain.Polytone polytone) {
            expected = polytone.proxy();
        } else if (config.processorDomain() instanceof ProcessorDomain.Hyperlane) {
            expected = null;
        } else {
            expected = config.authorizationContract();
        }
        if (expected == null || !expected.equals(ctx.sender())) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED,
                    "not the authorization contract: " + ctx.sender());
        }
    }

    private Response moduleAction(ContractContext ctx, ProcessorMsg.AuthorizationModuleAction action)
            throws ContractException {
        Storage storage = ctx.storage();
        if (action instanceof ProcessorMsg.EnqueueMsgs enqueue) {
            MessageBatch batch = MessageBatch.queued(enqueue.id(), enqueue.msgs(), enqueue.subroutine(),
                    enqueue.priority(), deadline(ctx, enqueue.subroutine()));
            lane(batch.priority()).pushBack(storage, batch);
            return new Response().addAttribute("method", "enqueue_msgs").addAttribute("execution_id", enqueue.id());
        }
        if (action instanceof ProcessorMsg.InsertMsgs insert) {
            MessageBatch batch = MessageBatch.queued(insert.executionId(), insert.msgs(), insert.subroutine(),
                    insert.priority(), deadline(ctx, insert.subroutine()));
            StateDeque<MessageBatch> lane = lane(batch.priority());
            int length = lane.len(storage);
            if (insert.queuePosition() < 0 || insert.queuePosition() > length) {
                throw new ProcessorError(ProcessorError.Reason.INVALID_QUEUE_POSITION,
                        insert.queuePosition() + " of " + length);
            }
            lane.insertAt(storage, insert.queuePosition(), batch);
            return new Response().addAttribute("method", "insert_msgs")
                    .addAttribute("execution_id", insert.executionId())
                    .addAttribute("queue_position", insert.queuePosition());
        }
        if (action instanceof ProcessorMsg.EvictMsgs evict) {
            return evict(ctx, evict);
        }
        ProcessorConfig config = CONFIG.load(storage);
        boolean pause = action instanceof ProcessorMsg.Pause;
        CONFIG.save(storage, config.withState(pause ? ProcessorState.PAUSED : ProcessorState.ACTIVE));
        LOG.debug("Processor {} {}", ctx.self(), pause ? "paused" : "resumed");
        return new Response().addAttribute("method", pause ? "pause" : "resume");
    }

    private Response evict(ContractContext ctx, ProcessorMsg.EvictMsgs evict) throws ContractException {
        Storage storage = ctx.storage();
        StateDeque<MessageBatch> lane = lane(evict.priority());
        int length = lane.len(storage);
        if (length == 0) {
            throw new ProcessorError(ProcessorError.Reason.EMPTY_QUEUE, String.valueOf(evict.priority()));
        }
        if (evict.queuePosition() < 0 || evict.queuePosition() >= length) {
            throw new ProcessorError(ProcessorError.Reason.INVALID_QUEUE_POSITION, evict.queuePosition() + " of " + length);
        }
        MessageBatch batch = lane.list(storage).get(evict.queuePosition());
        if (!batch.atomic() && batch.started()) {
            throw new ProcessorError(ProcessorError.Reason.BATCH_STARTED, "execution " + batch.id());
        }
        lane.removeAt(storage, evict.queuePosition());
        Response response = new Response().addAttribute("method", "evict_msgs").addAttribute("execution_id", batch.id());
        finish(ctx, batch, new ExecutionResult.RemovedByOwner(), response);
        return response;
    }

    private Response permissionlessAction(ContractContext ctx, ProcessorMsg.PermissionlessAction action)
            throws ContractException {
        if (action instanceof ProcessorMsg.Tick) {
            return tick(ctx);
        }
        Storage storage = ctx.storage();
        ProcessorConfig config = CONFIG.load(storage);
        if (action instanceof ProcessorMsg.RetryCallback retry) {
            PendingPolytoneCallback pending = PENDING_POLYTONE_CALLBACKS.mayLoad(storage, retry.executionId())
                    .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.EXECUTION_NOT_FOUND,
                            Long.toString(retry.executionId())));
            if (pending.status() != PendingPolytoneCallback.Status.TIMED_OUT) {
                throw new ProcessorError(ProcessorError.Reason.CALLBACK_NOT_RETRIABLE, "execution " + retry.executionId());
            }
            PENDING_POLYTONE_CALLBACKS.save(storage, retry.executionId(),
                    pending.withStatus(PendingPolytoneCallback.Status.PENDING, null));
            return new Response()
                    .addAttribute("method", "retry_callback")
                    .addAttribute("execution_id", retry.executionId())
                    .addMessage(router.callbackToRegistry(config.processorDomain(), config.authorizationContract(),
                            ctx.self(), pending.callback()));
        }
        if (!(config.processorDomain() instanceof ProcessorDomain.Polytone polytone)
                || !(polytone.proxyOnMainDomainState() instanceof PolytoneProxyState.TimedOut)) {
            throw new BridgeError(BridgeError.Reason.PROXY_NOT_RETRIABLE, ctx.self());
        }
        CONFIG.save(storage, config.withDomain(polytone.withProxyState(PolytoneProxyState.PENDING_RESPONSE)));
        return new Response()
                .addAttribute("method", "retry_bridge_creation")
                .addMessage(router.createProxy(polytone.note(), polytone.timeoutSeconds(), ctx.self(), null));
    }

    private Response tick(ContractContext ctx) throws ContractException {
        Storage storage = ctx.storage();
        if (CONFIG.load(storage).state() == ProcessorState.PAUSED) {
            throw new ProcessorError(ProcessorError.Reason.PAUSED);
        }
        Response response = new Response().addAttribute("method", "tick");
        sweepExpired(ctx, response);

        StateDeque<MessageBatch> lane = HIGH_QUEUE.isEmpty(storage) ? MEDIUM_QUEUE : HIGH_QUEUE;
        Optional<MessageBatch> next = lane.peekFront(storage);
        if (next.isEmpty()) {
            return response.addAttribute("action", "idle");
        }
        MessageBatch batch = next.get();
        if (batch.retry() != null && !batch.retry().retryCooldown().expired(ctx.block())) {
            return response.addAttribute("action", "cooldown").addAttribute("execution_id", batch.id());
        }
        response.addAttribute("execution_id", batch.id());

        if (batch.atomic()) {
            long replyId = track(storage, new PendingOperation(batch.id(), PendingOperation.Kind.ATOMIC, 0));
            return response.addAttribute("action", "execute_atomic")
                    .addSubMessage(SubMsg.replyAlways(replyId,
                            CosmosMsg.execute(ctx.self(), new ProcessorMsg.ExecuteAtomic(batch.id()))));
        }

        int index = batch.nextFunction();
        NonAtomicFunction function = (NonAtomicFunction) batch.subroutine().functions().get(index);
        ProcessorMessage message = batch.msgs().get(index);
        if (function.callbackConfirmation() != null && message.messageType().cosmwasm()) {
            message = message.withMsg(withExecutionId(message.msg(), batch.id()));
        }
        lane.set(storage, 0, batch.markStarted());
        CosmosMsg dispatch;
        try {
            dispatch = message.toCosmosMsg(function.contractAddress());
        } catch (ContractException e) {
            response.addAttribute("action", "function_failed");
            fail(ctx, batch.markStarted(), index, e.getMessage(), response);
            return response;
        }
        long replyId = track(storage, new PendingOperation(batch.id(), PendingOperation.Kind.NON_ATOMIC_FUNCTION, index));
        return response.addAttribute("action", "execute_function")
                .addAttribute("function_index", index)
                .addSubMessage(SubMsg.replyAlways(replyId, dispatch));
    }

    private void sweepExpired(ContractContext ctx, Response response) throws ContractException {
        Storage storage = ctx.storage();
        for (StateDeque<MessageBatch> lane : List.of(HIGH_QUEUE, MEDIUM_QUEUE)) {
            List<MessageBatch> kept = new ArrayList<>();
            List<MessageBatch> expired = new ArrayList<>();
            for (MessageBatch batch : lane.list(storage)) {
                (batch.expiration().expired(ctx.block()) ? expired : kept).add(batch);
            }
            if (expired.isEmpty()) {
                continue;
            }
            rewrite(storage, lane, kept);
            for (MessageBatch batch : expired) {
                finish(ctx, batch, new ExecutionResult.Expired(batch.executedCount()), response);
            }
        }
        for (PendingCallback parked : PENDING_CALLBACKS.values(storage)) {
            if (parked.batch().expiration().expired(ctx.block())) {
                PENDING_CALLBACKS.remove(storage, parked.batch().id());
                finish(ctx, parked.batch(), new ExecutionResult.Expired(parked.functionIndex()), response);
            }
        }
    }

    private Response internalAction(ContractContext ctx, ProcessorMsg.InternalAction action) throws ContractException {
        if (action instanceof ProcessorMsg.ExecuteAtomic atomic) {
            return executeAtomic(ctx, atomic.executionId());
        }
        if (action instanceof ProcessorMsg.LibraryCallback callback) {
            return libraryCallback(ctx, callback);
        }
        if (action instanceof ProcessorMsg.PolytoneCallback callback) {
            return polytoneCallback(ctx, callback);
        }
        ProcessorMsg.Handle handle = (ProcessorMsg.Handle) action;
        ProcessorConfig config = CONFIG.load(ctx.storage());
        if (!(config.processorDomain() instanceof ProcessorDomain.Hyperlane hyperlane)
                || !hyperlane.mailbox().equals(ctx.sender())
                || hyperlane.mainDomainId() != handle.origin()
                || !config.authorizationContract().equals(handle.sender())) {
            throw new BridgeError(BridgeError.Reason.INVALID_RELAY_ORIGIN,
                    "origin " + handle.origin() + " sender " + handle.sender());
        }
        ProcessorMsg inner = router.encoder().decodeProcessorMsg(handle.body());
        if (!(inner instanceof ProcessorMsg.AuthorizationModuleAction moduleAction)) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED, "only authorization module actions are relayed");
        }
        return moduleAction(ctx, moduleAction);
    }

    private Response executeAtomic(ContractContext ctx, long executionId) throws ContractException {
        if (!ctx.self().equals(ctx.sender())) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED, "execute_atomic is internal");
        }
        Located located = locate(ctx.storage(), executionId)
                .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.EXECUTION_NOT_FOUND, Long.toString(executionId)));
        MessageBatch batch = located.batch();
        List<? extends LibraryFunction> functions = batch.subroutine().functions();
        Response response = new Response().addAttribute("method", "execute_atomic").addAttribute("execution_id", executionId);
        for (int i = 0; i < functions.size(); i++) {
            response.addMessage(batch.msgs().get(i).toCosmosMsg(functions.get(i).contractAddress()));
        }
        return response;
    }

    @Override
    public Response reply(ContractContext ctx, Reply reply) throws ContractException {
        Storage storage = ctx.storage();
        PendingOperation operation = PENDING_OPERATIONS.mayLoad(storage, reply.id())
                .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.UNKNOWN_REPLY_ID, Long.toString(reply.id())));
        PENDING_OPERATIONS.remove(storage, reply.id());
        Located located = locate(storage, operation.executionId())
                .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.EXECUTION_NOT_FOUND,
                        Long.toString(operation.executionId())));
        MessageBatch batch = located.batch();
        Response response = new Response()
                .addAttribute("method", "reply")
                .addAttribute("execution_id", batch.id());

        if (!reply.result().isOk()) {
            fail(ctx, batch, operation.functionIndex(), reply.result().error(), response);
            return response;
        }
        if (operation.kind() == PendingOperation.Kind.ATOMIC) {
            located.lane().removeAt(storage, located.position());
            finish(ctx, batch, new ExecutionResult.Success(), response);
            return response;
        }
        NonAtomicFunction function = (NonAtomicFunction) batch.subroutine().functions().get(operation.functionIndex());
        if (function.callbackConfirmation() != null) {
            located.lane().removeAt(storage, located.position());
            PENDING_CALLBACKS.save(storage, batch.id(),
                    new PendingCallback(batch, operation.functionIndex(), function.callbackConfirmation()));
            return response.addAttribute("awaiting_callback", function.callbackConfirmation().contractAddress());
        }
        advance(ctx, located.lane(), located.position(), batch, operation.functionIndex(), response);
        return response;
    }

    private Response libraryCallback(ContractContext ctx, ProcessorMsg.LibraryCallback callback) throws ContractException {
        Storage storage = ctx.storage();
        PendingCallback parked = PENDING_CALLBACKS.mayLoad(storage, callback.executionId())
                .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.EXECUTION_NOT_FOUND,
                        Long.toString(callback.executionId())));
        FunctionCallback expected = parked.confirmation();
        if (!expected.contractAddress().equals(ctx.sender())) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED, "callback from " + ctx.sender());
        }
        PENDING_CALLBACKS.remove(storage, callback.executionId());
        MessageBatch batch = parked.batch();
        StateDeque<MessageBatch> lane = lane(batch.priority());
        lane.pushFront(storage, batch);
        Response response = new Response()
                .addAttribute("method", "library_callback")
                .addAttribute("execution_id", batch.id());
        if (Arrays.equals(expected.callbackMessage(), callback.msg())) {
            advance(ctx, lane, 0, batch, parked.functionIndex(), response);
        } else {
            fail(ctx, batch, parked.functionIndex(), INVALID_CALLBACK, response);
        }
        return response;
    }

    private Response polytoneCallback(ContractContext ctx, ProcessorMsg.PolytoneCallback callback)
            throws ContractException {
        Storage storage = ctx.storage();
        ProcessorConfig config = CONFIG.load(storage);
        if (!(config.processorDomain() instanceof ProcessorDomain.Polytone polytone)
                || !polytone.note().equals(ctx.sender())
                || !ctx.self().equals(callback.initiator())) {
            throw new ProcessorError(ProcessorError.Reason.UNAUTHORIZED, "callback from " + ctx.sender());
        }
        PolytoneCallbackTag tag = Wire.decode(callback.initiatorMsg(), PolytoneCallbackTag.class);
        Response response = new Response().addAttribute("method", "polytone_callback");
        if (tag instanceof PolytoneCallbackTag.CreateProxy) {
            PolytoneProxyState state;
            if (callback.result().ok()) {
                state = PolytoneProxyState.CREATED;
            } else if (callback.result().timedOut()) {
                state = PolytoneProxyState.TIMED_OUT;
            } else {
                state = new PolytoneProxyState.UnexpectedError(callback.result().errorMessage());
            }
            CONFIG.save(storage, config.withDomain(polytone.withProxyState(state)));
            return response.addAttribute("proxy_state", Wire.encodeToString(state));
        }
        long executionId = ((PolytoneCallbackTag.ExecutionId) tag).executionId();
        Optional<PendingPolytoneCallback> pending = PENDING_POLYTONE_CALLBACKS.mayLoad(storage, executionId);
        response.addAttribute("execution_id", executionId);
        if (pending.isEmpty()) {
            return response.addAttribute("replay", true);
        }
        if (callback.result().ok()) {
            PENDING_POLYTONE_CALLBACKS.remove(storage, executionId);
            return response.addAttribute("relay", "delivered");
        }
        PendingPolytoneCallback.Status status = callback.result().timedOut()
                ? PendingPolytoneCallback.Status.TIMED_OUT
                : PendingPolytoneCallback.Status.FAILED;
        PENDING_POLYTONE_CALLBACKS.save(storage, executionId, pending.get().withStatus(status, callback.result().errorMessage()));
        LOG.warn("Callback for execution {} was not delivered: {}", executionId, callback.result().errorMessage());
        return response.addAttribute("relay", status.name().toLowerCase(Locale.ROOT));
    }

    private void advance(ContractContext ctx, StateDeque<MessageBatch> lane, int position, MessageBatch batch, int index,
                         Response response) throws ContractException {
        int nextIndex = index + 1;
        if (nextIndex >= batch.subroutine().functions().size()) {
            lane.removeAt(ctx.storage(), position);
            finish(ctx, batch.advancedTo(nextIndex), new ExecutionResult.Success(), response);
            return;
        }
        lane.set(ctx.storage(), position, batch.advancedTo(nextIndex));
        response.addAttribute("next_function", nextIndex);
    }

    private void fail(ContractContext ctx, MessageBatch batch, int index, String error, Response response)
            throws ContractException {
        Storage storage = ctx.storage();
        Located located = locate(storage, batch.id())
                .orElseThrow(() -> new ProcessorError(ProcessorError.Reason.EXECUTION_NOT_FOUND, Long.toString(batch.id())));
        long failures = (batch.retry() == null ? 0L : batch.retry().retryAmounts()) + 1L;
        RetryLogic retryLogic = batch.subroutine().retryLogicFor(index);
        response.addAttribute("error", error);
        if (retryLogic == null || retryLogic.times() == null || retryLogic.times().exhaustedAfter(failures)) {
            located.lane().removeAt(storage, located.position());
            ExecutionResult result = batch.atomic()
                    ? new ExecutionResult.Rejected(error)
                    : new ExecutionResult.PartiallyExecuted(index, error);
            finish(ctx, batch, result, response);
            return;
        }
        Expiration cooldown = retryLogic.interval() == null
                ? Expiration.atHeight(ctx.block().height())
                : retryLogic.interval().after(ctx.block());
        located.lane().set(storage, located.position(), batch.withRetry(new CurrentRetry(failures, cooldown)));
        response.addAttribute("retry_amounts", failures);
        LOG.debug("Execution {} function {} failed ({} so far), retrying after {}", batch.id(), index, failures,
                Wire.encodeToString(cooldown));
    }

    private void finish(ContractContext ctx, MessageBatch batch, ExecutionResult result, Response response)
            throws ContractException {
        Storage storage = ctx.storage();
        ProcessorConfig config = CONFIG.load(storage);
        RegistryMsg.ProcessorCallback callback = new RegistryMsg.ProcessorCallback(batch.id(), result);
        response.addMessage(router.callbackToRegistry(config.processorDomain(), config.authorizationContract(),
                ctx.self(), callback));
        if (config.processorDomain() instanceof ProcessorDomain.Polytone) {
            PENDING_POLYTONE_CALLBACKS.save(storage, batch.id(),
                    new PendingPolytoneCallback(callback, PendingPolytoneCallback.Status.PENDING, null));
        }
        response.addAttribute("finished_" + batch.id(), Wire.encodeToString(result));
        LOG.debug("Execution {} finished: {}", batch.id(), Wire.encodeToString(result));
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) throws ContractException {
        ProcessorQuery query = Wire.decode(raw, ProcessorQuery.class);
        Storage storage = ctx.storage();
        if (query instanceof ProcessorQuery.Config) {
            return Wire.encode(CONFIG.load(storage));
        }
        if (query instanceof ProcessorQuery.GetQueue get) {
            return Wire.encode(lane(get.priority()).slice(storage, get.from(), get.to()));
        }
        if (query instanceof ProcessorQuery.IsQueueEmpty) {
            return Wire.encode(HIGH_QUEUE.isEmpty(storage) && MEDIUM_QUEUE.isEmpty(storage));
        }
        if (query instanceof ProcessorQuery.PendingRetry pendingRetry) {
            return Wire.encode(locate(storage, pendingRetry.executionId()).map(l -> l.batch().retry()).orElse(null));
        }
        if (query instanceof ProcessorQuery.PendingCallback pendingCallback) {
            return Wire.encode(PENDING_CALLBACKS.mayLoad(storage, pendingCallback.executionId()).orElse(null));
        }
        ProcessorQuery.PendingPolytoneCallback pending = (ProcessorQuery.PendingPolytoneCallback) query;
        return Wire.encode(PENDING_POLYTONE_CALLBACKS.mayLoad(storage, pending.executionId()).orElse(null));
    }

    private static StateDeque<MessageBatch> lane(Priority priority) {
        return priority == Priority.HIGH ? HIGH_QUEUE : MEDIUM_QUEUE;
    }

    private static Expiration deadline(ContractContext ctx, Subroutine subroutine) {
        Long seconds = subroutine.expirationTime();
        return seconds == null ? Expiration.NEVER : Expiration.atTime(ctx.block().time() + seconds);
    }

    private static long track(Storage storage, PendingOperation operation) {
        long id = NEXT_REPLY_ID.mayLoad(storage).orElse(0L) + 1L;
        NEXT_REPLY_ID.save(storage, id);
        PENDING_OPERATIONS.save(storage, id, operation);
        return id;
    }

    private static Optional<Located> locate(Storage storage, long executionId) {
        for (StateDeque<MessageBatch> lane : List.of(HIGH_QUEUE, MEDIUM_QUEUE)) {
            List<MessageBatch> batches = lane.list(storage);
            for (int i = 0; i < batches.size(); i++) {
                if (batches.get(i).id() == executionId) {
                    return Optional.of(new Located(lane, i, batches.get(i)));
                }
            }
        }
        return Optional.empty();
    }

    private static void rewrite(Storage storage, StateDeque<MessageBatch> lane, List<MessageBatch> batches) {
        while (!lane.isEmpty(storage)) {
            lane.popFront(storage);
        }
        for (MessageBatch batch : batches) {
            lane.pushBack(storage, batch);
        }
    }

    // execution_id goes under the single top-level key so the library can echo it back
    static byte[] withExecutionId(byte[] msg, long executionId) {
        try {
            JsonNode root = Jsons.wire().readTree(msg);
            if (root != null && root.isObject() && root.size() == 1) {
                JsonNode inner = root.elements().next();
                if (inner.isObject()) {
                    ((ObjectNode) inner).put("execution_id", executionId);
                    return Jsons.wire().writeValueAsBytes(root);
                }
            }
            return msg;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to append execution id to message", e);
        }
    }

    private record Located(StateDeque<MessageBatch> lane, int position, MessageBatch batch) {
    }
}
