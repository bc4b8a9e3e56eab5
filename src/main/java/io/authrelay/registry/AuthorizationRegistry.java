package io.authrelay.registry;

import io.authrelay.config.AuthRelayConfig;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.CosmosMsg;
import io.authrelay.host.Contract;
import io.authrelay.host.Item;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Response;
import io.authrelay.host.StateMap;
import io.authrelay.host.Storage;
import io.authrelay.host.Wire;
import io.authrelay.model.Authorization;
import io.authrelay.model.AuthorizationInfo;
import io.authrelay.model.AuthorizationMode;
import io.authrelay.model.AuthorizationState;
import io.authrelay.model.Domain;
import io.authrelay.model.ExecutionResult;
import io.authrelay.model.Expiration;
import io.authrelay.model.ExternalDomain;
import io.authrelay.model.ExternalDomainInfo;
import io.authrelay.model.LibraryFunction;
import io.authrelay.model.Mint;
import io.authrelay.model.PolytoneCallbackTag;
import io.authrelay.model.PolytoneProxyState;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorCallbackInfo;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RegistryQuery;
import io.authrelay.routing.BridgeError;
import io.authrelay.routing.DomainRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

public final class AuthorizationRegistry implements Contract {
    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationRegistry.class);

    static final Item<String> OWNER = Item.of("owner", String.class);
    static final Item<String> PENDING_OWNER = Item.of("pending_owner", String.class);
    static final StateMap<String, Boolean> SUB_OWNERS = StateMap.of("sub_owners", KeyCodec.STRING, Boolean.class);
    static final Item<String> PROCESSOR_ON_MAIN_DOMAIN = Item.of("processor_on_main_domain", String.class);
    static final StateMap<String, ExternalDomain> EXTERNAL_DOMAINS =
            StateMap.of("external_domains", KeyCodec.STRING, ExternalDomain.class);
    static final StateMap<String, Authorization> AUTHORIZATIONS =
            StateMap.of("authorizations", KeyCodec.STRING, Authorization.class);
    static final StateMap<String, Long> CURRENT_EXECUTIONS =
            StateMap.of("current_executions", KeyCodec.STRING, Long.class);
    static final Item<Long> EXECUTION_ID = Item.of("execution_id", Long.class);
    static final StateMap<Long, ProcessorCallbackInfo> PROCESSOR_CALLBACKS =
            StateMap.of("processor_callbacks", KeyCodec.U64, ProcessorCallbackInfo.class);
    static final StateMap<String, Long> PERMISSION_TOKENS =
            StateMap.of("permission_tokens", KeyCodec.STRING, Long.class);

    private final DomainRouter router;

    public AuthorizationRegistry(DomainRouter router) {
        this.router = router;
    }

    public record InstantiateMsg(
            String owner,
            List<String> subOwners,
            String processor,
            List<ExternalDomainInfo> externalDomains
    ) {
        public InstantiateMsg {
            subOwners = subOwners == null ? List.of() : List.copyOf(subOwners);
            externalDomains = externalDomains == null ? List.of() : List.copyOf(externalDomains);
        }
    }

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) throws ContractException {
        InstantiateMsg msg = Wire.decode(raw, InstantiateMsg.class);
        Storage storage = ctx.storage();
        OWNER.save(storage, msg.owner() == null || msg.owner().isBlank() ? ctx.sender() : msg.owner());
        for (String subOwner : msg.subOwners()) {
            SUB_OWNERS.save(storage, subOwner, Boolean.TRUE);
        }
        PROCESSOR_ON_MAIN_DOMAIN.save(storage, msg.processor());
        EXECUTION_ID.save(storage, 0L);
        Response response = new Response()
                .addAttribute("method", "instantiate")
                .addAttribute("processor", msg.processor());
        addExternalDomains(ctx, msg.externalDomains(), response);
        return response;
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        RegistryMsg msg = Wire.decode(raw, RegistryMsg.class);
        if (msg instanceof RegistryMsg.OwnershipAction action) {
            return ownership(ctx, action);
        }
        if (msg instanceof RegistryMsg.OwnerAction action) {
            assertOwner(ctx);
            return ownerAction(ctx, action);
        }
        if (msg instanceof RegistryMsg.PermissionedAction action) {
            assertOwnerOrSubOwner(ctx);
            return permissionedAction(ctx, action);
        }
        if (msg instanceof RegistryMsg.PermissionlessAction action) {
            return permissionlessAction(ctx, action);
        }
        return internalAction(ctx, (RegistryMsg.InternalAction) msg);
    }

    private Response ownership(ContractContext ctx, RegistryMsg.OwnershipAction action) throws ContractException {
        Storage storage = ctx.storage();
        if (action instanceof RegistryMsg.TransferOwnership transfer) {
            assertOwner(ctx);
            if (transfer.newOwner() == null || transfer.newOwner().isBlank()) {
                throw new AuthorizationError(AuthorizationError.Reason.OWNERSHIP, "new owner must not be blank");
            }
            PENDING_OWNER.save(storage, transfer.newOwner());
            return new Response().addAttribute("method", "transfer_ownership")
                    .addAttribute("pending_owner", transfer.newOwner());
        }
        if (action instanceof RegistryMsg.AcceptOwnership) {
            Optional<String> pending = PENDING_OWNER.mayLoad(storage);
            if (pending.isEmpty() || !pending.get().equals(ctx.sender())) {
                throw new AuthorizationError(AuthorizationError.Reason.OWNERSHIP, "no transfer pending for " + ctx.sender());
            }
            OWNER.save(storage, ctx.sender());
            PENDING_OWNER.remove(storage);
            return new Response().addAttribute("method", "accept_ownership").addAttribute("owner", ctx.sender());
        }
        assertOwner(ctx);
        OWNER.remove(storage);
        PENDING_OWNER.remove(storage);
        return new Response().addAttribute("method", "renounce_ownership");
    }

    private Response ownerAction(ContractContext ctx, RegistryMsg.OwnerAction action) {
        if (action instanceof RegistryMsg.AddSubOwner add) {
            SUB_OWNERS.save(ctx.storage(), add.subOwner(), Boolean.TRUE);
            return new Response().addAttribute("method", "add_sub_owner").addAttribute("sub_owner", add.subOwner());
        }
        RegistryMsg.RemoveSubOwner remove = (RegistryMsg.RemoveSubOwner) action;
        SUB_OWNERS.remove(ctx.storage(), remove.subOwner());
        return new Response().addAttribute("method", "remove_sub_owner").addAttribute("sub_owner", remove.subOwner());
    }

    private Response permissionedAction(ContractContext ctx, RegistryMsg.PermissionedAction action)
            throws ContractException {
        Storage storage = ctx.storage();
        if (action instanceof RegistryMsg.AddExternalDomains add) {
            Response response = new Response().addAttribute("method", "add_external_domains");
            addExternalDomains(ctx, add.externalDomains(), response);
            return response;
        }
        if (action instanceof RegistryMsg.CreateAuthorizations create) {
            return createAuthorizations(ctx, create.authorizations());
        }
        if (action instanceof RegistryMsg.ModifyAuthorization modify) {
            Authorization current = loadAuthorization(storage, modify.label());
            Authorization next = current.modified(modify.notBefore(), modify.expiration(),
                    modify.maxConcurrentExecutions(), modify.priority());
            checkPolicy(next);
            AUTHORIZATIONS.save(storage, next.label(), next);
            return new Response().addAttribute("method", "modify_authorization").addAttribute("label", next.label());
        }
        if (action instanceof RegistryMsg.DisableAuthorization disable) {
            Authorization current = loadAuthorization(storage, disable.label());
            AUTHORIZATIONS.save(storage, current.label(), current.withState(AuthorizationState.DISABLED));
            return new Response().addAttribute("method", "disable_authorization").addAttribute("label", current.label());
        }
        if (action instanceof RegistryMsg.EnableAuthorization enable) {
            Authorization current = loadAuthorization(storage, enable.label());
            AUTHORIZATIONS.save(storage, current.label(), current.withState(AuthorizationState.ENABLED));
            return new Response().addAttribute("method", "enable_authorization").addAttribute("label", current.label());
        }
        if (action instanceof RegistryMsg.MintAuthorizations mint) {
            Authorization current = loadAuthorization(storage, mint.label());
            if (current.permissionless()) {
                throw new AuthorizationError(AuthorizationError.Reason.CANNOT_MINT_FOR_PERMISSIONLESS, mint.label());
            }
            for (Mint each : mint.mints()) {
                if (each.amount() <= 0) {
                    continue;
                }
                addTokens(storage, mint.label(), each.address(), each.amount());
            }
            return new Response().addAttribute("method", "mint_authorizations").addAttribute("label", mint.label());
        }
        if (action instanceof RegistryMsg.EvictMsgs evict) {
            Response response = new Response().addAttribute("method", "evict_msgs")
                    .addAttribute("domain", evict.domain());
            response.addMessage(routeControl(ctx, evict.domain(),
                    new ProcessorMsg.EvictMsgs(evict.queuePosition(), priorityOrDefault(evict.priority()))));
            return response;
        }
        if (action instanceof RegistryMsg.InsertMsgs insert) {
            return insertMsgs(ctx, insert);
        }
        if (action instanceof RegistryMsg.PauseProcessor pause) {
            return new Response().addAttribute("method", "pause_processor").addAttribute("domain", pause.domain())
                    .addMessage(routeControl(ctx, pause.domain(), new ProcessorMsg.Pause()));
        }
        RegistryMsg.ResumeProcessor resume = (RegistryMsg.ResumeProcessor) action;
        return new Response().addAttribute("method", "resume_processor").addAttribute("domain", resume.domain())
                .addMessage(routeControl(ctx, resume.domain(), new ProcessorMsg.Resume()));
    }

    private Response permissionlessAction(ContractContext ctx, RegistryMsg.PermissionlessAction action)
            throws ContractException {
        if (action instanceof RegistryMsg.SendMsgs send) {
            return sendMsgs(ctx, send);
        }
        if (action instanceof RegistryMsg.RetryMsgs retry) {
            return retryMsgs(ctx, retry.executionId());
        }
        RegistryMsg.RetryBridgeCreation retry = (RegistryMsg.RetryBridgeCreation) action;
        Storage storage = ctx.storage();
        ExternalDomain domain = EXTERNAL_DOMAINS.mayLoad(storage, retry.domainName())
                .orElseThrow(() -> new AuthorizationError(AuthorizationError.Reason.DOMAIN_NOT_REGISTERED,
                        retry.domainName()));
        if (!(domain.executionEnvironment() instanceof ExternalDomain.Cosmwasm cosmwasm)
                || !(cosmwasm.polytone().polytoneNote().state() instanceof PolytoneProxyState.TimedOut)) {
            throw new BridgeError(BridgeError.Reason.PROXY_NOT_RETRIABLE, retry.domainName());
        }
        ExternalDomain.PolytoneNote note = cosmwasm.polytone().polytoneNote();
        EXTERNAL_DOMAINS.save(storage, domain.name(), domain.withProxyState(PolytoneProxyState.PENDING_RESPONSE));
        return new Response()
                .addAttribute("method", "retry_bridge_creation")
                .addAttribute("domain", domain.name())
                .addMessage(router.createProxy(note.address(), note.timeoutSeconds(), ctx.self(), domain.name()));
    }

    private Response internalAction(ContractContext ctx, RegistryMsg.InternalAction action) throws ContractException {
        if (action instanceof RegistryMsg.ProcessorCallback callback) {
            return processorCallback(ctx, callback, ctx.sender());
        }
        if (action instanceof RegistryMsg.PolytoneCallback callback) {
            return polytoneCallback(ctx, callback);
        }
        RegistryMsg.Handle handle = (RegistryMsg.Handle) action;
        ExternalDomain domain = findDomain(ctx.storage(), d -> d.executionEnvironment() instanceof ExternalDomain.Evm evm
                && evm.hyperlane().mailbox().equals(ctx.sender())
                && evm.hyperlane().domainId() == handle.origin())
                .orElseThrow(() -> new BridgeError(BridgeError.Reason.INVALID_RELAY_ORIGIN,
                        "mailbox " + ctx.sender() + " origin " + handle.origin()));
        if (!domain.processor().equals(handle.sender())) {
            throw new BridgeError(BridgeError.Reason.INVALID_RELAY_ORIGIN, "sender " + handle.sender());
        }
        RegistryMsg.ProcessorCallback callback = router.encoder().decodeCallback(handle.body());
        return processorCallback(ctx, callback, ctx.sender());
    }

    private void addExternalDomains(ContractContext ctx, List<ExternalDomainInfo> infos, Response response)
            throws ContractException {
        Storage storage = ctx.storage();
        for (ExternalDomainInfo info : infos) {
            if (info.name() == null || info.name().isBlank()) {
                throw new AuthorizationError(AuthorizationError.Reason.DOMAIN_NOT_REGISTERED, "blank domain name");
            }
            if (EXTERNAL_DOMAINS.has(storage, info.name())) {
                throw new AuthorizationError(AuthorizationError.Reason.DOMAIN_ALREADY_REGISTERED, info.name());
            }
            ExternalDomain domain = info.toExternalDomain();
            EXTERNAL_DOMAINS.save(storage, domain.name(), domain);
            if (domain.executionEnvironment() instanceof ExternalDomain.Cosmwasm cosmwasm) {
                ExternalDomain.PolytoneNote note = cosmwasm.polytone().polytoneNote();
                response.addMessage(router.createProxy(note.address(), note.timeoutSeconds(), ctx.self(), domain.name()));
            }
            response.addAttribute("domain_added", domain.name());
        }
    }

    private Response createAuthorizations(ContractContext ctx, List<AuthorizationInfo> infos)
            throws ContractException {
        Storage storage = ctx.storage();
        Response response = new Response().addAttribute("method", "create_authorizations");
        List<String> labels = new ArrayList<>();
        for (AuthorizationInfo info : infos) {
            Authorization authorization = info.toAuthorization(ctx.block());
            validateNew(storage, authorization);
            AUTHORIZATIONS.save(storage, authorization.label(), authorization);
            if (authorization.mode() instanceof AuthorizationMode.Permissioned permissioned) {
                for (Map.Entry<String, Long> tokens : permissioned.permissionType().initialTokens().entrySet()) {
                    addTokens(storage, authorization.label(), tokens.getKey(), tokens.getValue());
                }
            }
            labels.add(authorization.label());
        }
        LOG.debug("Created authorizations {}", labels);
        return response.addAttribute("labels", String.join(",", labels));
    }

    private void validateNew(Storage storage, Authorization authorization) throws AuthorizationError {
        if (authorization.label() == null || authorization.label().isEmpty()) {
            throw new AuthorizationError(AuthorizationError.Reason.EMPTY_LABEL);
        }
        if (AUTHORIZATIONS.has(storage, authorization.label())) {
            throw new AuthorizationError(AuthorizationError.Reason.LABEL_ALREADY_EXISTS, authorization.label());
        }
        if (authorization.subroutine() == null || authorization.subroutine().functions().isEmpty()) {
            throw new AuthorizationError(AuthorizationError.Reason.NO_FUNCTIONS, authorization.label());
        }
        Domain domain = authorization.subroutine().domain();
        if (!domain.main() && !EXTERNAL_DOMAINS.has(storage, domain.externalName())) {
            throw new AuthorizationError(AuthorizationError.Reason.DOMAIN_NOT_REGISTERED, domain.externalName());
        }
        for (LibraryFunction function : authorization.subroutine().functions()) {
            if (!domain.equals(function.domain())) {
                throw new AuthorizationError(AuthorizationError.Reason.DIFFERENT_FUNCTION_DOMAINS, authorization.label());
            }
        }
        checkPolicy(authorization);
    }

    private void checkPolicy(Authorization authorization) throws AuthorizationError {
        if (authorization.permissionless() && authorization.priority() == Priority.HIGH) {
            throw new AuthorizationError(AuthorizationError.Reason.PERMISSIONLESS_WITH_HIGH_PRIORITY, authorization.label());
        }
        if (authorization.maxConcurrentExecutions() < 1) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_CONCURRENCY_LIMIT, authorization.label());
        }
    }

    private Response sendMsgs(ContractContext ctx, RegistryMsg.SendMsgs send) throws ContractException {
        Storage storage = ctx.storage();
        Authorization authorization = loadAuthorization(storage, send.label());
        if (authorization.state() == AuthorizationState.DISABLED) {
            throw new AuthorizationError(AuthorizationError.Reason.AUTHORIZATION_DISABLED, send.label());
        }
        Expiration notBefore = authorization.notBefore();
        if (notBefore.kind() != Expiration.Kind.NEVER && !notBefore.expired(ctx.block())) {
            throw new AuthorizationError(AuthorizationError.Reason.NOT_YET_VALID, send.label());
        }
        if (authorization.expiration().expired(ctx.block())) {
            throw new AuthorizationError(AuthorizationError.Reason.EXPIRED, send.label());
        }
        boolean escrowed = false;
        if (authorization.mode() instanceof AuthorizationMode.Permissioned permissioned) {
            long balance = tokens(storage, send.label(), ctx.sender());
            if (balance < 1) {
                throw new AuthorizationError(AuthorizationError.Reason.NO_PERMISSION_TOKEN, ctx.sender());
            }
            if (permissioned.permissionType() instanceof AuthorizationMode.PermissionType.WithCallLimit) {
                setTokens(storage, send.label(), ctx.sender(), balance - 1);
                escrowed = true;
            }
        }
        long inFlight = CURRENT_EXECUTIONS.mayLoad(storage, send.label()).orElse(0L);
        if (inFlight >= authorization.maxConcurrentExecutions()) {
            throw new AuthorizationError(AuthorizationError.Reason.MAX_CONCURRENT_EXECUTIONS_REACHED, send.label());
        }
        MessageValidator.validate(authorization.subroutine(), send.messages());

        long executionId = nextExecutionId(storage);
        ProcessorMsg enqueue = new ProcessorMsg.EnqueueMsgs(executionId, send.messages(),
                authorization.subroutine(), authorization.priority());
        Routed routed = routeExecution(ctx, authorization.subroutine().domain(), enqueue, executionId);
        CURRENT_EXECUTIONS.save(storage, send.label(), inFlight + 1);
        PROCESSOR_CALLBACKS.save(storage, executionId, new ProcessorCallbackInfo(
                executionId,
                routed.callbackAddress(),
                authorization.subroutine().domain(),
                send.label(),
                send.messages(),
                send.ttl(),
                new ExecutionResult.InProcess(),
                ctx.sender(),
                escrowed,
                ctx.block().time()
        ));
        LOG.debug("Execution {} accepted for {} from {}", executionId, send.label(), ctx.sender());
        return new Response()
                .addAttribute("method", "send_msgs")
                .addAttribute("label", send.label())
                .addAttribute("execution_id", executionId)
                .addMessage(routed.msg());
    }

    private Response insertMsgs(ContractContext ctx, RegistryMsg.InsertMsgs insert) throws ContractException {
        Storage storage = ctx.storage();
        Authorization authorization = loadAuthorization(storage, insert.label());
        MessageValidator.validate(authorization.subroutine(), insert.messages());
        long executionId = nextExecutionId(storage);
        ProcessorMsg msg = new ProcessorMsg.InsertMsgs(executionId, insert.queuePosition(),
                priorityOrDefault(insert.priority()), insert.messages(), authorization.subroutine());
        Routed routed = routeExecution(ctx, authorization.subroutine().domain(), msg, executionId);
        long inFlight = CURRENT_EXECUTIONS.mayLoad(storage, insert.label()).orElse(0L);
        CURRENT_EXECUTIONS.save(storage, insert.label(), inFlight + 1);
        PROCESSOR_CALLBACKS.save(storage, executionId, new ProcessorCallbackInfo(
                executionId,
                routed.callbackAddress(),
                authorization.subroutine().domain(),
                insert.label(),
                insert.messages(),
                null,
                new ExecutionResult.InProcess(),
                ctx.sender(),
                false,
                ctx.block().time()
        ));
        return new Response()
                .addAttribute("method", "insert_msgs")
                .addAttribute("label", insert.label())
                .addAttribute("execution_id", executionId)
                .addMessage(routed.msg());
    }

    private Response retryMsgs(ContractContext ctx, long executionId) throws ContractException {
        Storage storage = ctx.storage();
        ProcessorCallbackInfo info = loadCallback(storage, executionId);
        if (!(info.executionResult() instanceof ExecutionResult.Timeout timeout) || !timeout.retriable()
                || info.ttl().expired(ctx.block())) {
            throw new AuthorizationError(AuthorizationError.Reason.NOT_RETRIABLE, "execution " + executionId);
        }
        Authorization authorization = loadAuthorization(storage, info.label());
        ProcessorMsg enqueue = new ProcessorMsg.EnqueueMsgs(executionId, info.messages(),
                authorization.subroutine(), authorization.priority());
        Routed routed = routeExecution(ctx, info.domain(), enqueue, executionId);
        PROCESSOR_CALLBACKS.save(storage, executionId, info.withResult(new ExecutionResult.InProcess()));
        return new Response()
                .addAttribute("method", "retry_msgs")
                .addAttribute("execution_id", executionId)
                .addMessage(routed.msg());
    }

    private Response processorCallback(ContractContext ctx, RegistryMsg.ProcessorCallback callback, String origin)
            throws ContractException {
        Storage storage = ctx.storage();
        ProcessorCallbackInfo info = loadCallback(storage, callback.executionId());
        if (!info.processorCallbackAddress().equals(origin)) {
            throw new AuthorizationError(AuthorizationError.Reason.UNAUTHORIZED,
                    "callback for " + callback.executionId() + " from " + origin);
        }
        Response response = new Response()
                .addAttribute("method", "processor_callback")
                .addAttribute("execution_id", callback.executionId());
        if (!info.executionResult().open()) {
            LOG.debug("Ignoring replayed callback for execution {}", callback.executionId());
            return response.addAttribute("replay", true);
        }
        settle(storage, info, callback.executionResult());
        return response.addAttribute("result", Wire.encodeToString(callback.executionResult()));
    }

    private Response polytoneCallback(ContractContext ctx, RegistryMsg.PolytoneCallback callback)
            throws ContractException {
        Storage storage = ctx.storage();
        if (!ctx.self().equals(callback.initiator())) {
            throw new AuthorizationError(AuthorizationError.Reason.UNAUTHORIZED, "initiator " + callback.initiator());
        }
        ExternalDomain source = findDomain(storage, d -> d.executionEnvironment() instanceof ExternalDomain.Cosmwasm c
                && c.polytone().polytoneNote().address().equals(ctx.sender()))
                .orElseThrow(() -> new AuthorizationError(AuthorizationError.Reason.UNAUTHORIZED,
                        "callback from " + ctx.sender()));
        PolytoneCallbackTag tag = Wire.decode(callback.initiatorMsg(), PolytoneCallbackTag.class);
        Response response = new Response().addAttribute("method", "polytone_callback");

        if (tag instanceof PolytoneCallbackTag.CreateProxy create) {
            ExternalDomain domain = create.domainName() == null ? source
                    : EXTERNAL_DOMAINS.load(storage, create.domainName());
            PolytoneProxyState state;
            if (callback.result().ok()) {
                state = PolytoneProxyState.CREATED;
            } else if (callback.result().timedOut()) {
                state = PolytoneProxyState.TIMED_OUT;
            } else {
                state = new PolytoneProxyState.UnexpectedError(callback.result().errorMessage());
            }
            EXTERNAL_DOMAINS.save(storage, domain.name(), domain.withProxyState(state));
            LOG.debug("Proxy for domain {} is now {}", domain.name(), state);
            return response.addAttribute("domain", domain.name()).addAttribute("proxy_state", Wire.encodeToString(state));
        }

        long executionId = ((PolytoneCallbackTag.ExecutionId) tag).executionId();
        response.addAttribute("execution_id", executionId);
        if (callback.result().ok()) {
            return response.addAttribute("relay", "delivered");
        }
        ProcessorCallbackInfo info = loadCallback(storage, executionId);
        if (!(info.executionResult() instanceof ExecutionResult.InProcess)) {
            return response.addAttribute("replay", true);
        }
        ExecutionResult result = callback.result().timedOut()
                ? new ExecutionResult.Timeout(!info.ttl().expired(ctx.block()))
                : new ExecutionResult.UnexpectedError(callback.result().errorMessage());
        settle(storage, info, result);
        return response.addAttribute("relay", Wire.encodeToString(result));
    }

    private void settle(Storage storage, ProcessorCallbackInfo info, ExecutionResult result) {
        PROCESSOR_CALLBACKS.save(storage, info.executionId(), info.withResult(result));
        if (result.open()) {
            return;
        }
        long inFlight = CURRENT_EXECUTIONS.mayLoad(storage, info.label()).orElse(0L);
        CURRENT_EXECUTIONS.save(storage, info.label(), Math.max(0L, inFlight - 1));
        if (info.escrowedToken() && !result.consumesToken()) {
            addTokens(storage, info.label(), info.initiator(), 1L);
        }
    }

    private Routed routeExecution(ContractContext ctx, Domain domain, ProcessorMsg msg, long executionId)
            throws ContractException {
        Storage storage = ctx.storage();
        if (domain.main()) {
            String processor = PROCESSOR_ON_MAIN_DOMAIN.load(storage);
            return new Routed(router.toMainProcessor(processor, msg), processor);
        }
        ExternalDomain external = loadDomain(storage, domain.externalName());
        CosmosMsg routed = router.toExternalProcessor(external, ctx.self(), msg,
                new PolytoneCallbackTag.ExecutionId(executionId));
        String callbackAddress = external.executionEnvironment() instanceof ExternalDomain.Cosmwasm cosmwasm
                ? cosmwasm.polytone().polytoneProxy()
                : ((ExternalDomain.Evm) external.executionEnvironment()).hyperlane().mailbox();
        return new Routed(routed, callbackAddress);
    }

    private CosmosMsg routeControl(ContractContext ctx, Domain domain, ProcessorMsg msg) throws ContractException {
        if (domain == null || domain.main()) {
            return router.toMainProcessor(PROCESSOR_ON_MAIN_DOMAIN.load(ctx.storage()), msg);
        }
        return router.toExternalProcessor(loadDomain(ctx.storage(), domain.externalName()), ctx.self(), msg, null);
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) throws ContractException {
        RegistryQuery query = Wire.decode(raw, RegistryQuery.class);
        Storage storage = ctx.storage();
        if (query instanceof RegistryQuery.Ownership) {
            return Wire.encode(new RegistryQuery.OwnershipInfo(OWNER.mayLoad(storage).orElse(null),
                    PENDING_OWNER.mayLoad(storage).orElse(null)));
        }
        if (query instanceof RegistryQuery.SubOwners) {
            List<String> subOwners = new ArrayList<>();
            for (Map.Entry<String, Boolean> entry : SUB_OWNERS.entries(storage)) {
                subOwners.add(entry.getKey());
            }
            return Wire.encode(subOwners);
        }
        if (query instanceof RegistryQuery.Processor) {
            return Wire.encode(PROCESSOR_ON_MAIN_DOMAIN.load(storage));
        }
        if (query instanceof RegistryQuery.ExternalDomains page) {
            return Wire.encode(values(EXTERNAL_DOMAINS.range(storage, page.startAfter(), limit(page.limit()))));
        }
        if (query instanceof RegistryQuery.ExternalDomainByName byName) {
            return Wire.encode(loadDomain(storage, byName.name()));
        }
        if (query instanceof RegistryQuery.Authorizations page) {
            return Wire.encode(values(AUTHORIZATIONS.range(storage, page.startAfter(), limit(page.limit()))));
        }
        if (query instanceof RegistryQuery.ProcessorCallbacks page) {
            return Wire.encode(values(PROCESSOR_CALLBACKS.range(storage, page.startAfter(), limit(page.limit()))));
        }
        if (query instanceof RegistryQuery.ProcessorCallback single) {
            return Wire.encode(loadCallback(storage, single.executionId()));
        }
        if (query instanceof RegistryQuery.PermissionTokens tokens) {
            return Wire.encode(tokens(storage, tokens.label(), tokens.address()));
        }
        RegistryQuery.CurrentExecutions current = (RegistryQuery.CurrentExecutions) query;
        return Wire.encode(CURRENT_EXECUTIONS.mayLoad(storage, current.label()).orElse(0L));
    }

    private void assertOwner(ContractContext ctx) throws AuthorizationError {
        Optional<String> owner = OWNER.mayLoad(ctx.storage());
        if (owner.isEmpty() || !owner.get().equals(ctx.sender())) {
            throw new AuthorizationError(AuthorizationError.Reason.UNAUTHORIZED, "not the owner: " + ctx.sender());
        }
    }

    private void assertOwnerOrSubOwner(ContractContext ctx) throws AuthorizationError {
        Optional<String> owner = OWNER.mayLoad(ctx.storage());
        boolean isOwner = owner.isPresent() && owner.get().equals(ctx.sender());
        if (!isOwner && !SUB_OWNERS.has(ctx.storage(), ctx.sender())) {
            throw new AuthorizationError(AuthorizationError.Reason.UNAUTHORIZED,
                    "not the owner or a sub-owner: " + ctx.sender());
        }
    }

    private static Authorization loadAuthorization(Storage storage, String label) throws AuthorizationError {
        return AUTHORIZATIONS.mayLoad(storage, label)
                .orElseThrow(() -> new AuthorizationError(AuthorizationError.Reason.AUTHORIZATION_DOES_NOT_EXIST, label));
    }

    private static ExternalDomain loadDomain(Storage storage, String name) throws AuthorizationError {
        return EXTERNAL_DOMAINS.mayLoad(storage, name)
                .orElseThrow(() -> new AuthorizationError(AuthorizationError.Reason.DOMAIN_NOT_REGISTERED, name));
    }

    private static ProcessorCallbackInfo loadCallback(Storage storage, long executionId) throws AuthorizationError {
        return PROCESSOR_CALLBACKS.mayLoad(storage, executionId)
                .orElseThrow(() -> new AuthorizationError(AuthorizationError.Reason.EXECUTION_NOT_FOUND,
                        Long.toString(executionId)));
    }

    private static Optional<ExternalDomain> findDomain(Storage storage, Predicate<ExternalDomain> match) {
        for (ExternalDomain domain : EXTERNAL_DOMAINS.values(storage)) {
            if (match.test(domain)) {
                return Optional.of(domain);
            }
        }
        return Optional.empty();
    }

    private static long nextExecutionId(Storage storage) {
        long next = EXECUTION_ID.mayLoad(storage).orElse(0L) + 1L;
        EXECUTION_ID.save(storage, next);
        return next;
    }

    private static String tokenKey(String label, String address) {
        return label + "/" + address;
    }

    private static long tokens(Storage storage, String label, String address) {
        return PERMISSION_TOKENS.mayLoad(storage, tokenKey(label, address)).orElse(0L);
    }

    private static void setTokens(Storage storage, String label, String address, long amount) {
        PERMISSION_TOKENS.save(storage, tokenKey(label, address), amount);
    }

    private static void addTokens(Storage storage, String label, String address, long amount) {
        setTokens(storage, label, address, tokens(storage, label, address) + amount);
    }

    private static Priority priorityOrDefault(Priority priority) {
        return priority == null ? Priority.MEDIUM : priority;
    }

    private static int limit(Integer requested) {
        int value = requested == null ? AuthRelayConfig.DEFAULT_PAGE_LIMIT : requested;
        return Math.max(0, Math.min(value, AuthRelayConfig.MAX_PAGE_LIMIT));
    }

    private static <K, V> List<V> values(List<Map.Entry<K, V>> entries) {
        List<V> out = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> entry : entries) {
            out.add(entry.getValue());
        }
        return out;
    }

    private record Routed(CosmosMsg msg, String callbackAddress) {
    }
}
