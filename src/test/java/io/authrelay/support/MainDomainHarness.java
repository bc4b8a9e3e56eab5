package io.authrelay.support;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.host.ContractException;
import io.authrelay.host.InMemoryStateBackend;
import io.authrelay.host.LocalChain;
import io.authrelay.host.TxResult;
import io.authrelay.library.EchoLibrary;
import io.authrelay.library.FailLibrary;
import io.authrelay.library.LedgerLibrary;
import io.authrelay.model.AtomicFunction;
import io.authrelay.model.AuthorizationInfo;
import io.authrelay.model.AuthorizationMode;
import io.authrelay.model.Domain;
import io.authrelay.model.FunctionCallback;
import io.authrelay.model.Message;
import io.authrelay.model.MessageBatch;
import io.authrelay.model.MessageDetails;
import io.authrelay.model.MessageType;
import io.authrelay.model.NonAtomicFunction;
import io.authrelay.model.ParamRestriction;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorCallbackInfo;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.ProcessorQuery;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RegistryQuery;
import io.authrelay.model.RetryLogic;
import io.authrelay.model.Subroutine;
import io.authrelay.processor.Processor;
import io.authrelay.registry.AuthorizationRegistry;
import io.authrelay.routing.DomainRouter;
import io.authrelay.routing.JsonMessageEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Main domain with a registry, its processor and the built-in libraries on an in-memory chain.
 * The ledger starts with {@code alice: 100}.
 */
public final class MainDomainHarness {
    public static final String OWNER = "owner";
    public static final String SUB_OWNER = "sub-owner";
    public static final String USER = "user";
    public static final String KEEPER = "keeper";

    private final LocalChain chain;
    private final String registry;
    private final String processor;
    private final String echo;
    private final String fail;
    private final String ledger;

    public MainDomainHarness() throws ContractException {
        DomainRouter router = new DomainRouter(new JsonMessageEncoder());
        chain = new LocalChain("neutron-test", "neutron", new InMemoryStateBackend());
        long registryCode = chain.storeCode(new AuthorizationRegistry(router));
        long processorCode = chain.storeCode(new Processor(router));
        long echoCode = chain.storeCode(new EchoLibrary());
        long failCode = chain.storeCode(new FailLibrary());
        long ledgerCode = chain.storeCode(new LedgerLibrary());

        registry = chain.predictAddress(OWNER, "authorization");
        processor = chain.instantiate2(OWNER, processorCode,
                new Processor.InstantiateMsg(OWNER, registry, null), "processor", OWNER, "processor");
        echo = chain.instantiate2(OWNER, echoCode, Map.of("processor", processor), "echo", OWNER, "library-echo");
        fail = chain.instantiate2(OWNER, failCode, Map.of("processor", processor), "fail", OWNER, "library-fail");
        ledger = chain.instantiate2(OWNER, ledgerCode,
                Map.of("processor", processor, "balances", Map.of("alice", 100L)), "ledger", OWNER, "library-ledger");
        chain.instantiate2(OWNER, registryCode,
                new AuthorizationRegistry.InstantiateMsg(OWNER, List.of(SUB_OWNER), processor, List.of()),
                "authorization", OWNER, "authorization");
    }

    public LocalChain chain() {
        return chain;
    }

    public String registry() {
        return registry;
    }

    public String processor() {
        return processor;
    }

    public String echo() {
        return echo;
    }

    public String fail() {
        return fail;
    }

    public String ledger() {
        return ledger;
    }

    public TxResult create(AuthorizationInfo... infos) throws ContractException {
        return chain.execute(OWNER, registry, new RegistryMsg.CreateAuthorizations(Arrays.asList(infos)));
    }

    public TxResult send(String sender, String label, ProcessorMessage... messages) throws ContractException {
        return chain.execute(sender, registry, new RegistryMsg.SendMsgs(label, Arrays.asList(messages), null));
    }

    public TxResult tick() throws ContractException {
        return chain.execute(KEEPER, processor, new ProcessorMsg.Tick());
    }

    public ProcessorCallbackInfo callback(long executionId) throws ContractException {
        return chain.query(registry, new RegistryQuery.ProcessorCallback(executionId), ProcessorCallbackInfo.class);
    }

    public long currentExecutions(String label) throws ContractException {
        return chain.query(registry, new RegistryQuery.CurrentExecutions(label), Long.class);
    }

    public long tokens(String label, String address) throws ContractException {
        return chain.query(registry, new RegistryQuery.PermissionTokens(label, address), Long.class);
    }

    public List<MessageBatch> queue(Priority priority) throws ContractException {
        return chain.query(processor, new ProcessorQuery.GetQueue(null, null, priority),
                new TypeReference<List<MessageBatch>>() {
                });
    }

    public Map<String, Long> balances() throws ContractException {
        return chain.query(ledger, Map.of("balances", Map.of()), new TypeReference<Map<String, Long>>() {
        });
    }

    public static long executionId(TxResult result) {
        return Long.parseLong(result.attributes("execution_id").get(0));
    }

    public static ProcessorMessage execute(String json) {
        return new ProcessorMessage.CosmwasmExecuteMsg(json.getBytes(StandardCharsets.UTF_8));
    }

    public static AuthorizationInfo permissionless(String label, Subroutine subroutine) {
        return new AuthorizationInfo(label, new AuthorizationMode.Permissionless(), null, null, null, subroutine,
                Priority.MEDIUM);
    }

    public static AuthorizationInfo withCallLimit(String label, Subroutine subroutine, Map<String, Long> limits,
                                                  Priority priority) {
        return new AuthorizationInfo(label, new AuthorizationMode.Permissioned(
                new AuthorizationMode.PermissionType.WithCallLimit(limits)), null, null, null, subroutine, priority);
    }

    public static MessageDetails processFunction(ParamRestriction... restrictions) {
        return new MessageDetails(MessageType.COSMWASM_EXECUTE_MSG,
                new Message("process_function", Arrays.asList(restrictions)));
    }

    public static AtomicFunction atomicCall(String contract) {
        return new AtomicFunction(Domain.MAIN, processFunction(), contract);
    }

    public static NonAtomicFunction nonAtomicCall(String contract, RetryLogic retryLogic, FunctionCallback callback) {
        return new NonAtomicFunction(Domain.MAIN, processFunction(), contract, retryLogic, callback);
    }

    public static Subroutine.Atomic atomic(RetryLogic retryLogic, AtomicFunction... functions) {
        return new Subroutine.Atomic(Arrays.asList(functions), retryLogic, null);
    }

    public static Subroutine.NonAtomic nonAtomic(NonAtomicFunction... functions) {
        return new Subroutine.NonAtomic(Arrays.asList(functions), null);
    }
}
