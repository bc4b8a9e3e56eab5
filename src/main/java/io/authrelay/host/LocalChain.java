package io.authrelay.host;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class LocalChain {
    private static final Logger LOG = LoggerFactory.getLogger(LocalChain.class);
    private static final String HOST_PREFIX = "~host/";
    private static final String BLOCK_KEY = HOST_PREFIX + "block";
    private static final String CONTRACTS_PREFIX = HOST_PREFIX + "contracts/";
    private static final String INSTANCE_SEQ_KEY = HOST_PREFIX + "instance_seq";
    private static final int MAX_CALL_DEPTH = 64;
    public static final long GENESIS_TIME = 1_700_000_000L;
    public static final long BLOCK_SECONDS = 5L;

    private final String chainId;
    private final String addressPrefix;
    private final ChainState state;
    private final Map<Long, Contract> codes = new LinkedHashMap<>();
    private BlockInfo block;

    public LocalChain(String chainId, String addressPrefix, StateBackend backend) {
        this.chainId = chainId;
        this.addressPrefix = addressPrefix;
        this.state = new ChainState(backend);
        this.block = state.get(BLOCK_KEY)
                .map(raw -> StoredValues.read(raw, BlockInfo.class, BLOCK_KEY))
                .orElse(new BlockInfo(1L, GENESIS_TIME));
    }

    public String chainId() {
        return chainId;
    }

    public synchronized BlockInfo block() {
        return block;
    }

    public synchronized void advanceSeconds(long seconds) {
        block = new BlockInfo(block.height() + 1, block.time() + Math.max(0L, seconds));
        persistBlock();
    }

    public synchronized void advanceBlocks(long blocks) {
        long n = Math.max(0L, blocks);
        block = new BlockInfo(block.height() + n, block.time() + n * BLOCK_SECONDS);
        persistBlock();
    }

    // code ids follow registration order; a restarted host must register the same code in the same order
    public synchronized long storeCode(Contract code) {
        long codeId = codes.size() + 1L;
        codes.put(codeId, code);
        return codeId;
    }

    public String predictAddress(String creator, String salt) {
        return addressPrefix + "1" + Hashing.sha256Hex(chainId + "/" + creator + "/" + salt).substring(0, 38);
    }

    public synchronized boolean hasContract(String address) {
        return state.get(CONTRACTS_PREFIX + address).isPresent();
    }

    public synchronized Optional<ContractInfo> contractInfo(String address) {
        return loadContractInfo(address);
    }

    public synchronized String instantiate(String sender, long codeId, Object msg, String label, String admin)
            throws ContractException {
        return instantiate2(sender, codeId, msg, label, admin, null);
    }

    public synchronized String instantiate2(String sender, long codeId, Object msg, String label, String admin, String salt)
            throws ContractException {
        CosmosMsg.WasmInstantiate instantiate = new CosmosMsg.WasmInstantiate(admin, codeId, label, Wire.encode(msg), salt);
        TxResult result = transact(() -> {
            List<Event> events = new ArrayList<>();
            byte[] address = dispatchInstantiate(sender, instantiate, events, 0);
            return new TxResult(block.height(), address, events);
        });
        return Wire.text(result.data());
    }

    public synchronized TxResult execute(String sender, String contract, Object msg) throws ContractException {
        return executeRaw(sender, contract, Wire.encode(msg));
    }

    public synchronized TxResult executeRaw(String sender, String contract, byte[] msg) throws ContractException {
        return transact(() -> {
            List<Event> events = new ArrayList<>();
            byte[] data = dispatchExecute(sender, contract, msg, events, 0);
            return new TxResult(block.height(), data, events);
        });
    }

    public synchronized <T> T query(String contract, Object msg, Class<T> type) throws ContractException {
        return Wire.decode(queryRaw(contract, Wire.encode(msg)), type);
    }

    public synchronized <T> T query(String contract, Object msg, TypeReference<T> type) throws ContractException {
        return Wire.decode(queryRaw(contract, Wire.encode(msg)), type);
    }

    public synchronized byte[] queryRaw(String contract, byte[] msg) throws ContractException {
        ContractInfo info = requireContract(contract);
        state.begin();
        try {
            return code(info).query(context(contract, null), msg);
        } finally {
            state.rollback();
        }
    }

    private TxResult transact(Transaction body) throws ContractException {
        block = new BlockInfo(block.height() + 1, block.time());
        state.begin();
        try {
            TxResult result = body.run();
            state.put(BLOCK_KEY, StoredValues.write(block, BLOCK_KEY));
            state.commit();
            return result;
        } catch (ContractException | RuntimeException e) {
            state.rollback();
            persistBlock();
            LOG.debug("Transaction reverted on {} at height {}: {}", chainId, block.height(), e.getMessage());
            throw e;
        }
    }

    private byte[] dispatchExecute(String sender, String contract, byte[] msg, List<Event> events, int depth)
            throws ContractException {
        checkDepth(depth);
        ContractInfo info = requireContract(contract);
        Response response = code(info).execute(context(contract, sender), msg);
        events.add(wasmEvent(contract, response));
        return dispatchResponse(contract, response, events, depth);
    }

    private byte[] dispatchInstantiate(String sender, CosmosMsg.WasmInstantiate msg, List<Event> events, int depth)
            throws ContractException {
        checkDepth(depth);
        Contract code = codes.get(msg.codeId());
        if (code == null) {
            throw new ContractException("No code stored with id " + msg.codeId());
        }
        String salt = msg.salt();
        if (salt == null || salt.isBlank()) {
            long seq = state.get(INSTANCE_SEQ_KEY).map(Long::parseLong).orElse(0L) + 1L;
            state.put(INSTANCE_SEQ_KEY, Long.toString(seq));
            salt = "instance-" + seq;
        }
        String address = predictAddress(sender, salt);
        if (hasContract(address)) {
            throw new ContractException("Contract address already in use: " + address);
        }
        ContractInfo info = new ContractInfo(msg.codeId(), msg.admin(), msg.label(), sender);
        state.put(CONTRACTS_PREFIX + address, StoredValues.write(info, address));
        Response response = code.instantiate(context(address, sender), msg.msg());
        Event event = wasmEvent(address, response);
        Map<String, String> attrs = new LinkedHashMap<>(event.attributes());
        attrs.put("_code_id", Long.toString(msg.codeId()));
        events.add(new Event("instantiate", attrs));
        dispatchResponse(address, response, events, depth);
        return address.getBytes(StandardCharsets.UTF_8);
    }

    private byte[] dispatchMigrate(String sender, CosmosMsg.WasmMigrate msg, List<Event> events, int depth)
            throws ContractException {
        checkDepth(depth);
        ContractInfo info = requireContract(msg.contractAddr());
        if (info.admin() == null || !info.admin().equals(sender)) {
            throw new ContractException("Unauthorized: only the contract admin can migrate " + msg.contractAddr());
        }
        Contract code = codes.get(msg.newCodeId());
        if (code == null) {
            throw new ContractException("No code stored with id " + msg.newCodeId());
        }
        ContractInfo migrated = new ContractInfo(msg.newCodeId(), info.admin(), info.label(), info.creator());
        state.put(CONTRACTS_PREFIX + msg.contractAddr(), StoredValues.write(migrated, msg.contractAddr()));
        Response response = code.migrate(context(msg.contractAddr(), sender), msg.msg());
        events.add(wasmEvent(msg.contractAddr(), response));
        return dispatchResponse(msg.contractAddr(), response, events, depth);
    }

    private byte[] dispatchMsg(String sender, CosmosMsg msg, List<Event> events, int depth) throws ContractException {
        if (msg instanceof CosmosMsg.WasmExecute execute) {
            return dispatchExecute(sender, execute.contractAddr(), execute.msg(), events, depth);
        }
        if (msg instanceof CosmosMsg.WasmMigrate migrate) {
            return dispatchMigrate(sender, migrate, events, depth);
        }
        if (msg instanceof CosmosMsg.WasmInstantiate instantiate) {
            return dispatchInstantiate(sender, instantiate, events, depth);
        }
        throw new ContractException("Unsupported message: " + msg.getClass().getSimpleName());
    }

    private byte[] dispatchResponse(String contract, Response response, List<Event> events, int depth)
            throws ContractException {
        byte[] data = response.data();
        for (SubMsg sub : response.messages()) {
            List<Event> subEvents = new ArrayList<>();
            state.begin();
            byte[] subData;
            try {
                subData = dispatchMsg(contract, sub.msg(), subEvents, depth + 1);
                state.commit();
            } catch (ContractException e) {
                state.rollback();
                if (!sub.replyOn().onError()) {
                    throw e;
                }
                byte[] replyData = reply(contract, new Reply(sub.id(), SubMsgResult.err(e.getMessage())), events, depth);
                if (replyData != null) {
                    data = replyData;
                }
                continue;
            }
            events.addAll(subEvents);
            if (sub.replyOn().onSuccess()) {
                byte[] replyData = reply(contract, new Reply(sub.id(), SubMsgResult.ok(subData, subEvents)), events, depth);
                if (replyData != null) {
                    data = replyData;
                }
            }
        }
        return data;
    }

    private byte[] reply(String contract, Reply reply, List<Event> events, int depth) throws ContractException {
        ContractInfo info = requireContract(contract);
        Response response = code(info).reply(context(contract, contract), reply);
        events.add(wasmEvent(contract, response));
        return dispatchResponse(contract, response, events, depth);
    }

    private ContractContext context(String contract, String sender) {
        return new ContractContext(new Env(block, chainId, contract), sender, new Storage(state, contract));
    }

    private Event wasmEvent(String contract, Response response) {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("_contract_address", contract);
        attrs.putAll(response.attributes());
        return new Event("wasm", attrs);
    }

    private ContractInfo requireContract(String address) throws ContractException {
        Optional<ContractInfo> info = loadContractInfo(address);
        if (info.isEmpty()) {
            throw new ContractException("Contract not found: " + address);
        }
        return info.get();
    }

    private Optional<ContractInfo> loadContractInfo(String address) {
        return state.get(CONTRACTS_PREFIX + address)
                .map(raw -> StoredValues.read(raw, ContractInfo.class, address));
    }

    private Contract code(ContractInfo info) throws ContractException {
        Contract code = codes.get(info.codeId());
        if (code == null) {
            throw new ContractException("No code stored with id " + info.codeId());
        }
        return code;
    }

    private void checkDepth(int depth) throws ContractException {
        if (depth > MAX_CALL_DEPTH) {
            throw new ContractException("Maximum call depth exceeded");
        }
    }

    private void persistBlock() {
        state.begin();
        state.put(BLOCK_KEY, StoredValues.write(block, BLOCK_KEY));
        state.commit();
    }

    @FunctionalInterface
    private interface Transaction {
        TxResult run() throws ContractException;
    }

    public record ContractInfo(long codeId, String admin, String label, String creator) {
    }
}
