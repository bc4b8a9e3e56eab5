package io.authrelay.bridge;

import io.authrelay.host.Contract;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.CosmosMsg;
import io.authrelay.host.Item;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Reply;
import io.authrelay.host.Response;
import io.authrelay.host.StateMap;
import io.authrelay.host.Storage;
import io.authrelay.host.SubMsg;
import io.authrelay.host.Wire;
import io.authrelay.model.PolytoneMsg;
import io.authrelay.model.PolytoneResult;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class PolytoneVoice implements Contract {
    private static final long REPLY_INSTANTIATE = 1L;
    private static final long REPLY_EXECUTE = 2L;

    static final Item<Long> PROXY_CODE_ID = Item.of("proxy_code_id", Long.class);
    static final Item<String> RELAYER = Item.of("relayer", String.class);
    static final StateMap<String, String> PROXIES = StateMap.of("proxies", KeyCodec.STRING, String.class);
    static final Item<InFlight> IN_FLIGHT = Item.of("in_flight", InFlight.class);

    public record InstantiateMsg(long proxyCodeId, String relayer) {
    }

    record InFlight(String key, List<CosmosMsg> msgs, String proxy) {
    }

    public static String proxySalt(String sourceChain, String initiator) {
        return sourceChain + "/" + initiator;
    }

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) throws ContractException {
        InstantiateMsg msg = Wire.decode(raw, InstantiateMsg.class);
        PROXY_CODE_ID.save(ctx.storage(), msg.proxyCodeId());
        if (msg.relayer() != null) {
            RELAYER.save(ctx.storage(), msg.relayer());
        }
        return new Response().addAttribute("method", "instantiate_voice");
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        PolytoneMsg msg = Wire.decode(raw, PolytoneMsg.class);
        if (!(msg instanceof PolytoneMsg.Rx rx)) {
            throw new ContractException("Unsupported voice message: " + msg.getClass().getSimpleName());
        }
        Storage storage = ctx.storage();
        RelayerGuard.check(RELAYER.mayLoad(storage), ctx.sender());
        String key = proxySalt(rx.sourceChain(), rx.initiator());
        Response response = new Response().addAttribute("method", "rx").addAttribute("initiator", rx.initiator());
        String proxy = PROXIES.mayLoad(storage, key).orElse(null);
        IN_FLIGHT.save(storage, new InFlight(key, rx.msgs(), proxy));
        if (proxy == null) {
            CosmosMsg.WasmInstantiate create = new CosmosMsg.WasmInstantiate(ctx.self(), PROXY_CODE_ID.load(storage),
                    "polytone-proxy " + key, Wire.encode(Map.of()), key);
            return response.addSubMessage(SubMsg.replyOnSuccess(REPLY_INSTANTIATE, create));
        }
        return response.addSubMessage(SubMsg.replyAlways(REPLY_EXECUTE, proxyExecute(proxy, rx.msgs())));
    }

    @Override
    public Response reply(ContractContext ctx, Reply reply) throws ContractException {
        Storage storage = ctx.storage();
        InFlight inFlight = IN_FLIGHT.load(storage);
        if (reply.id() == REPLY_INSTANTIATE) {
            String proxy = Wire.text(reply.result().data());
            PROXIES.save(storage, inFlight.key(), proxy);
            IN_FLIGHT.save(storage, new InFlight(inFlight.key(), inFlight.msgs(), proxy));
            return new Response()
                    .addAttribute("proxy_created", proxy)
                    .addSubMessage(SubMsg.replyAlways(REPLY_EXECUTE, proxyExecute(proxy, inFlight.msgs())));
        }
        IN_FLIGHT.remove(storage);
        PolytoneResult ack = reply.result().isOk()
                ? PolytoneResult.executed(inFlight.proxy())
                : PolytoneResult.failed(reply.result().error());
        return new Response().setData(Wire.encode(ack, PolytoneResult.class));
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) {
        return Wire.encode(PROXIES.entries(ctx.storage()).stream()
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
    }

    private static CosmosMsg proxyExecute(String proxy, List<CosmosMsg> msgs) {
        return new CosmosMsg.WasmExecute(proxy, Wire.encode(new PolytoneMsg.ProxyExecute(msgs), PolytoneMsg.class));
    }
}
