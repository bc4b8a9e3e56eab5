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
import io.authrelay.model.CallbackMessage;
import io.authrelay.model.PolytoneMsg;
import io.authrelay.model.PolytonePacket;
import io.authrelay.model.PolytoneResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class PolytoneNote implements Contract {
    private static final Logger LOG = LoggerFactory.getLogger(PolytoneNote.class);
    private static final long CALLBACK_REPLY_ID = 1L;

    static final Item<String> RELAYER = Item.of("relayer", String.class);
    static final Item<Long> NEXT_SEQUENCE = Item.of("next_sequence", Long.class);
    static final StateMap<Long, PolytonePacket> PACKETS = StateMap.of("packets", KeyCodec.U64, PolytonePacket.class);

    public record InstantiateMsg(String relayer) {
    }

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) throws ContractException {
        InstantiateMsg msg = Wire.decode(raw, InstantiateMsg.class);
        if (msg.relayer() != null) {
            RELAYER.save(ctx.storage(), msg.relayer());
        }
        NEXT_SEQUENCE.save(ctx.storage(), 1L);
        return new Response().addAttribute("method", "instantiate_note");
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        PolytoneMsg msg = Wire.decode(raw, PolytoneMsg.class);
        Storage storage = ctx.storage();
        if (msg instanceof PolytoneMsg.Execute execute) {
            long sequence = NEXT_SEQUENCE.mayLoad(storage).orElse(1L);
            NEXT_SEQUENCE.save(storage, sequence + 1);
            PACKETS.save(storage, sequence, new PolytonePacket(sequence, ctx.sender(), execute.msgs(), execute.callback(),
                    ctx.block().time() + execute.timeoutSeconds()));
            return new Response()
                    .addAttribute("method", "note_execute")
                    .addAttribute("sequence", sequence)
                    .addAttribute("initiator", ctx.sender());
        }
        if (msg instanceof PolytoneMsg.Ack ack) {
            return settle(ctx, ack.sequence(), ack.result());
        }
        if (msg instanceof PolytoneMsg.Timeout timeout) {
            return settle(ctx, timeout.sequence(), PolytoneResult.timeout());
        }
        throw new ContractException("Unsupported note message: " + msg.getClass().getSimpleName());
    }

    private Response settle(ContractContext ctx, long sequence, PolytoneResult result) throws ContractException {
        Storage storage = ctx.storage();
        RelayerGuard.check(RELAYER.mayLoad(storage), ctx.sender());
        PolytonePacket packet = PACKETS.mayLoad(storage, sequence)
                .orElseThrow(() -> new ContractException("Unknown packet sequence " + sequence));
        PACKETS.remove(storage, sequence);
        Response response = new Response()
                .addAttribute("method", "note_settle")
                .addAttribute("sequence", sequence)
                .addAttribute("ok", result.ok());
        if (packet.callback() != null) {
            CallbackMessage callback = new CallbackMessage(packet.initiator(), packet.callback().msg(), result);
            response.addSubMessage(SubMsg.replyOnError(CALLBACK_REPLY_ID,
                    CosmosMsg.execute(packet.callback().receiver(), Map.of("callback", callback))));
        }
        return response;
    }

    // a failing callback receiver does not keep the packet open
    @Override
    public Response reply(ContractContext ctx, Reply reply) {
        LOG.warn("Polytone callback delivery failed on {}: {}", ctx.env().chainId(), reply.result().error());
        return new Response().addAttribute("callback_error", reply.result().error());
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) throws ContractException {
        PolytoneMsg msg = Wire.decode(raw, PolytoneMsg.class);
        if (msg instanceof PolytoneMsg.PendingPackets) {
            return Wire.encode(PACKETS.values(ctx.storage()));
        }
        throw new ContractException("Unsupported note query: " + msg.getClass().getSimpleName());
    }
}
