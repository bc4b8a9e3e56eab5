package io.authrelay.bridge;

import io.authrelay.host.Contract;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.CosmosMsg;
import io.authrelay.host.Item;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Response;
import io.authrelay.host.StateMap;
import io.authrelay.host.Storage;
import io.authrelay.host.Wire;
import io.authrelay.model.HyperlaneMsg;

import java.util.Map;

public final class HyperlaneMailbox implements Contract {
    static final Item<Integer> LOCAL_DOMAIN = Item.of("local_domain", Integer.class);
    static final Item<String> RELAYER = Item.of("relayer", String.class);
    static final Item<Long> NEXT_NONCE = Item.of("next_nonce", Long.class);
    static final StateMap<Long, HyperlaneMsg.OutboundMessage> OUTBOX =
            StateMap.of("outbox", KeyCodec.U64, HyperlaneMsg.OutboundMessage.class);
    static final StateMap<String, Boolean> PROCESSED = StateMap.of("processed", KeyCodec.STRING, Boolean.class);

    public record InstantiateMsg(int localDomain, String relayer) {
    }

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) throws ContractException {
        InstantiateMsg msg = Wire.decode(raw, InstantiateMsg.class);
        LOCAL_DOMAIN.save(ctx.storage(), msg.localDomain());
        if (msg.relayer() != null) {
            RELAYER.save(ctx.storage(), msg.relayer());
        }
        NEXT_NONCE.save(ctx.storage(), 1L);
        return new Response()
                .addAttribute("method", "instantiate_mailbox")
                .addAttribute("local_domain", msg.localDomain());
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        HyperlaneMsg msg = Wire.decode(raw, HyperlaneMsg.class);
        Storage storage = ctx.storage();
        if (msg instanceof HyperlaneMsg.Dispatch dispatch) {
            long nonce = NEXT_NONCE.mayLoad(storage).orElse(1L);
            NEXT_NONCE.save(storage, nonce + 1);
            OUTBOX.save(storage, nonce, new HyperlaneMsg.OutboundMessage(nonce, LOCAL_DOMAIN.load(storage), ctx.sender(),
                    dispatch.destinationDomain(), dispatch.recipient(), dispatch.body()));
            return new Response()
                    .addAttribute("method", "dispatch")
                    .addAttribute("nonce", nonce)
                    .addAttribute("destination_domain", dispatch.destinationDomain());
        }
        if (msg instanceof HyperlaneMsg.Process process) {
            RelayerGuard.check(RELAYER.mayLoad(storage), ctx.sender());
            String key = process.origin() + "/" + process.nonce();
            if (PROCESSED.has(storage, key)) {
                throw new ContractException("Message already processed: " + key);
            }
            PROCESSED.save(storage, key, Boolean.TRUE);
            HyperlaneMsg.HandleMsg handle = new HyperlaneMsg.HandleMsg(process.origin(), process.sender(), process.body());
            return new Response()
                    .addAttribute("method", "process")
                    .addAttribute("origin", process.origin())
                    .addAttribute("nonce", process.nonce())
                    .addMessage(CosmosMsg.execute(process.recipient(), Map.of("handle", handle)));
        }
        if (msg instanceof HyperlaneMsg.Delivered delivered) {
            RelayerGuard.check(RELAYER.mayLoad(storage), ctx.sender());
            if (!OUTBOX.has(storage, delivered.nonce())) {
                throw new ContractException("Unknown outbound nonce " + delivered.nonce());
            }
            OUTBOX.remove(storage, delivered.nonce());
            return new Response().addAttribute("method", "delivered").addAttribute("nonce", delivered.nonce());
        }
        throw new ContractException("Unsupported mailbox message: " + msg.getClass().getSimpleName());
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) throws ContractException {
        HyperlaneMsg msg = Wire.decode(raw, HyperlaneMsg.class);
        if (msg instanceof HyperlaneMsg.Outbox) {
            return Wire.encode(OUTBOX.values(ctx.storage()));
        }
        throw new ContractException("Unsupported mailbox query: " + msg.getClass().getSimpleName());
    }
}
