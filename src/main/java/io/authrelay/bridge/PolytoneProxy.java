package io.authrelay.bridge;

import io.authrelay.host.Contract;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.Item;
import io.authrelay.host.Response;
import io.authrelay.host.Wire;
import io.authrelay.model.PolytoneMsg;

public final class PolytoneProxy implements Contract {
    static final Item<String> INSTANTIATOR = Item.of("instantiator", String.class);

    @Override
    public Response instantiate(ContractContext ctx, byte[] raw) {
        INSTANTIATOR.save(ctx.storage(), ctx.sender());
        return new Response().addAttribute("method", "instantiate_proxy");
    }

    @Override
    public Response execute(ContractContext ctx, byte[] raw) throws ContractException {
        if (!INSTANTIATOR.load(ctx.storage()).equals(ctx.sender())) {
            throw new ContractException("Unauthorized: only the voice can execute through its proxy");
        }
        PolytoneMsg msg = Wire.decode(raw, PolytoneMsg.class);
        if (!(msg instanceof PolytoneMsg.ProxyExecute execute)) {
            throw new ContractException("Unsupported proxy message: " + msg.getClass().getSimpleName());
        }
        return new Response().addAttribute("method", "proxy_execute").addMessages(execute.msgs());
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] raw) throws ContractException {
        return Wire.encode(INSTANTIATOR.load(ctx.storage()));
    }
}
