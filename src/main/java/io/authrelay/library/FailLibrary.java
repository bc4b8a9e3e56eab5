package io.authrelay.library;

import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.Item;
import io.authrelay.host.Response;
import io.authrelay.host.Wire;

public final class FailLibrary extends Library {
    static final Item<Boolean> FAIL = Item.of("fail", Boolean.class);
    static final Item<String> REASON = Item.of("reason", String.class);
    static final Item<Long> CALLS = Item.of("calls", Long.class);
    static final String DEFAULT_REASON = "intentional failure from fail library";

    @Override
    public String id() {
        return "fail";
    }

    @Override
    protected void configure(ContractContext ctx, JsonNode config) {
        if (config.has("fail")) {
            FAIL.save(ctx.storage(), config.path("fail").asBoolean(true));
        }
        if (config.path("reason").isTextual()) {
            REASON.save(ctx.storage(), config.path("reason").asText());
        }
    }

    @Override
    protected Response processFunction(ContractContext ctx, JsonNode body) throws ContractException {
        long calls = CALLS.mayLoad(ctx.storage()).orElse(0L) + 1;
        if (FAIL.mayLoad(ctx.storage()).orElse(Boolean.TRUE)) {
            throw new ContractException(REASON.mayLoad(ctx.storage()).orElse(DEFAULT_REASON));
        }
        CALLS.save(ctx.storage(), calls);
        return new Response().addAttribute("method", PROCESS_FUNCTION).addAttribute("calls", calls);
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] msg) {
        return Wire.encode(CALLS.mayLoad(ctx.storage()).orElse(0L));
    }
}
