package io.authrelay.library;

import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Response;
import io.authrelay.host.StateMap;
import io.authrelay.host.Storage;
import io.authrelay.host.Wire;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

public final class LedgerLibrary extends Library {
    static final StateMap<String, Long> BALANCES = StateMap.of("balances", KeyCodec.STRING, Long.class);

    @Override
    public String id() {
        return "ledger";
    }

    @Override
    protected void configure(ContractContext ctx, JsonNode config) {
        Iterator<Map.Entry<String, JsonNode>> balances = config.path("balances").fields();
        while (balances.hasNext()) {
            Map.Entry<String, JsonNode> entry = balances.next();
            BALANCES.save(ctx.storage(), entry.getKey(), entry.getValue().asLong());
        }
    }

    @Override
    protected Response processFunction(ContractContext ctx, JsonNode body) throws ContractException {
        Storage storage = ctx.storage();
        if (body.has("transfer")) {
            JsonNode transfer = body.get("transfer");
            String from = transfer.path("from").asText();
            String to = transfer.path("to").asText();
            long amount = amount(transfer);
            long available = BALANCES.mayLoad(storage, from).orElse(0L);
            if (available < amount) {
                throw new ContractException("Insufficient funds: " + from + " has " + available + ", needs " + amount);
            }
            BALANCES.save(storage, from, available - amount);
            BALANCES.save(storage, to, BALANCES.mayLoad(storage, to).orElse(0L) + amount);
            return new Response()
                    .addAttribute("method", "transfer")
                    .addAttribute("from", from)
                    .addAttribute("to", to)
                    .addAttribute("amount", amount);
        }
        if (body.has("mint")) {
            JsonNode mint = body.get("mint");
            String to = mint.path("to").asText();
            long amount = amount(mint);
            BALANCES.save(storage, to, BALANCES.mayLoad(storage, to).orElse(0L) + amount);
            return new Response().addAttribute("method", "mint").addAttribute("to", to).addAttribute("amount", amount);
        }
        throw new ContractException("Unsupported ledger function: " + body);
    }

    private static long amount(JsonNode node) throws ContractException {
        long amount = node.path("amount").asLong(-1L);
        if (amount <= 0) {
            throw new ContractException("Amount must be positive");
        }
        return amount;
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] msg) {
        Map<String, Long> out = new LinkedHashMap<>();
        BALANCES.entries(ctx.storage()).forEach(entry -> out.put(entry.getKey(), entry.getValue()));
        return Wire.encode(out);
    }
}
