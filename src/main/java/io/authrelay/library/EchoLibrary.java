package io.authrelay.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.CosmosMsg;
import io.authrelay.host.KeyCodec;
import io.authrelay.host.Response;
import io.authrelay.host.StateDeque;
import io.authrelay.host.StateMap;
import io.authrelay.host.Wire;
import io.authrelay.model.ProcessorMsg;

import java.nio.charset.StandardCharsets;

public final class EchoLibrary extends Library {
    static final StateDeque<String> RECEIVED = StateDeque.of("received", String.class);
    static final StateMap<Long, PendingConfirmation> PENDING =
            StateMap.of("pending_confirmations", KeyCodec.U64, PendingConfirmation.class);

    record PendingConfirmation(String processor, byte[] msg) {
    }

    @Override
    public String id() {
        return "echo";
    }

    @Override
    protected Response processFunction(ContractContext ctx, JsonNode body) throws ContractException {
        RECEIVED.pushBack(ctx.storage(), body.toString());
        Response response = new Response()
                .addAttribute("method", PROCESS_FUNCTION)
                .addAttribute("received", RECEIVED.len(ctx.storage()));
        if (body.has("execution_id") && body.has("confirm_with")) {
            long executionId = body.path("execution_id").asLong();
            PENDING.save(ctx.storage(), executionId,
                    new PendingConfirmation(ctx.sender(), Wire.encode(body.get("confirm_with"))));
            response.addAttribute("confirmation_pending", executionId);
        }
        return response;
    }

    @Override
    protected Response handleOther(ContractContext ctx, String action, JsonNode body) throws ContractException {
        if (!"confirm".equals(action)) {
            return super.handleOther(ctx, action, body);
        }
        long executionId = body.path("execution_id").asLong();
        PendingConfirmation pending = PENDING.mayLoad(ctx.storage(), executionId)
                .orElseThrow(() -> new ContractException("No confirmation pending for execution " + executionId));
        PENDING.remove(ctx.storage(), executionId);
        return new Response()
                .addAttribute("method", "confirm")
                .addAttribute("execution_id", executionId)
                .addMessage(CosmosMsg.execute(pending.processor(), new ProcessorMsg.LibraryCallback(executionId, pending.msg())));
    }

    @Override
    public byte[] query(ContractContext ctx, byte[] msg) throws ContractException {
        ObjectNode out = object();
        ArrayNode received = out.putArray("received");
        for (String raw : RECEIVED.list(ctx.storage())) {
            received.add(Wire.tree(raw.getBytes(StandardCharsets.UTF_8)));
        }
        ArrayNode pending = out.putArray("pending");
        PENDING.entries(ctx.storage()).forEach(entry -> pending.add(entry.getKey()));
        return Wire.encode(out);
    }
}
