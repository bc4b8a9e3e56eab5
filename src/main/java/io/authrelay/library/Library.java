package io.authrelay.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.authrelay.host.Contract;
import io.authrelay.host.ContractContext;
import io.authrelay.host.ContractException;
import io.authrelay.host.Item;
import io.authrelay.host.Response;
import io.authrelay.host.Wire;
import io.authrelay.util.Jsons;

import java.util.Map;

public abstract class Library implements Contract {
    public static final String PROCESS_FUNCTION = "process_function";
    public static final String UPDATE_CONFIG = "update_config";

    static final Item<String> PROCESSOR = Item.of("processor", String.class);
    static final Item<String> ADMIN = Item.of("admin", String.class);

    public abstract String id();

    protected abstract Response processFunction(ContractContext ctx, JsonNode body) throws ContractException;

    protected void configure(ContractContext ctx, JsonNode config) throws ContractException {
    }

    protected Response handleOther(ContractContext ctx, String action, JsonNode body) throws ContractException {
        throw new ContractException("Unsupported " + id() + " message: " + action);
    }

    @Override
    public final Response instantiate(ContractContext ctx, byte[] msg) throws ContractException {
        JsonNode root = Wire.tree(msg);
        ADMIN.save(ctx.storage(), ctx.sender());
        JsonNode processor = root.path("processor");
        if (processor.isTextual()) {
            PROCESSOR.save(ctx.storage(), processor.asText());
        }
        configure(ctx, root);
        return new Response().addAttribute("method", "instantiate").addAttribute("library", id());
    }

    @Override
    public final Response execute(ContractContext ctx, byte[] msg) throws ContractException {
        Map.Entry<String, JsonNode> action = singleAction(msg);
        if (PROCESS_FUNCTION.equals(action.getKey())) {
            String processor = PROCESSOR.mayLoad(ctx.storage()).orElse(null);
            if (processor != null && !processor.equals(ctx.sender())) {
                throw new ContractException("Unauthorized: only the processor can call " + id());
            }
            return processFunction(ctx, action.getValue());
        }
        if (UPDATE_CONFIG.equals(action.getKey())) {
            if (!ADMIN.load(ctx.storage()).equals(ctx.sender())) {
                throw new ContractException("Unauthorized: only the admin can update " + id());
            }
            JsonNode update = action.getValue();
            if (update.path("processor").isTextual()) {
                PROCESSOR.save(ctx.storage(), update.path("processor").asText());
            }
            configure(ctx, update);
            return new Response().addAttribute("method", UPDATE_CONFIG).addAttribute("library", id());
        }
        return handleOther(ctx, action.getKey(), action.getValue());
    }

    private static Map.Entry<String, JsonNode> singleAction(byte[] msg) throws ContractException {
        JsonNode root = Wire.tree(msg);
        if (!root.isObject() || root.size() != 1) {
            throw new ContractException("Library messages must be an object with a single key");
        }
        Map.Entry<String, JsonNode> entry = root.fields().next();
        JsonNode body = entry.getValue().isObject() ? entry.getValue() : Jsons.wire().createObjectNode();
        return Map.entry(entry.getKey(), body);
    }

    static ObjectNode object() {
        return Jsons.wire().createObjectNode();
    }
}
