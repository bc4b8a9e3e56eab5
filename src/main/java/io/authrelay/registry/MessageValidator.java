package io.authrelay.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.model.LibraryFunction;
import io.authrelay.model.Message;
import io.authrelay.model.ParamRestriction;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.model.Subroutine;
import io.authrelay.util.Jsons;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

public final class MessageValidator {
    private MessageValidator() {
    }

    public static void validate(Subroutine subroutine, List<ProcessorMessage> messages) throws AuthorizationError {
        List<? extends LibraryFunction> functions = subroutine.functions();
        if (messages == null || messages.size() != functions.size()) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_AMOUNT,
                    "expected " + functions.size() + ", got " + (messages == null ? 0 : messages.size()));
        }
        for (int i = 0; i < functions.size(); i++) {
            validateOne(functions.get(i), messages.get(i), i);
        }
    }

    private static void validateOne(LibraryFunction function, ProcessorMessage message, int index)
            throws AuthorizationError {
        if (message.messageType() != function.messageDetails().messageType()) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_TYPE, "message " + index);
        }
        if (!message.messageType().cosmwasm()) {
            return;
        }
        JsonNode root = parse(message.msg(), index);
        if (!root.isObject() || root.size() != 1) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_STRUCTURE, "message " + index);
        }
        Message expected = function.messageDetails().message();
        String topKey = root.fieldNames().next();
        if (!topKey.equals(expected.name())) {
            throw new AuthorizationError(AuthorizationError.Reason.DOES_NOT_MATCH,
                    "expected " + expected.name() + ", got " + topKey);
        }
        for (ParamRestriction restriction : expected.paramsRestrictions()) {
            if (!satisfied(root, restriction)) {
                throw new AuthorizationError(AuthorizationError.Reason.INVALID_MESSAGE_PARAMS,
                        "message " + index + " path " + String.join(".", restriction.path()));
            }
        }
    }

    static boolean satisfied(JsonNode root, ParamRestriction restriction) {
        JsonNode node = at(root, restriction.path());
        if (restriction instanceof ParamRestriction.MustBeIncluded) {
            return node != null;
        }
        if (restriction instanceof ParamRestriction.CannotBeIncluded) {
            return node == null;
        }
        ParamRestriction.MustBeValue mustBeValue = (ParamRestriction.MustBeValue) restriction;
        if (node == null) {
            return false;
        }
        try {
            return node.equals(Jsons.wire().readTree(mustBeValue.value()));
        } catch (IOException e) {
            return false;
        }
    }

    private static JsonNode at(JsonNode root, List<String> path) {
        JsonNode current = root;
        Iterator<String> keys = path.iterator();
        while (keys.hasNext()) {
            String key = keys.next();
            if (current == null || !current.isObject() || !current.has(key)) {
                return null;
            }
            current = current.get(key);
        }
        return current;
    }

    private static JsonNode parse(byte[] raw, int index) throws AuthorizationError {
        if (raw == null || raw.length == 0) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_JSON, "message " + index);
        }
        try {
            JsonNode node = Jsons.wire().readTree(raw);
            if (node == null || node.isMissingNode()) {
                throw new AuthorizationError(AuthorizationError.Reason.INVALID_JSON, "message " + index);
            }
            return node;
        } catch (IOException e) {
            throw new AuthorizationError(AuthorizationError.Reason.INVALID_JSON, "message " + index);
        }
    }
}
