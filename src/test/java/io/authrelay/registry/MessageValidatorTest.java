package io.authrelay.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.authrelay.model.AtomicFunction;
import io.authrelay.model.Domain;
import io.authrelay.model.Message;
import io.authrelay.model.MessageDetails;
import io.authrelay.model.MessageType;
import io.authrelay.model.ParamRestriction;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.model.Subroutine;
import io.authrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

final class MessageValidatorTest {

    @Test
    void nestedPathsStartAtTheTopLevelKey() throws Exception {
        JsonNode root = Jsons.wire().readTree("{\"swap\":{\"route\":{\"pool\":7}}}");

        Assertions.assertTrue(MessageValidator.satisfied(root,
                new ParamRestriction.MustBeIncluded(List.of("swap", "route", "pool"))));
        Assertions.assertFalse(MessageValidator.satisfied(root,
                new ParamRestriction.MustBeIncluded(List.of("route", "pool"))));
        Assertions.assertFalse(MessageValidator.satisfied(root,
                new ParamRestriction.CannotBeIncluded(List.of("swap", "route"))));
        Assertions.assertTrue(MessageValidator.satisfied(root,
                new ParamRestriction.CannotBeIncluded(List.of("swap", "route", "pool", "id"))));
    }

    @Test
    void mustBeValueComparesJsonNotText() throws Exception {
        JsonNode root = Jsons.wire().readTree("{\"swap\":{\"limits\":{\"max\":5,\"min\":1}}}");

        Assertions.assertTrue(MessageValidator.satisfied(root, new ParamRestriction.MustBeValue(
                List.of("swap", "limits"), bytes("{ \"min\": 1, \"max\": 5 }"))));
        Assertions.assertFalse(MessageValidator.satisfied(root, new ParamRestriction.MustBeValue(
                List.of("swap", "limits", "max"), bytes("6"))));
        Assertions.assertFalse(MessageValidator.satisfied(root, new ParamRestriction.MustBeValue(
                List.of("swap", "missing"), bytes("null"))));
    }

    @Test
    void rejectsWrongShapes() {
        Subroutine swap = single(MessageType.COSMWASM_EXECUTE_MSG, "swap");

        assertReason(AuthorizationError.Reason.INVALID_STRUCTURE, swap, cosmwasm("[1,2]"));
        assertReason(AuthorizationError.Reason.INVALID_STRUCTURE, swap, cosmwasm("{\"swap\":{},\"extra\":{}}"));
        assertReason(AuthorizationError.Reason.INVALID_JSON, swap,
                new ProcessorMessage.CosmwasmExecuteMsg(new byte[0]));
        assertReason(AuthorizationError.Reason.INVALID_TYPE, swap,
                new ProcessorMessage.CosmwasmMigrateMsg(3L, bytes("{\"swap\":{}}")));
    }

    @Test
    void evmCallsAreCheckedByKindOnly() throws Exception {
        Subroutine call = single(MessageType.EVM_CALL, "transfer");

        MessageValidator.validate(call, List.of(new ProcessorMessage.EvmCall(new byte[]{1, 2, 3})));
        assertReason(AuthorizationError.Reason.INVALID_TYPE, call, new ProcessorMessage.EvmRawCall(new byte[]{1}));
    }

    @Test
    void checksEveryFunctionInOrder() throws Exception {
        Subroutine twoStep = new Subroutine.Atomic(List.of(
                function(MessageType.COSMWASM_EXECUTE_MSG, "approve"),
                function(MessageType.COSMWASM_EXECUTE_MSG, "swap")), null, null);

        MessageValidator.validate(twoStep, List.of(cosmwasm("{\"approve\":{}}"), cosmwasm("{\"swap\":{}}")));
        assertReason(AuthorizationError.Reason.DOES_NOT_MATCH, twoStep,
                cosmwasm("{\"swap\":{}}"), cosmwasm("{\"approve\":{}}"));
    }

    private static void assertReason(AuthorizationError.Reason reason, Subroutine subroutine,
                                     ProcessorMessage... messages) {
        AuthorizationError error = Assertions.assertThrows(AuthorizationError.class,
                () -> MessageValidator.validate(subroutine, List.of(messages)));
        Assertions.assertEquals(reason, error.reason());
    }

    private static Subroutine single(MessageType type, String name) {
        return new Subroutine.Atomic(List.of(function(type, name)), null, null);
    }

    private static AtomicFunction function(MessageType type, String name) {
        return new AtomicFunction(Domain.MAIN, new MessageDetails(type, new Message(name, List.of())), "lib");
    }

    private static ProcessorMessage cosmwasm(String json) {
        return new ProcessorMessage.CosmwasmExecuteMsg(bytes(json));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
