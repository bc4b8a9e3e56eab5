package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.authrelay.host.ContractException;
import io.authrelay.host.CosmosMsg;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ProcessorMessage.CosmwasmExecuteMsg.class),
        @JsonSubTypes.Type(ProcessorMessage.CosmwasmMigrateMsg.class),
        @JsonSubTypes.Type(ProcessorMessage.EvmCall.class),
        @JsonSubTypes.Type(ProcessorMessage.EvmRawCall.class)
})
public interface ProcessorMessage {
    byte[] msg();

    MessageType messageType();

    ProcessorMessage withMsg(byte[] next);

    default CosmosMsg toCosmosMsg(String contractAddress) throws ContractException {
        throw new ContractException("Msg type not supported: " + messageType());
    }

    @JsonTypeName("cosmwasm_execute_msg")
    record CosmwasmExecuteMsg(byte[] msg) implements ProcessorMessage {
        @Override
        public MessageType messageType() {
            return MessageType.COSMWASM_EXECUTE_MSG;
        }

        @Override
        public ProcessorMessage withMsg(byte[] next) {
            return new CosmwasmExecuteMsg(next);
        }

        @Override
        public CosmosMsg toCosmosMsg(String contractAddress) {
            return new CosmosMsg.WasmExecute(contractAddress, msg);
        }
    }

    @JsonTypeName("cosmwasm_migrate_msg")
    record CosmwasmMigrateMsg(long codeId, byte[] msg) implements ProcessorMessage {
        @Override
        public MessageType messageType() {
            return MessageType.COSMWASM_MIGRATE_MSG;
        }

        @Override
        public ProcessorMessage withMsg(byte[] next) {
            return new CosmwasmMigrateMsg(codeId, next);
        }

        @Override
        public CosmosMsg toCosmosMsg(String contractAddress) {
            return new CosmosMsg.WasmMigrate(contractAddress, codeId, msg);
        }
    }

    @JsonTypeName("evm_call")
    record EvmCall(byte[] msg) implements ProcessorMessage {
        @Override
        public MessageType messageType() {
            return MessageType.EVM_CALL;
        }

        @Override
        public ProcessorMessage withMsg(byte[] next) {
            return new EvmCall(next);
        }
    }

    @JsonTypeName("evm_raw_call")
    record EvmRawCall(byte[] msg) implements ProcessorMessage {
        @Override
        public MessageType messageType() {
            return MessageType.EVM_RAW_CALL;
        }

        @Override
        public ProcessorMessage withMsg(byte[] next) {
            return new EvmRawCall(next);
        }
    }
}
