package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageType {
    @JsonProperty("cosmwasm_execute_msg")
    COSMWASM_EXECUTE_MSG,
    @JsonProperty("cosmwasm_migrate_msg")
    COSMWASM_MIGRATE_MSG,
    @JsonProperty("evm_call")
    EVM_CALL,
    @JsonProperty("evm_raw_call")
    EVM_RAW_CALL;

    public boolean cosmwasm() {
        return this == COSMWASM_EXECUTE_MSG || this == COSMWASM_MIGRATE_MSG;
    }
}
