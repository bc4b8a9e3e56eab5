package io.authrelay.host;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(CosmosMsg.WasmExecute.class),
        @JsonSubTypes.Type(CosmosMsg.WasmMigrate.class),
        @JsonSubTypes.Type(CosmosMsg.WasmInstantiate.class)
})
public interface CosmosMsg {

    @JsonTypeName("execute")
    record WasmExecute(String contractAddr, byte[] msg) implements CosmosMsg {
    }

    @JsonTypeName("migrate")
    record WasmMigrate(String contractAddr, long newCodeId, byte[] msg) implements CosmosMsg {
    }

    @JsonTypeName("instantiate")
    record WasmInstantiate(String admin, long codeId, String label, byte[] msg, String salt) implements CosmosMsg {
    }

    static CosmosMsg execute(String contract, Object msg) {
        return new WasmExecute(contract, Wire.encode(msg));
    }
}
