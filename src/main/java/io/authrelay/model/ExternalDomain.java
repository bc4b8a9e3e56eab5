package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

public record ExternalDomain(String name, ExecutionEnvironment executionEnvironment, String processor) {

    public ExternalDomain withProxyState(PolytoneProxyState state) {
        if (executionEnvironment instanceof Cosmwasm cosmwasm) {
            PolytoneConnectors connectors = cosmwasm.polytone();
            PolytoneNote note = connectors.polytoneNote();
            PolytoneNote updated = new PolytoneNote(note.address(), note.timeoutSeconds(), state);
            return new ExternalDomain(name, new Cosmwasm(new PolytoneConnectors(updated, connectors.polytoneProxy())), processor);
        }
        return this;
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    @JsonSubTypes({
            @JsonSubTypes.Type(Cosmwasm.class),
            @JsonSubTypes.Type(Evm.class)
    })
    public interface ExecutionEnvironment {
    }

    @JsonTypeName("cosmwasm")
    public record Cosmwasm(PolytoneConnectors polytone) implements ExecutionEnvironment {
    }

    @JsonTypeName("evm")
    public record Evm(HyperlaneConnector hyperlane) implements ExecutionEnvironment {
    }

    public record PolytoneConnectors(PolytoneNote polytoneNote, String polytoneProxy) {
    }

    public record PolytoneNote(String address, long timeoutSeconds, PolytoneProxyState state) {
    }

    public record HyperlaneConnector(String mailbox, int domainId) {
    }
}
