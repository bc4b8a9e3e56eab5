package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.authrelay.host.CosmosMsg;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(PolytoneMsg.Execute.class),
        @JsonSubTypes.Type(PolytoneMsg.Ack.class),
        @JsonSubTypes.Type(PolytoneMsg.Timeout.class),
        @JsonSubTypes.Type(PolytoneMsg.Rx.class),
        @JsonSubTypes.Type(PolytoneMsg.ProxyExecute.class),
        @JsonSubTypes.Type(PolytoneMsg.PendingPackets.class)
})
public interface PolytoneMsg {

    @JsonTypeName("execute")
    record Execute(List<CosmosMsg> msgs, CallbackRequest callback, long timeoutSeconds) implements PolytoneMsg {
        public Execute {
            msgs = msgs == null ? List.of() : List.copyOf(msgs);
        }
    }

    @JsonTypeName("ack")
    record Ack(long sequence, PolytoneResult result) implements PolytoneMsg {
    }

    @JsonTypeName("timeout")
    record Timeout(long sequence) implements PolytoneMsg {
    }

    @JsonTypeName("rx")
    record Rx(String sourceChain, String initiator, List<CosmosMsg> msgs) implements PolytoneMsg {
        public Rx {
            msgs = msgs == null ? List.of() : List.copyOf(msgs);
        }
    }

    @JsonTypeName("proxy_execute")
    record ProxyExecute(List<CosmosMsg> msgs) implements PolytoneMsg {
        public ProxyExecute {
            msgs = msgs == null ? List.of() : List.copyOf(msgs);
        }
    }

    @JsonTypeName("pending_packets")
    record PendingPackets() implements PolytoneMsg {
    }
}
