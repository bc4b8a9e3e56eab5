package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(HyperlaneMsg.Dispatch.class),
        @JsonSubTypes.Type(HyperlaneMsg.Process.class),
        @JsonSubTypes.Type(HyperlaneMsg.Delivered.class),
        @JsonSubTypes.Type(HyperlaneMsg.Outbox.class)
})
public interface HyperlaneMsg {

    @JsonTypeName("dispatch")
    record Dispatch(int destinationDomain, String recipient, byte[] body) implements HyperlaneMsg {
    }

    @JsonTypeName("process")
    record Process(long nonce, int origin, String sender, String recipient, byte[] body) implements HyperlaneMsg {
    }

    @JsonTypeName("delivered")
    record Delivered(long nonce) implements HyperlaneMsg {
    }

    @JsonTypeName("outbox")
    record Outbox() implements HyperlaneMsg {
    }

    record OutboundMessage(long nonce, int origin, String sender, int destinationDomain, String recipient, byte[] body) {
    }

    record HandleMsg(int origin, String sender, byte[] body) {
    }
}
