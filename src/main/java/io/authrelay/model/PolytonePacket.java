package io.authrelay.model;

import io.authrelay.host.CosmosMsg;

import java.util.List;

public record PolytonePacket(
        long sequence,
        String initiator,
        List<CosmosMsg> msgs,
        CallbackRequest callback,
        long timeoutAt
) {
    public PolytonePacket {
        msgs = msgs == null ? List.of() : List.copyOf(msgs);
    }
}
