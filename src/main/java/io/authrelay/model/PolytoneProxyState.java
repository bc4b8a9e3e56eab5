package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(PolytoneProxyState.PendingResponse.class),
        @JsonSubTypes.Type(PolytoneProxyState.Created.class),
        @JsonSubTypes.Type(PolytoneProxyState.TimedOut.class),
        @JsonSubTypes.Type(PolytoneProxyState.UnexpectedError.class)
})
public interface PolytoneProxyState {
    PolytoneProxyState PENDING_RESPONSE = new PendingResponse();
    PolytoneProxyState CREATED = new Created();
    PolytoneProxyState TIMED_OUT = new TimedOut();

    @JsonTypeName("pending_response")
    record PendingResponse() implements PolytoneProxyState {
    }

    @JsonTypeName("created")
    record Created() implements PolytoneProxyState {
    }

    @JsonTypeName("timed_out")
    record TimedOut() implements PolytoneProxyState {
    }

    @JsonTypeName("unexpected_error")
    record UnexpectedError(String reason) implements PolytoneProxyState {
    }
}
