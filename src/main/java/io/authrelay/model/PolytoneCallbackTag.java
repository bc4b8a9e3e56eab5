package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(PolytoneCallbackTag.ExecutionId.class),
        @JsonSubTypes.Type(PolytoneCallbackTag.CreateProxy.class)
})
public interface PolytoneCallbackTag {

    @JsonTypeName("execution_id")
    record ExecutionId(long executionId) implements PolytoneCallbackTag {
    }

    @JsonTypeName("create_proxy")
    record CreateProxy(String domainName) implements PolytoneCallbackTag {
    }
}
