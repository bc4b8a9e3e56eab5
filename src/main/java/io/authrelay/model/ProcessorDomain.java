package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ProcessorDomain.Main.class),
        @JsonSubTypes.Type(ProcessorDomain.Polytone.class),
        @JsonSubTypes.Type(ProcessorDomain.Hyperlane.class)
})
public interface ProcessorDomain {

    @JsonTypeName("main")
    record Main() implements ProcessorDomain {
    }

    @JsonTypeName("polytone")
    record Polytone(String note, String proxy, long timeoutSeconds, PolytoneProxyState proxyOnMainDomainState)
            implements ProcessorDomain {
        public Polytone withProxyState(PolytoneProxyState next) {
            return new Polytone(note, proxy, timeoutSeconds, next);
        }
    }

    @JsonTypeName("hyperlane")
    record Hyperlane(String mailbox, int mainDomainId) implements ProcessorDomain {
    }
}
