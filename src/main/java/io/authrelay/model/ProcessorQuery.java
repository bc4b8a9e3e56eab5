package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ProcessorQuery.Config.class),
        @JsonSubTypes.Type(ProcessorQuery.GetQueue.class),
        @JsonSubTypes.Type(ProcessorQuery.IsQueueEmpty.class),
        @JsonSubTypes.Type(ProcessorQuery.PendingRetry.class),
        @JsonSubTypes.Type(ProcessorQuery.PendingCallback.class),
        @JsonSubTypes.Type(ProcessorQuery.PendingPolytoneCallback.class)
})
public interface ProcessorQuery {

    @JsonTypeName("config")
    record Config() implements ProcessorQuery {
    }

    @JsonTypeName("get_queue")
    record GetQueue(Integer from, Integer to, Priority priority) implements ProcessorQuery {
    }

    @JsonTypeName("is_queue_empty")
    record IsQueueEmpty() implements ProcessorQuery {
    }

    @JsonTypeName("pending_retry")
    record PendingRetry(long executionId) implements ProcessorQuery {
    }

    @JsonTypeName("pending_callback")
    record PendingCallback(long executionId) implements ProcessorQuery {
    }

    @JsonTypeName("pending_polytone_callback")
    record PendingPolytoneCallback(long executionId) implements ProcessorQuery {
    }
}
