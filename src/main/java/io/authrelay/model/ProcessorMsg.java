package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ProcessorMsg.UpdateConfig.class),
        @JsonSubTypes.Type(ProcessorMsg.EnqueueMsgs.class),
        @JsonSubTypes.Type(value = ProcessorMsg.EvictMsgs.class, names = {"evict_msgs", "remove_msgs"}),
        @JsonSubTypes.Type(value = ProcessorMsg.InsertMsgs.class, names = {"insert_msgs", "add_msgs"}),
        @JsonSubTypes.Type(ProcessorMsg.Pause.class),
        @JsonSubTypes.Type(ProcessorMsg.Resume.class),
        @JsonSubTypes.Type(ProcessorMsg.Tick.class),
        @JsonSubTypes.Type(ProcessorMsg.RetryCallback.class),
        @JsonSubTypes.Type(ProcessorMsg.RetryBridgeCreation.class),
        @JsonSubTypes.Type(ProcessorMsg.ExecuteAtomic.class),
        @JsonSubTypes.Type(ProcessorMsg.LibraryCallback.class),
        @JsonSubTypes.Type(ProcessorMsg.PolytoneCallback.class),
        @JsonSubTypes.Type(ProcessorMsg.Handle.class)
})
public interface ProcessorMsg {

    interface OwnerAction extends ProcessorMsg {
    }

    interface AuthorizationModuleAction extends ProcessorMsg {
    }

    interface PermissionlessAction extends ProcessorMsg {
    }

    interface InternalAction extends ProcessorMsg {
    }

    // null fields are left unchanged
    @JsonTypeName("update_config")
    record UpdateConfig(String authorizationContract, ProcessorDomain processorDomain) implements OwnerAction {
    }

    @JsonTypeName("enqueue_msgs")
    record EnqueueMsgs(long id, List<ProcessorMessage> msgs, Subroutine subroutine, Priority priority)
            implements AuthorizationModuleAction {
        public EnqueueMsgs {
            msgs = msgs == null ? List.of() : List.copyOf(msgs);
        }
    }

    @JsonTypeName("evict_msgs")
    record EvictMsgs(int queuePosition, Priority priority) implements AuthorizationModuleAction {
    }

    @JsonTypeName("insert_msgs")
    record InsertMsgs(long executionId, int queuePosition, Priority priority, List<ProcessorMessage> msgs,
                      Subroutine subroutine) implements AuthorizationModuleAction {
        public InsertMsgs {
            msgs = msgs == null ? List.of() : List.copyOf(msgs);
        }
    }

    @JsonTypeName("pause")
    record Pause() implements AuthorizationModuleAction {
    }

    @JsonTypeName("resume")
    record Resume() implements AuthorizationModuleAction {
    }

    @JsonTypeName("tick")
    record Tick() implements PermissionlessAction {
    }

    @JsonTypeName("retry_callback")
    record RetryCallback(long executionId) implements PermissionlessAction {
    }

    @JsonTypeName("retry_bridge_creation")
    record RetryBridgeCreation() implements PermissionlessAction {
    }

    @JsonTypeName("execute_atomic")
    record ExecuteAtomic(long executionId) implements InternalAction {
    }

    @JsonTypeName("library_callback")
    record LibraryCallback(long executionId, byte[] msg) implements InternalAction {
    }

    @JsonTypeName("callback")
    record PolytoneCallback(String initiator, byte[] initiatorMsg, PolytoneResult result) implements InternalAction {
    }

    @JsonTypeName("handle")
    record Handle(int origin, String sender, byte[] body) implements InternalAction {
    }
}
