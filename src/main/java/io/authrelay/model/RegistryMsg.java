package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(RegistryMsg.TransferOwnership.class),
        @JsonSubTypes.Type(RegistryMsg.AcceptOwnership.class),
        @JsonSubTypes.Type(RegistryMsg.RenounceOwnership.class),
        @JsonSubTypes.Type(RegistryMsg.AddSubOwner.class),
        @JsonSubTypes.Type(RegistryMsg.RemoveSubOwner.class),
        @JsonSubTypes.Type(RegistryMsg.AddExternalDomains.class),
        @JsonSubTypes.Type(RegistryMsg.CreateAuthorizations.class),
        @JsonSubTypes.Type(RegistryMsg.ModifyAuthorization.class),
        @JsonSubTypes.Type(RegistryMsg.DisableAuthorization.class),
        @JsonSubTypes.Type(RegistryMsg.EnableAuthorization.class),
        @JsonSubTypes.Type(RegistryMsg.MintAuthorizations.class),
        @JsonSubTypes.Type(value = RegistryMsg.EvictMsgs.class, names = {"evict_msgs", "remove_msgs"}),
        @JsonSubTypes.Type(value = RegistryMsg.InsertMsgs.class, names = {"insert_msgs", "add_msgs"}),
        @JsonSubTypes.Type(RegistryMsg.PauseProcessor.class),
        @JsonSubTypes.Type(RegistryMsg.ResumeProcessor.class),
        @JsonSubTypes.Type(RegistryMsg.SendMsgs.class),
        @JsonSubTypes.Type(RegistryMsg.RetryMsgs.class),
        @JsonSubTypes.Type(RegistryMsg.RetryBridgeCreation.class),
        @JsonSubTypes.Type(RegistryMsg.ProcessorCallback.class),
        @JsonSubTypes.Type(RegistryMsg.PolytoneCallback.class),
        @JsonSubTypes.Type(RegistryMsg.Handle.class)
})
public interface RegistryMsg {

    interface OwnershipAction extends RegistryMsg {
    }

    interface OwnerAction extends RegistryMsg {
    }

    interface PermissionedAction extends RegistryMsg {
    }

    interface PermissionlessAction extends RegistryMsg {
    }

    interface InternalAction extends RegistryMsg {
    }

    @JsonTypeName("transfer_ownership")
    record TransferOwnership(String newOwner) implements OwnershipAction {
    }

    @JsonTypeName("accept_ownership")
    record AcceptOwnership() implements OwnershipAction {
    }

    @JsonTypeName("renounce_ownership")
    record RenounceOwnership() implements OwnershipAction {
    }

    @JsonTypeName("add_sub_owner")
    record AddSubOwner(String subOwner) implements OwnerAction {
    }

    @JsonTypeName("remove_sub_owner")
    record RemoveSubOwner(String subOwner) implements OwnerAction {
    }

    @JsonTypeName("add_external_domains")
    record AddExternalDomains(List<ExternalDomainInfo> externalDomains) implements PermissionedAction {
        public AddExternalDomains {
            externalDomains = externalDomains == null ? List.of() : List.copyOf(externalDomains);
        }
    }

    @JsonTypeName("create_authorizations")
    record CreateAuthorizations(List<AuthorizationInfo> authorizations) implements PermissionedAction {
        public CreateAuthorizations {
            authorizations = authorizations == null ? List.of() : List.copyOf(authorizations);
        }
    }

    // null fields are left unchanged
    @JsonTypeName("modify_authorization")
    record ModifyAuthorization(
            String label,
            Expiration notBefore,
            Expiration expiration,
            Long maxConcurrentExecutions,
            Priority priority
    ) implements PermissionedAction {
    }

    @JsonTypeName("disable_authorization")
    record DisableAuthorization(String label) implements PermissionedAction {
    }

    @JsonTypeName("enable_authorization")
    record EnableAuthorization(String label) implements PermissionedAction {
    }

    @JsonTypeName("mint_authorizations")
    record MintAuthorizations(String label, List<Mint> mints) implements PermissionedAction {
        public MintAuthorizations {
            mints = mints == null ? List.of() : List.copyOf(mints);
        }
    }

    @JsonTypeName("evict_msgs")
    record EvictMsgs(Domain domain, int queuePosition, Priority priority) implements PermissionedAction {
    }

    @JsonTypeName("insert_msgs")
    record InsertMsgs(String label, int queuePosition, Priority priority, List<ProcessorMessage> messages)
            implements PermissionedAction {
        public InsertMsgs {
            messages = messages == null ? List.of() : List.copyOf(messages);
        }
    }

    @JsonTypeName("pause_processor")
    record PauseProcessor(Domain domain) implements PermissionedAction {
    }

    @JsonTypeName("resume_processor")
    record ResumeProcessor(Domain domain) implements PermissionedAction {
    }

    @JsonTypeName("send_msgs")
    record SendMsgs(String label, List<ProcessorMessage> messages, Expiration ttl) implements PermissionlessAction {
        public SendMsgs {
            messages = messages == null ? List.of() : List.copyOf(messages);
        }
    }

    @JsonTypeName("retry_msgs")
    record RetryMsgs(long executionId) implements PermissionlessAction {
    }

    @JsonTypeName("retry_bridge_creation")
    record RetryBridgeCreation(String domainName) implements PermissionlessAction {
    }

    @JsonTypeName("processor_callback")
    record ProcessorCallback(long executionId, ExecutionResult executionResult) implements InternalAction {
    }

    @JsonTypeName("callback")
    record PolytoneCallback(String initiator, byte[] initiatorMsg, PolytoneResult result) implements InternalAction {
    }

    @JsonTypeName("handle")
    record Handle(int origin, String sender, byte[] body) implements InternalAction {
    }
}
