package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(RegistryQuery.Ownership.class),
        @JsonSubTypes.Type(RegistryQuery.SubOwners.class),
        @JsonSubTypes.Type(RegistryQuery.Processor.class),
        @JsonSubTypes.Type(RegistryQuery.ExternalDomains.class),
        @JsonSubTypes.Type(RegistryQuery.ExternalDomainByName.class),
        @JsonSubTypes.Type(RegistryQuery.Authorizations.class),
        @JsonSubTypes.Type(RegistryQuery.ProcessorCallbacks.class),
        @JsonSubTypes.Type(RegistryQuery.ProcessorCallback.class),
        @JsonSubTypes.Type(RegistryQuery.PermissionTokens.class),
        @JsonSubTypes.Type(RegistryQuery.CurrentExecutions.class)
})
public interface RegistryQuery {

    @JsonTypeName("ownership")
    record Ownership() implements RegistryQuery {
    }

    @JsonTypeName("sub_owners")
    record SubOwners() implements RegistryQuery {
    }

    @JsonTypeName("processor")
    record Processor() implements RegistryQuery {
    }

    @JsonTypeName("external_domains")
    record ExternalDomains(String startAfter, Integer limit) implements RegistryQuery {
    }

    @JsonTypeName("external_domain")
    record ExternalDomainByName(String name) implements RegistryQuery {
    }

    @JsonTypeName("authorizations")
    record Authorizations(String startAfter, Integer limit) implements RegistryQuery {
    }

    @JsonTypeName("processor_callbacks")
    record ProcessorCallbacks(Long startAfter, Integer limit) implements RegistryQuery {
    }

    @JsonTypeName("processor_callback")
    record ProcessorCallback(long executionId) implements RegistryQuery {
    }

    @JsonTypeName("permission_tokens")
    record PermissionTokens(String label, String address) implements RegistryQuery {
    }

    @JsonTypeName("current_executions")
    record CurrentExecutions(String label) implements RegistryQuery {
    }

    record OwnershipInfo(String owner, String pendingOwner) {
    }
}
