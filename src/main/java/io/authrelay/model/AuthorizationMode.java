package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(AuthorizationMode.Permissionless.class),
        @JsonSubTypes.Type(AuthorizationMode.Permissioned.class)
})
public interface AuthorizationMode {

    @JsonTypeName("permissionless")
    record Permissionless() implements AuthorizationMode {
    }

    @JsonTypeName("permissioned")
    record Permissioned(PermissionType permissionType) implements AuthorizationMode {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    @JsonSubTypes({
            @JsonSubTypes.Type(PermissionType.WithCallLimit.class),
            @JsonSubTypes.Type(PermissionType.WithoutCallLimit.class)
    })
    interface PermissionType {
        Map<String, Long> initialTokens();

        @JsonTypeName("with_call_limit")
        record WithCallLimit(Map<String, Long> callLimits) implements PermissionType {
            public WithCallLimit {
                callLimits = callLimits == null ? Map.of() : new LinkedHashMap<>(callLimits);
            }

            @Override
            public Map<String, Long> initialTokens() {
                return callLimits;
            }
        }

        @JsonTypeName("without_call_limit")
        record WithoutCallLimit(List<String> addresses) implements PermissionType {
            public WithoutCallLimit {
                addresses = addresses == null ? List.of() : List.copyOf(addresses);
            }

            @Override
            public Map<String, Long> initialTokens() {
                Map<String, Long> out = new LinkedHashMap<>();
                for (String address : addresses) {
                    out.put(address, 1L);
                }
                return out;
            }
        }
    }
}
