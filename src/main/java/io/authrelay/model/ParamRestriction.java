package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(ParamRestriction.MustBeIncluded.class),
        @JsonSubTypes.Type(ParamRestriction.CannotBeIncluded.class),
        @JsonSubTypes.Type(ParamRestriction.MustBeValue.class)
})
public interface ParamRestriction {
    List<String> path();

    @JsonTypeName("must_be_included")
    record MustBeIncluded(List<String> path) implements ParamRestriction {
    }

    @JsonTypeName("cannot_be_included")
    record CannotBeIncluded(List<String> path) implements ParamRestriction {
    }

    @JsonTypeName("must_be_value")
    record MustBeValue(List<String> path, byte[] value) implements ParamRestriction {
    }
}
