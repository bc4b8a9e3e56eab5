package io.authrelay.model;

import java.util.List;

public record Message(String name, List<ParamRestriction> paramsRestrictions) {
    public Message {
        paramsRestrictions = paramsRestrictions == null ? List.of() : List.copyOf(paramsRestrictions);
    }
}
