package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where an argument goes in the outgoing request. LOCAL arguments steer the handler only. */
public enum ParamLocation {

    PATH,
    QUERY,
    BODY,
    LOCAL;

    @JsonValue
    public String yamlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParamLocation fromYaml(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
