package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FlowType {
    QUALIFICATION,
    PROPOSAL,
    MONITORING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FlowType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Flow type is required");
        }
        for (FlowType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown flow type: " + value);
    }
}
