package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Trend {
    UP,
    DOWN,
    STABLE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
