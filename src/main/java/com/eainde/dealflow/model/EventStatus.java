package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
