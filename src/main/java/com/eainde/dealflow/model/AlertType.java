package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    SENTIMENT_DROP,
    DEADLINE_RISK,
    COMPETITOR_MENTION,
    POSITIVE_UPDATE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
