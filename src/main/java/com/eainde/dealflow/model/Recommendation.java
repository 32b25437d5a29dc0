package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Recommendation {
    GO,
    NO_GO,
    CONDITIONAL_GO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse; anything unrecognised is treated as {@link #NO_GO}. */
    @JsonCreator
    public static Recommendation from(String value) {
        if (value == null) {
            return NO_GO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Recommendation r : values()) {
            if (r.name().equals(normalized)) {
                return r;
            }
        }
        return NO_GO;
    }
}
