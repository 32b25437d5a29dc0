package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ComplianceStatus {
    ADDRESSED,
    PARTIALLY_ADDRESSED,
    NOT_ADDRESSED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse; unknown tags count as {@link #PARTIALLY_ADDRESSED}. */
    @JsonCreator
    public static ComplianceStatus from(String value) {
        if (value == null) {
            return PARTIALLY_ADDRESSED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ComplianceStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return PARTIALLY_ADDRESSED;
    }
}
