package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Reply draft and internal action items produced by the recovery stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecoveryPlan(
        @JsonProperty("recovery_email")   String recoveryEmail,
        @JsonProperty("recovery_actions") List<String> recoveryActions
) implements Serializable {

    private static final String SUBJECT_PREFIX = "subject:";

    public RecoveryPlan {
        recoveryEmail = NullSafe.nvl(recoveryEmail);
        recoveryActions = NullSafe.list(recoveryActions);
    }

    public static RecoveryPlan none() {
        return new RecoveryPlan("", List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return recoveryEmail.isBlank() && recoveryActions.isEmpty();
    }

    /**
     * Subject taken from a leading {@code Subject:} line, else {@code fallback}.
     */
    public String subject(String fallback) {
        String firstLine = firstLine();
        if (firstLine.toLowerCase(Locale.ROOT).startsWith(SUBJECT_PREFIX)) {
            return firstLine.substring(SUBJECT_PREFIX.length()).trim();
        }
        return fallback;
    }

    /** Draft text without the leading {@code Subject:} line. */
    public String body() {
        String trimmed = recoveryEmail.strip();
        if (firstLine().toLowerCase(Locale.ROOT).startsWith(SUBJECT_PREFIX)) {
            int newline = trimmed.indexOf('\n');
            return newline < 0 ? "" : trimmed.substring(newline + 1).strip();
        }
        return recoveryEmail;
    }

    private String firstLine() {
        String trimmed = recoveryEmail.strip();
        int newline = trimmed.indexOf('\n');
        return (newline < 0 ? trimmed : trimmed.substring(0, newline)).trim();
    }
}
