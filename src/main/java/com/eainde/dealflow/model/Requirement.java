package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.Locale;

/**
 * A typed requirement extracted from deal documents.
 *
 * @param category   technical, functional, integration, security, ... (free text, lower-cased)
 * @param text       the requirement itself
 * @param priority   must_have, should_have or nice_to_have
 * @param confidence extraction confidence in [0, 1]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Requirement(
        @JsonProperty("category")   String category,
        @JsonProperty("text") @JsonAlias("requirement_text") String text,
        @JsonProperty("priority")   String priority,
        @JsonProperty("confidence") Double confidence
) implements Serializable {

    public Requirement {
        category = NullSafe.hasText(category) ? category.trim().toLowerCase(Locale.ROOT) : "general";
        text = NullSafe.nvl(text).trim();
        priority = NullSafe.hasText(priority) ? priority.trim() : "should_have";
        confidence = NullSafe.clamp(confidence != null ? confidence : 0.5, 0.0, 1.0);
    }
}
