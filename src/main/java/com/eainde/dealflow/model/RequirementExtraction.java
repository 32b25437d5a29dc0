package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the extract stage: {@code {"requirements": [...], "entities": {...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequirementExtraction(
        @JsonProperty("requirements") List<Requirement> requirements,
        @JsonProperty("entities")     DealEntities entities
) implements Serializable {

    public RequirementExtraction {
        requirements = NullSafe.list(requirements).stream()
                .filter(r -> !r.text().isEmpty())
                .toList();
        entities = entities != null ? entities : DealEntities.empty();
    }

    public static RequirementExtraction empty() {
        return new RequirementExtraction(List.of(), DealEntities.empty());
    }
}
