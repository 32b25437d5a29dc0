package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DealEntities(
        @JsonProperty("client_name")            String clientName,
        @JsonProperty("project_name")           String projectName,
        @JsonProperty("budget_range")           String budgetRange,
        @JsonProperty("timeline")               String timeline,
        @JsonProperty("deadline")               String deadline,
        @JsonProperty("key_stakeholders")       List<String> keyStakeholders,
        @JsonProperty("industry")               String industry,
        @JsonProperty("technologies_mentioned") List<String> technologiesMentioned
) implements Serializable {

    public DealEntities {
        keyStakeholders = NullSafe.list(keyStakeholders);
        technologiesMentioned = NullSafe.list(technologiesMentioned);
    }

    public static DealEntities empty() {
        return new DealEntities(null, null, null, null, null, null, null, null);
    }
}
