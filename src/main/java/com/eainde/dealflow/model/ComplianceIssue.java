package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplianceIssue(
        @JsonProperty("requirement_index") int requirementIndex,
        @JsonProperty("requirement_text")  String requirementText,
        @JsonProperty("status")            ComplianceStatus status,
        @JsonProperty("notes")             String notes
) implements Serializable {

    public ComplianceIssue {
        requirementText = NullSafe.nvl(requirementText);
        status = status != null ? status : ComplianceStatus.PARTIALLY_ADDRESSED;
        notes = NullSafe.nvl(notes);
    }
}
