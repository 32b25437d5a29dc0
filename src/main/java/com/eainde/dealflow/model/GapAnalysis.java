package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

/**
 * Capability-gap assessment of the requirements against the organization and roster.
 *
 * @param capabilityMatchPercent overall coverage, forced into [0, 100]
 * @param strongAreas            areas with demonstrable coverage
 * @param gapAreas               areas with no coverage at all
 * @param riskFactors            concrete delivery risks
 * @param opportunityFactors     positive signals
 * @param resourceEstimate       team size, duration and key roles
 * @param note                   set when the assessment is a placeholder
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GapAnalysis(
        @JsonProperty("capability_match_percent") Double capabilityMatchPercent,
        @JsonProperty("strong_areas")             List<String> strongAreas,
        @JsonProperty("gap_areas")                List<String> gapAreas,
        @JsonProperty("risk_factors")             List<String> riskFactors,
        @JsonProperty("opportunity_factors")      List<String> opportunityFactors,
        @JsonProperty("resource_estimate")        ResourceEstimate resourceEstimate,
        @JsonProperty("note")                     String note
) implements Serializable {

    public GapAnalysis {
        capabilityMatchPercent = NullSafe.clamp(capabilityMatchPercent != null ? capabilityMatchPercent : 0.0, 0.0, 100.0);
        strongAreas = NullSafe.list(strongAreas);
        gapAreas = NullSafe.list(gapAreas);
        riskFactors = NullSafe.list(riskFactors);
        opportunityFactors = NullSafe.list(opportunityFactors);
        resourceEstimate = resourceEstimate != null ? resourceEstimate : ResourceEstimate.empty();
    }

    public static GapAnalysis unavailable(String note) {
        return new GapAnalysis(0.0, null, null, null, null, null, note);
    }

    public List<String> keyRoles() {
        return resourceEstimate.keyRoles();
    }
}
