package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QualificationDecision(
        @JsonProperty("recommendation")   Recommendation recommendation,
        @JsonProperty("confidence_score") Double confidenceScore,
        @JsonProperty("positive_factors") List<String> positiveFactors,
        @JsonProperty("risk_factors")     List<String> riskFactors,
        @JsonProperty("conditions")       List<String> conditions,
        @JsonProperty("reasoning")        String reasoning
) implements Serializable {

    public QualificationDecision {
        recommendation = recommendation != null ? recommendation : Recommendation.NO_GO;
        confidenceScore = NullSafe.clamp(confidenceScore != null ? confidenceScore : 0.5, 0.0, 1.0);
        positiveFactors = NullSafe.list(positiveFactors);
        riskFactors = NullSafe.list(riskFactors);
        conditions = NullSafe.list(conditions);
        reasoning = NullSafe.nvl(reasoning);
    }

    public static QualificationDecision undecided(String reasoning) {
        return new QualificationDecision(Recommendation.NO_GO, 0.0, null, null, null, reasoning);
    }
}
