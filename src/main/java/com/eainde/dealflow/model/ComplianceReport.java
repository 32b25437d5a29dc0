package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

/**
 * Coverage of the input requirements by a generated proposal.
 *
 * @param complianceScore overall coverage, forced into [0, 1]
 * @param issues          per-requirement status tags
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplianceReport(
        @JsonProperty("compliance_score") Double complianceScore,
        @JsonProperty("issues") @JsonAlias("compliance_issues") List<ComplianceIssue> issues
) implements Serializable {

    public ComplianceReport {
        complianceScore = NullSafe.clamp(complianceScore != null ? complianceScore : 0.0, 0.0, 1.0);
        issues = NullSafe.list(issues);
    }

    public static ComplianceReport fullyCompliant() {
        return new ComplianceReport(1.0, List.of());
    }

    public static ComplianceReport manualReview(double score, String notes) {
        return new ComplianceReport(score, List.of(new ComplianceIssue(0, "Automated compliance check",
                ComplianceStatus.PARTIALLY_ADDRESSED, notes)));
    }
}
