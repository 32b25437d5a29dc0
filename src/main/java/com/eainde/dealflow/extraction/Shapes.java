package com.eainde.dealflow.extraction;

import com.eainde.dealflow.model.ComplianceReport;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.model.QualificationDecision;
import com.eainde.dealflow.model.RecoveryPlan;
import com.eainde.dealflow.model.RequirementExtraction;
import com.eainde.dealflow.model.SentimentAnalysis;

/**
 * Expected reasoning outputs, one per stage that calls the reasoning service.
 */
public final class Shapes {

    public static final ExtractionShape<RequirementExtraction> REQUIREMENTS = new ExtractionShape<>(
            "requirements", "requirements", RequirementExtraction.class, note -> RequirementExtraction.empty());

    public static final ExtractionShape<GapAnalysis> GAP_ANALYSIS = new ExtractionShape<>(
            "gap analysis", "capability_match_percent", GapAnalysis.class, GapAnalysis::unavailable);

    public static final ExtractionShape<QualificationDecision> DECISION = new ExtractionShape<>(
            "decision", "recommendation", QualificationDecision.class, QualificationDecision::undecided);

    public static final ExtractionShape<SentimentAnalysis> SENTIMENT = new ExtractionShape<>(
            "sentiment", "overall_sentiment", SentimentAnalysis.class, note -> SentimentAnalysis.neutral());

    public static final ExtractionShape<RecoveryPlan> RECOVERY = new ExtractionShape<>(
            "recovery", "recovery_email", RecoveryPlan.class, note -> RecoveryPlan.none());

    private Shapes() {
    }

    /** Compliance output; unparseable responses score {@code fallbackScore}. */
    public static ExtractionShape<ComplianceReport> compliance(double fallbackScore) {
        return new ExtractionShape<>("compliance", "compliance_score", ComplianceReport.class,
                note -> ComplianceReport.manualReview(fallbackScore, note));
    }
}
