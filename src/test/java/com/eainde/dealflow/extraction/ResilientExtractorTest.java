package com.eainde.dealflow.extraction;

import com.eainde.dealflow.model.ComplianceReport;
import com.eainde.dealflow.model.ComplianceStatus;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.model.QualificationDecision;
import com.eainde.dealflow.model.Recommendation;
import com.eainde.dealflow.model.RequirementExtraction;
import com.eainde.dealflow.model.SentimentAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ResilientExtractorTest {

    private final ResilientExtractor extractor = new ResilientExtractor(new ObjectMapper());

    @Nested
    @DisplayName("parse chain")
    class Chain {

        @Test
        void extract_shouldUseLabelledFence_whenJsonFencePresent() {
            String raw = """
                    Here is the analysis.
                    ```json
                    {"recommendation": "go", "confidence_score": 0.82, "reasoning": "Strong fit"}
                    ```
                    """;

            Extraction<QualificationDecision> result = extractor.extract(raw, Shapes.DECISION);

            assertThat(result.degraded()).isFalse();
            assertThat(result.strategy()).isEqualTo(ParseStrategies.LABELLED_FENCE);
            assertThat(result.value().recommendation()).isEqualTo(Recommendation.GO);
            assertThat(result.value().confidenceScore()).isEqualTo(0.82);
        }

        @Test
        void extract_shouldUseAnyFence_whenFenceIsUnlabelled() {
            String raw = "```\n{\"overall_sentiment\": -0.3, \"key_concerns\": [\"pricing\"]}\n```";

            Extraction<SentimentAnalysis> result = extractor.extract(raw, Shapes.SENTIMENT);

            assertThat(result.strategy()).isEqualTo(ParseStrategies.ANY_FENCE);
            assertThat(result.value().overallSentiment()).isEqualTo(-0.3);
            assertThat(result.value().keyConcerns()).containsExactly("pricing");
        }

        @Test
        void extract_shouldFindMarkerObject_whenJsonIsEmbeddedInProse() {
            String raw = "Sure! {\"note\": \"ignore me\"} and the result is "
                    + "{\"recommendation\": \"conditional go\", \"confidence_score\": 1.7} hope that helps";

            Extraction<QualificationDecision> result = extractor.extract(raw, Shapes.DECISION);

            assertThat(result.strategy()).isEqualTo(ParseStrategies.MARKER_OBJECT);
            assertThat(result.value().recommendation()).isEqualTo(Recommendation.CONDITIONAL_GO);
            assertThat(result.value().confidenceScore()).isEqualTo(1.0);
        }

        @Test
        void extract_shouldParseWholeText_whenResponseIsBareJson() {
            String raw = "  {\"capability_match_percent\": 140, \"strong_areas\": [\"java\"]}  ";

            Extraction<GapAnalysis> result = extractor.extract(raw, Shapes.GAP_ANALYSIS);

            assertThat(result.degraded()).isFalse();
            assertThat(result.value().capabilityMatchPercent()).isEqualTo(100.0);
            assertThat(result.value().strongAreas()).containsExactly("java");
        }

        @Test
        void extract_shouldRepairTruncatedFence_whenOutputWasCutOff() {
            String raw = "```json\n{\"requirements\": [{\"category\": \"security\", \"text\": \"SSO via SAML\"}, "
                    + "{\"category\": \"technical\", \"text\": \"Audit lo";

            Extraction<RequirementExtraction> result = extractor.extract(raw, Shapes.REQUIREMENTS);

            assertThat(result.degraded()).isFalse();
            assertThat(result.value().requirements()).hasSize(1);
            assertThat(result.value().requirements().get(0).text()).isEqualTo("SSO via SAML");
        }

        @Test
        void extract_shouldSkipObjectsWithoutMarker_whenFenceHoldsOtherJson() {
            String raw = "```json\n{\"summary\": \"n/a\"}\n```\nFinal: {\"compliance_score\": 0.9, \"issues\": []}";

            Extraction<ComplianceReport> result = extractor.extract(raw, Shapes.compliance(0.5));

            assertThat(result.strategy()).isEqualTo(ParseStrategies.MARKER_OBJECT);
            assertThat(result.value().complianceScore()).isEqualTo(0.9);
        }

        @Test
        void extract_shouldTryNextStrategy_whenAStrategyThrows() {
            ParseStrategy broken = new ParseStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public Optional<com.fasterxml.jackson.databind.JsonNode> parse(String text, String marker) {
                    throw new IllegalStateException("boom");
                }
            };
            ObjectMapper mapper = new ObjectMapper();
            ResilientExtractor chain = new ResilientExtractor(mapper, List.of(broken, ParseStrategies.wholeText(mapper)));

            Extraction<QualificationDecision> result = chain.extract("{\"recommendation\": \"no_go\"}", Shapes.DECISION);

            assertThat(result.strategy()).isEqualTo(ParseStrategies.WHOLE_TEXT);
            assertThat(result.value().recommendation()).isEqualTo(Recommendation.NO_GO);
        }
    }

    @Nested
    @DisplayName("fallbacks")
    class Fallbacks {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "I could not analyse this document.", "```json\n", "{{{{", "```json\n{\"a\": [1, 2"})
        void extract_shouldNeverThrow_whenInputIsGarbage(String raw) {
            assertThatCode(() -> extractor.extract(raw, Shapes.DECISION)).doesNotThrowAnyException();

            Extraction<QualificationDecision> result = extractor.extract(raw, Shapes.DECISION);

            assertThat(result.degraded()).isTrue();
            assertThat(result.strategy()).isEqualTo(Extraction.FALLBACK);
            assertThat(result.value().recommendation()).isEqualTo(Recommendation.NO_GO);
            assertThat(result.note()).contains("manual review required");
        }

        @Test
        void extract_shouldReturnEmptyDefault_whenInputIsNull() {
            Extraction<RequirementExtraction> result = extractor.extract(null, Shapes.REQUIREMENTS);

            assertThat(result.degraded()).isTrue();
            assertThat(result.value().requirements()).isEmpty();
        }

        @Test
        void extract_shouldReturnManualReviewReport_whenComplianceIsUnparseable() {
            Extraction<ComplianceReport> result = extractor.extract("The proposal looks fine to me.", Shapes.compliance(0.5));

            assertThat(result.degraded()).isTrue();
            assertThat(result.value().complianceScore()).isEqualTo(0.5);
            assertThat(result.value().issues()).singleElement()
                    .satisfies(issue -> assertThat(issue.status()).isEqualTo(ComplianceStatus.PARTIALLY_ADDRESSED));
        }

        @Test
        void unavailable_shouldCarryReason_whenReasoningCallFailed() {
            Extraction<GapAnalysis> result = extractor.unavailable(Shapes.GAP_ANALYSIS, "Reasoning service unavailable");

            assertThat(result.degraded()).isTrue();
            assertThat(result.note()).isEqualTo("Reasoning service unavailable");
            assertThat(result.value().note()).isEqualTo("Reasoning service unavailable");
            assertThat(result.value().capabilityMatchPercent()).isZero();
        }
    }
}
