package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentAnalysis(
        @JsonProperty("scores")            List<SentimentScore> scores,
        @JsonProperty("overall_sentiment") Double overallSentiment,
        @JsonProperty("key_concerns")      List<String> keyConcerns,
        @JsonProperty("positive_signals")  List<String> positiveSignals
) implements Serializable {

    public SentimentAnalysis {
        scores = NullSafe.list(scores);
        overallSentiment = NullSafe.clamp(overallSentiment != null ? overallSentiment : 0.0, -1.0, 1.0);
        keyConcerns = NullSafe.list(keyConcerns);
        positiveSignals = NullSafe.list(positiveSignals);
    }

    public static SentimentAnalysis neutral() {
        return new SentimentAnalysis(List.of(), 0.0, List.of(), List.of());
    }
}
