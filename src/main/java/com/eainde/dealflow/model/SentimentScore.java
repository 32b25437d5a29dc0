package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentScore(
        @JsonProperty("index")     int index,
        @JsonProperty("sentiment") Double sentiment,
        @JsonProperty("signals")   List<String> signals,
        @JsonProperty("summary")   String summary
) implements Serializable {

    public SentimentScore {
        sentiment = NullSafe.clamp(sentiment != null ? sentiment : 0.0, -1.0, 1.0);
        signals = NullSafe.list(signals);
        summary = NullSafe.nvl(summary);
    }
}
