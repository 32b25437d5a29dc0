package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.SentimentAnalysis;
import com.eainde.dealflow.model.SentimentScore;
import com.eainde.dealflow.prompt.MonitoringPrompts;
import com.eainde.dealflow.state.MonitoringState;
import com.eainde.dealflow.util.NullSafe;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Monitoring stage 1: recency-weighted sentiment over the latest communications.
 * <p>
 * Messages are ordered newest first (undated last) and capped. When the
 * reasoning service scores messages individually, the overall value is the
 * mean weighted by {@code decay^i} for the i-th most recent message; otherwise
 * its own overall value is taken. Either way the result lies in [-1, 1].
 * </p>
 */
@Slf4j
@Component
public class SentimentNode implements AsyncNodeAction<MonitoringState> {

    public static final String NAME = "sentiment";
    static final int MAX_OUTPUT_TOKENS = 2048;

    private final StructuredReasoning reasoning;
    private final double recencyDecay;
    private final int maxCommunications;

    public SentimentNode(StructuredReasoning reasoning,
                         @Value("${dealflow.monitoring.recency-decay:0.6}") double recencyDecay,
                         @Value("${dealflow.monitoring.max-communications:10}") int maxCommunications) {
        this.reasoning = reasoning;
        this.recencyDecay = recencyDecay;
        this.maxCommunications = maxCommunications;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(MonitoringState state) {
        List<Communication> analyzed = newestFirst(state.getCommunications()).stream()
                .limit(maxCommunications)
                .toList();
        Map<String, Object> update = new HashMap<>();
        update.put(MonitoringState.ANALYZED_COMMUNICATIONS, analyzed);

        if (analyzed.isEmpty()) {
            log.info("No communications to analyze");
            update.put(MonitoringState.SENTIMENT_SCORES, List.of());
            update.put(MonitoringState.OVERALL_SENTIMENT, 0.0);
            update.put(MonitoringState.KEY_CONCERNS, List.of());
            return CompletableFuture.completedFuture(update);
        }

        Extraction<SentimentAnalysis> extraction = reasoning.ask(
                MonitoringPrompts.sentiment(state.getDeal(), analyzed), MAX_OUTPUT_TOKENS, Shapes.SENTIMENT);
        SentimentAnalysis analysis = extraction.value();
        double overall = overallSentiment(analysis, analyzed.size(), recencyDecay);

        update.put(MonitoringState.SENTIMENT_SCORES, analysis.scores());
        update.put(MonitoringState.OVERALL_SENTIMENT, overall);
        update.put(MonitoringState.KEY_CONCERNS, analysis.keyConcerns());
        if (extraction.degraded()) {
            update.put(MonitoringState.ERRORS, state.errorsWith(extraction.note()));
        }
        log.info("Sentiment over {} communications: {} (service said {})",
                analyzed.size(), overall, analysis.overallSentiment());
        return CompletableFuture.completedFuture(update);
    }

    public static List<Communication> newestFirst(List<Communication> communications) {
        List<Communication> sorted = new ArrayList<>(communications);
        sorted.sort(Comparator.comparing(Communication::receivedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return List.copyOf(sorted);
    }

    /**
     * Recency-weighted mean of the per-message scores. A score's position is its
     * {@code index} when that is a valid message position, else its list position.
     */
    static double overallSentiment(SentimentAnalysis analysis, int messageCount, double decay) {
        List<SentimentScore> scores = analysis.scores();
        if (scores.isEmpty()) {
            return NullSafe.clamp(analysis.overallSentiment(), -1.0, 1.0);
        }
        double weighted = 0.0;
        double weights = 0.0;
        for (int i = 0; i < scores.size(); i++) {
            SentimentScore score = scores.get(i);
            int position = score.index() >= 0 && score.index() < messageCount ? score.index() : i;
            double weight = Math.pow(decay, position);
            weighted += weight * score.sentiment();
            weights += weight;
        }
        return NullSafe.clamp(weights > 0 ? weighted / weights : 0.0, -1.0, 1.0);
    }
}
