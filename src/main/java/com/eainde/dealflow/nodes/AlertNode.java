package com.eainde.dealflow.nodes;

import com.eainde.dealflow.model.AlertSeverity;
import com.eainde.dealflow.model.AlertType;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.DealAlert;
import com.eainde.dealflow.model.SentimentScore;
import com.eainde.dealflow.state.MonitoringState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Monitoring stage 3: threshold alerts. Deterministic, no reasoning call.
 */
@Slf4j
@Component
public class AlertNode implements AsyncNodeAction<MonitoringState> {

    public static final String NAME = "alert";

    static final double SENTIMENT_DROP = -0.3;
    static final double SENTIMENT_CRITICAL = -0.6;
    static final int HEALTH_RISK = 50;
    static final double POSITIVE = 0.2;

    @Override
    public CompletableFuture<Map<String, Object>> apply(MonitoringState state) {
        List<DealAlert> alerts = detect(state.getDeal(), state.getOverallSentiment(),
                state.getHealthScore(100), state.getSentimentScores());
        log.info("{} alerts detected", alerts.size());
        return CompletableFuture.completedFuture(Map.of(MonitoringState.ALERTS, alerts));
    }

    static List<DealAlert> detect(Deal deal, double sentiment, int health, List<SentimentScore> scores) {
        String client = deal != null && deal.clientName() != null ? deal.clientName() : "client";
        List<DealAlert> alerts = new ArrayList<>();

        if (sentiment < SENTIMENT_DROP) {
            alerts.add(new DealAlert(AlertType.SENTIMENT_DROP,
                    sentiment < SENTIMENT_CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.HIGH,
                    "Negative sentiment detected for " + client,
                    String.format(Locale.ROOT, "Overall sentiment score: %.2f. Immediate attention required.",
                            sentiment)));
        }

        if (health < HEALTH_RISK) {
            alerts.add(new DealAlert(AlertType.DEADLINE_RISK, AlertSeverity.HIGH,
                    "Deal health critical: " + health + "%",
                    "Deal health has dropped to " + health + "%. Review and take action."));
        }

        // one alert per message, on its first competitor signal
        for (SentimentScore score : scores) {
            score.signals().stream()
                    .filter(signal -> signal.toLowerCase(Locale.ROOT).contains("competitor"))
                    .findFirst()
                    .ifPresent(signal -> alerts.add(new DealAlert(AlertType.COMPETITOR_MENTION, AlertSeverity.MEDIUM,
                            "Competitor mentioned in communications", signal)));
        }

        if (alerts.isEmpty() && sentiment > POSITIVE) {
            List<String> signals = scores.stream().flatMap(s -> s.signals().stream()).limit(3).toList();
            alerts.add(new DealAlert(AlertType.POSITIVE_UPDATE, AlertSeverity.INFO,
                    "Positive sentiment from " + client,
                    String.format(Locale.ROOT, "Client communication is positive (sentiment: %.2f). ", sentiment)
                            + (signals.isEmpty() ? "Good relationship signals detected." : String.join("; ", signals))));
        }
        return List.copyOf(alerts);
    }
}
