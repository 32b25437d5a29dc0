package com.eainde.dealflow.nodes;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.Trend;
import com.eainde.dealflow.state.MonitoringState;
import com.eainde.dealflow.util.NullSafe;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Monitoring stage 2: prior health adjusted by {@code (int) (sentiment * coefficient)},
 * kept in [0, 100], and the trend against the previous score.
 */
@Slf4j
@Component
public class HealthNode implements AsyncNodeAction<MonitoringState> {

    public static final String NAME = "health";

    private final int sentimentCoefficient;
    private final int trendThreshold;
    private final int defaultHealthScore;

    public HealthNode(@Value("${dealflow.monitoring.sentiment-coefficient:15}") int sentimentCoefficient,
                      @Value("${dealflow.monitoring.trend-threshold:5}") int trendThreshold,
                      @Value("${dealflow.monitoring.default-health-score:70}") int defaultHealthScore) {
        this.sentimentCoefficient = sentimentCoefficient;
        this.trendThreshold = trendThreshold;
        this.defaultHealthScore = defaultHealthScore;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(MonitoringState state) {
        Deal deal = state.getDeal();
        int base = deal != null && deal.healthScore() != null ? deal.healthScore() : defaultHealthScore;
        int previous = deal != null && deal.previousHealthScore() != null ? deal.previousHealthScore() : base;

        int health = healthScore(base, state.getOverallSentiment());
        Trend trend = trend(health, previous);
        log.info("Health score {} -> {} ({})", base, health, trend.value());
        return CompletableFuture.completedFuture(Map.of(
                MonitoringState.HEALTH_SCORE, health,
                MonitoringState.TREND, trend));
    }

    int healthScore(int base, double sentiment) {
        int adjustment = (int) (sentiment * sentimentCoefficient);
        return NullSafe.clamp(base + adjustment, 0, 100);
    }

    Trend trend(int health, int previous) {
        if (health > previous + trendThreshold) {
            return Trend.UP;
        }
        if (health < previous - trendThreshold) {
            return Trend.DOWN;
        }
        return Trend.STABLE;
    }
}
