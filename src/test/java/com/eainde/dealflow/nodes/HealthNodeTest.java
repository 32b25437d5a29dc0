package com.eainde.dealflow.nodes;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.Trend;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.MonitoringState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HealthNodeTest {

    private final HealthNode node = new HealthNode(15, 5, 70);

    private static Deal deal(Integer health, Integer previous) {
        return new Deal("d1", "Portal rebuild", "Acme", null, 250_000.0, health, previous, "qualification");
    }

    @Test
    void healthScore_shouldAddTruncatedSentimentAdjustment() {
        assertThat(node.healthScore(70, 0.4)).isEqualTo(76);
        assertThat(node.healthScore(70, -0.5)).isEqualTo(63);
    }

    @Test
    void healthScore_shouldClampToZeroAndHundred() {
        assertThat(node.healthScore(95, 1.0)).isEqualTo(100);
        assertThat(node.healthScore(5, -1.0)).isZero();
    }

    @Test
    void trend_shouldNeedMoreThanThresholdToMove() {
        assertThat(node.trend(76, 70)).isEqualTo(Trend.UP);
        assertThat(node.trend(75, 70)).isEqualTo(Trend.STABLE);
        assertThat(node.trend(64, 70)).isEqualTo(Trend.DOWN);
        assertThat(node.trend(65, 70)).isEqualTo(Trend.STABLE);
    }

    @Test
    void apply_shouldScoreFromDealHealth_andTrendAgainstIt() {
        MonitoringState state = new MonitoringState(Map.of(
                DealState.DEAL, deal(70, null),
                MonitoringState.OVERALL_SENTIMENT, 0.4));

        Map<String, Object> update = node.apply(state).join();

        assertThat(update).containsEntry(MonitoringState.HEALTH_SCORE, 76)
                .containsEntry(MonitoringState.TREND, Trend.UP);
    }

    @Test
    void apply_shouldUseDefaultHealth_whenDealHasNone() {
        MonitoringState state = new MonitoringState(Map.of(
                DealState.DEAL, deal(null, null),
                MonitoringState.OVERALL_SENTIMENT, 0.0));

        Map<String, Object> update = node.apply(state).join();

        assertThat(update).containsEntry(MonitoringState.HEALTH_SCORE, 70)
                .containsEntry(MonitoringState.TREND, Trend.STABLE);
    }

    @Test
    void apply_shouldHonourConfiguredCoefficient() {
        HealthNode steep = new HealthNode(30, 5, 70);
        MonitoringState state = new MonitoringState(Map.of(
                DealState.DEAL, deal(60, 60),
                MonitoringState.OVERALL_SENTIMENT, -0.5));

        assertThat(steep.apply(state).join()).containsEntry(MonitoringState.HEALTH_SCORE, 45)
                .containsEntry(MonitoringState.TREND, Trend.DOWN);
    }
}
