package com.eainde.dealflow.state;

import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.DealAlert;
import com.eainde.dealflow.model.RecoveryPlan;
import com.eainde.dealflow.model.SentimentScore;
import com.eainde.dealflow.model.Trend;

import java.util.List;
import java.util.Map;

public class MonitoringState extends DealState {

    public static final String COMMUNICATIONS = "communications";
    public static final String NO_DATA_REASON = "noDataReason";

    public static final String ANALYZED_COMMUNICATIONS = "analyzedCommunications";
    public static final String SENTIMENT_SCORES = "sentimentScores";
    public static final String OVERALL_SENTIMENT = "overallSentiment";
    public static final String KEY_CONCERNS = "keyConcerns";
    public static final String HEALTH_SCORE = "healthScore";
    public static final String TREND = "trend";
    public static final String ALERTS = "alerts";
    public static final String RECOVERY = "recovery";

    public MonitoringState(Map<String, Object> initData) {
        super(initData);
    }

    public List<Communication> getCommunications() {
        return listOf(COMMUNICATIONS);
    }

    public String getNoDataReason() {
        return stringOf(NO_DATA_REASON);
    }

    /** Communications the sentiment stage looked at, newest first. */
    public List<Communication> getAnalyzedCommunications() {
        return listOf(ANALYZED_COMMUNICATIONS);
    }

    public List<SentimentScore> getSentimentScores() {
        return listOf(SENTIMENT_SCORES);
    }

    public double getOverallSentiment() {
        return doubleOf(OVERALL_SENTIMENT, 0.0);
    }

    public List<String> getKeyConcerns() {
        return listOf(KEY_CONCERNS);
    }

    /** Health after the health stage, {@code fallback} before it ran. */
    public int getHealthScore(int fallback) {
        return intOf(HEALTH_SCORE, fallback);
    }

    public Trend getTrend() {
        return this.<Trend>value(TREND).orElse(Trend.STABLE);
    }

    public List<DealAlert> getAlerts() {
        return listOf(ALERTS);
    }

    public RecoveryPlan getRecovery() {
        return this.<RecoveryPlan>value(RECOVERY).orElse(RecoveryPlan.none());
    }
}
