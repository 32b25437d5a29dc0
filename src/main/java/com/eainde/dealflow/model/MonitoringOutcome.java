package com.eainde.dealflow.model;

import java.util.List;

/**
 * Monitoring result for the deal store; the recovery draft is already split
 * into subject and body.
 */
public record MonitoringOutcome(
        int healthScore,
        Trend trend,
        double overallSentiment,
        List<DealAlert> alerts,
        String emailSubject,
        String emailBody,
        List<String> recoveryActions,
        List<Communication> sourceCommunications
) {
}
