package com.eainde.dealflow.flow;

import com.eainde.dealflow.collaborator.CommunicationSource;
import com.eainde.dealflow.collaborator.DealStore;
import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.MonitoringOutcome;
import com.eainde.dealflow.model.RecoveryPlan;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.MonitoringState;
import com.eainde.dealflow.util.NullSafe;
import com.eainde.dealflow.workflow.StageGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health monitoring of a deal from its recent client communications.
 * <p>
 * Running out of communications is not a failure: every stage still runs on
 * an empty list and the result carries the reason there was nothing to read.
 * </p>
 */
@Slf4j
@Component
public class MonitoringFlow implements DealFlow<MonitoringState> {

    private final StageGraph<MonitoringState> graph;
    private final DealStore dealStore;
    private final CommunicationSource communicationSource;

    public MonitoringFlow(@Qualifier("monitoringWorkflow") StageGraph<MonitoringState> graph,
                          DealStore dealStore,
                          CommunicationSource communicationSource) {
        this.graph = graph;
        this.dealStore = dealStore;
        this.communicationSource = communicationSource;
    }

    @Override
    public FlowType flowType() {
        return FlowType.MONITORING;
    }

    @Override
    public StageGraph<MonitoringState> graph() {
        return graph;
    }

    @Override
    public Map<String, Object> resolveInputs(String runId, String dealId, Map<String, Object> args) {
        Deal deal = dealStore.findDeal(dealId)
                .orElseThrow(() -> new InputResolutionException("Deal not found"));

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put(DealState.RUN_ID, runId);
        inputs.put(DealState.DEAL_ID, dealId);
        inputs.put(DealState.DEAL, deal);

        List<Communication> communications;
        try {
            communications = NullSafe.list(communicationSource.recent(deal));
        } catch (RuntimeException e) {
            log.warn("Fetching communications for deal {} failed: {}", dealId, e.getMessage());
            communications = List.of();
            inputs.put(MonitoringState.NO_DATA_REASON, "Communication fetch failed: " + e.getMessage());
        }
        if (communications.isEmpty() && !inputs.containsKey(MonitoringState.NO_DATA_REASON)) {
            inputs.put(MonitoringState.NO_DATA_REASON, "No recent communications found for '"
                    + NullSafe.nvl(deal.clientName(), deal.title()) + "'");
        }
        log.info("Monitoring inputs for deal {}: {} communications", dealId, communications.size());

        inputs.put(MonitoringState.COMMUNICATIONS, communications);
        return inputs;
    }

    @Override
    public RunResult complete(String runId, String dealId, MonitoringState state) {
        Deal deal = state.getDeal();
        int baseHealth = deal != null && deal.healthScore() != null ? deal.healthScore() : 0;
        int healthScore = state.getHealthScore(baseHealth);
        RecoveryPlan recovery = state.getRecovery();

        String subject = "";
        String body = "";
        if (!recovery.recoveryEmail().isBlank()) {
            subject = recovery.subject("Re: " + (deal != null ? NullSafe.nvl(deal.title()) : ""));
            body = recovery.body();
        }

        dealStore.saveMonitoring(dealId, new MonitoringOutcome(
                healthScore,
                state.getTrend(),
                state.getOverallSentiment(),
                state.getAlerts(),
                subject,
                body,
                recovery.recoveryActions(),
                state.getAnalyzedCommunications()));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("health_score", healthScore);
        summary.put("trend", state.getTrend().value());
        summary.put("sentiment", state.getOverallSentiment());
        summary.put("alerts_generated", state.getAlerts().size());
        String noDataReason = state.getNoDataReason();
        if (!noDataReason.isEmpty()) {
            summary.put("no_data_reason", noDataReason);
            return new RunResult("Monitoring complete, no relevant communications found", summary);
        }
        return new RunResult("Monitoring complete", summary);
    }
}
