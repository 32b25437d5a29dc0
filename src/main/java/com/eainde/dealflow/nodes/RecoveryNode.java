package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.DealAlert;
import com.eainde.dealflow.model.RecoveryPlan;
import com.eainde.dealflow.prompt.MonitoringPrompts;
import com.eainde.dealflow.state.MonitoringState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Monitoring stage 4: reply draft and internal actions. Skipped when the alert
 * stage found nothing. Positive-only alerts get a follow-up, anything else a
 * recovery email.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoveryNode implements AsyncNodeAction<MonitoringState> {

    public static final String NAME = "recovery";
    static final int MAX_OUTPUT_TOKENS = 2048;

    private final StructuredReasoning reasoning;

    @Override
    public CompletableFuture<Map<String, Object>> apply(MonitoringState state) {
        List<DealAlert> alerts = state.getAlerts();
        Map<String, Object> update = new HashMap<>();

        if (alerts.isEmpty()) {
            log.info("No alerts, recovery skipped");
            update.put(MonitoringState.RECOVERY, RecoveryPlan.none());
            return CompletableFuture.completedFuture(update);
        }

        Deal deal = state.getDeal();
        List<Communication> communications = state.getAnalyzedCommunications();
        String address = communications.stream()
                .map(Communication::from)
                .filter(from -> from != null && !from.isBlank())
                .findFirst()
                .orElse(null);
        String recipient = recipientName(address, deal != null ? deal.clientName() : null);

        String prompt = MonitoringPrompts.recovery(deal, alerts, communications, state.getOverallSentiment(),
                recipient, address);
        Extraction<RecoveryPlan> extraction = reasoning.ask(prompt, MAX_OUTPUT_TOKENS, Shapes.RECOVERY);

        update.put(MonitoringState.RECOVERY, extraction.value());
        if (extraction.degraded()) {
            update.put(MonitoringState.ERRORS, state.errorsWith(extraction.note()));
        }
        log.info("Recovery plan for {}: {} actions", recipient, extraction.value().recoveryActions().size());
        return CompletableFuture.completedFuture(update);
    }

    /**
     * {@code "Jane Doe <jane@acme.com>"} gives {@code Jane Doe}, a bare address gives
     * its local part; without a sender the client name is used.
     */
    static String recipientName(String from, String clientName) {
        if (from != null && !from.isBlank()) {
            int bracket = from.indexOf('<');
            if (bracket >= 0) {
                String name = from.substring(0, bracket).strip().replace("\"", "");
                if (!name.isEmpty()) {
                    return name;
                }
            } else {
                int at = from.indexOf('@');
                return (at > 0 ? from.substring(0, at) : from).strip();
            }
        }
        return clientName != null && !clientName.isBlank() ? clientName : "the client";
    }
}
