package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.ResilientExtractor;
import com.eainde.dealflow.model.AlertSeverity;
import com.eainde.dealflow.model.AlertType;
import com.eainde.dealflow.model.Communication;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.DealAlert;
import com.eainde.dealflow.model.RecoveryPlan;
import com.eainde.dealflow.reasoning.ReasoningPort;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.MonitoringState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecoveryNodeTest {

    private static final Deal DEAL = new Deal("d1", "Portal rebuild", "Acme", null, 120_000.0, 55, null, "proposal");

    @Mock
    private ReasoningPort reasoningPort;

    private RecoveryNode node;

    @BeforeEach
    void setUp() {
        node = new RecoveryNode(new StructuredReasoning(reasoningPort, new ResilientExtractor(new ObjectMapper())));
    }

    @Test
    void apply_shouldReturnEmptyPlan_whenThereAreNoAlerts() {
        MonitoringState state = new MonitoringState(Map.of(DealState.DEAL, DEAL, MonitoringState.ALERTS, List.of()));

        Map<String, Object> update = node.apply(state).join();

        assertThat(((RecoveryPlan) update.get(MonitoringState.RECOVERY)).isEmpty()).isTrue();
        verifyNoInteractions(reasoningPort);
    }

    @Test
    void apply_shouldDraftRecoveryEmail_toMostRecentSender() {
        DealAlert drop = new DealAlert(AlertType.SENTIMENT_DROP, AlertSeverity.CRITICAL,
                "Negative sentiment detected for Acme", "Overall sentiment score: -0.70.");
        Communication latest = new Communication("email", "Jane Doe <jane@acme.com>", "Delays",
                Instant.parse("2024-03-05T10:00:00Z"), "We are worried about the delays.");
        when(reasoningPort.submit(anyString(), anyInt())).thenReturn("""
                ```json
                {"recovery_email": "Subject: Getting back on track\\n\\nDear Jane,\\n\\nThank you.",
                 "recovery_actions": ["Call Jane", "Share revised plan"]}
                ```
                """);
        MonitoringState state = new MonitoringState(Map.of(
                DealState.DEAL, DEAL,
                MonitoringState.ALERTS, List.of(drop),
                MonitoringState.ANALYZED_COMMUNICATIONS, List.of(latest),
                MonitoringState.OVERALL_SENTIMENT, -0.7));

        Map<String, Object> update = node.apply(state).join();

        RecoveryPlan plan = (RecoveryPlan) update.get(MonitoringState.RECOVERY);
        assertThat(plan.recoveryActions()).containsExactly("Call Jane", "Share revised plan");
        assertThat(plan.subject("fallback")).isEqualTo("Getting back on track");
        assertThat(plan.body()).startsWith("Dear Jane,");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningPort).submit(prompt.capture(), anyInt());
        assertThat(prompt.getValue()).contains("recovery email to Jane Doe").contains("RECIPIENT: Jane Doe at Jane Doe <jane@acme.com>");
    }

    @Test
    void apply_shouldWriteFollowUp_whenAllAlertsArePositive() {
        DealAlert positive = new DealAlert(AlertType.POSITIVE_UPDATE, AlertSeverity.INFO, "Positive sentiment from Acme", "Good");
        when(reasoningPort.submit(anyString(), anyInt()))
                .thenReturn("{\"recovery_email\": \"Thanks!\", \"recovery_actions\": []}");
        MonitoringState state = new MonitoringState(Map.of(DealState.DEAL, DEAL, MonitoringState.ALERTS, List.of(positive)));

        node.apply(state).join();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningPort).submit(prompt.capture(), anyInt());
        assertThat(prompt.getValue()).contains("POSITIVE messages").contains("reply to Acme");
    }

    @Test
    void recipientName_shouldPreferDisplayName_thenLocalPart_thenClient() {
        assertThat(RecoveryNode.recipientName("\"Jane Doe\" <jane@acme.com>", "Acme")).isEqualTo("Jane Doe");
        assertThat(RecoveryNode.recipientName("jane.doe@acme.com", "Acme")).isEqualTo("jane.doe");
        assertThat(RecoveryNode.recipientName(null, "Acme")).isEqualTo("Acme");
        assertThat(RecoveryNode.recipientName("", null)).isEqualTo("the client");
    }
}
