package com.eainde.dealflow;

import com.eainde.dealflow.collaborator.InMemoryDealStore;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.EventStatus;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.ProgressEvent;
import com.eainde.dealflow.model.ProposalOutcome;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RunStatus;
import com.eainde.dealflow.progress.ProgressStream;
import com.eainde.dealflow.reasoning.ReasoningPort;
import com.eainde.dealflow.run.RunCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class DealFlowApplicationTest {

    @Autowired
    private RunCoordinator coordinator;

    @Autowired
    private InMemoryDealStore dealStore;

    @MockBean
    private ReasoningPort reasoningPort;

    private List<ProgressEvent> awaitEnd(String runId) throws InterruptedException {
        List<ProgressEvent> events = new ArrayList<>();
        try (ProgressStream stream = coordinator.stream(runId)) {
            Optional<ProgressEvent> next;
            while ((next = stream.poll(Duration.ofSeconds(30))).isPresent()) {
                events.add(next.get());
            }
        }
        return events;
    }

    @Test
    void monitoring_shouldComplete_whenDealHasNoCommunications() throws Exception {
        dealStore.putDeal(new Deal("quiet-deal", "Data lake", "Globex", null, null, 70, 70, "proposal"));

        String runId = coordinator.start(FlowType.MONITORING, "quiet-deal", null);
        List<ProgressEvent> events = awaitEnd(runId);

        ProgressEvent last = events.get(events.size() - 1);
        assertThat(last.status()).isEqualTo(EventStatus.COMPLETED);
        assertThat(last.stageIndex()).isEqualTo(4);
        assertThat(last.payload()).containsEntry("no_data_reason", "No recent communications found for 'Globex'");
        assertThat(coordinator.status(runId).status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(dealStore.monitoringHistory("quiet-deal")).hasSize(1);
        verifyNoInteractions(reasoningPort);
    }

    @Test
    void proposal_shouldDraftAndCheckCompliance() throws Exception {
        dealStore.putDeal(new Deal("rfp-deal", "Portal", "Initech", "Customer portal", 80_000.0, 75, null, "qualification"))
                .putRequirements("rfp-deal", List.of(new Requirement("security", "SSO via SAML", "must_have", 0.9)));
        when(reasoningPort.submit(anyString(), anyInt())).thenReturn(
                "# Executive Summary\nWe deliver.\n## Security\nSAML SSO.",
                "{\"compliance_score\": 0.9, \"issues\": []}");

        String runId = coordinator.start(FlowType.PROPOSAL, "rfp-deal", Map.of());
        List<ProgressEvent> events = awaitEnd(runId);

        assertThat(events.get(events.size() - 1).status()).isEqualTo(EventStatus.COMPLETED);
        ProposalOutcome proposal = dealStore.proposals("rfp-deal").get(0);
        assertThat(proposal.title()).isEqualTo("Proposal - Initech - Portal");
        assertThat(proposal.sections()).hasSize(2);
        assertThat(proposal.compliance().complianceScore()).isEqualTo(0.9);
    }

    @Test
    void qualification_shouldFailAtStart_whenDealIsUnknown() throws Exception {
        String runId = coordinator.start(FlowType.QUALIFICATION, "no-such-deal", null);
        List<ProgressEvent> events = awaitEnd(runId);

        assertThat(events).last().satisfies(e -> {
            assertThat(e.status()).isEqualTo(EventStatus.FAILED);
            assertThat(e.stageIndex()).isZero();
            assertThat(e.totalStages()).isEqualTo(5);
        });
        assertThat(coordinator.status(runId).error()).isEqualTo("Deal not found");
    }
}
