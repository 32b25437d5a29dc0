package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.ComplianceReport;
import com.eainde.dealflow.model.ComplianceStatus;
import com.eainde.dealflow.prompt.ProposalPrompts;
import com.eainde.dealflow.state.ProposalState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Proposal stage 3: how well the draft covers each requirement.
 */
@Slf4j
@Component
public class ComplyNode implements AsyncNodeAction<ProposalState> {

    public static final String NAME = "comply";
    static final int MAX_OUTPUT_TOKENS = 2048;

    private final StructuredReasoning reasoning;
    private final double fallbackScore;
    private final int draftChars;

    public ComplyNode(StructuredReasoning reasoning,
                      @Value("${dealflow.proposal.fallback-compliance-score:0.5}") double fallbackScore,
                      @Value("${dealflow.proposal.compliance-draft-chars:10000}") int draftChars) {
        this.reasoning = reasoning;
        this.fallbackScore = fallbackScore;
        this.draftChars = draftChars;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProposalState state) {
        Map<String, Object> update = new HashMap<>();

        if (state.getRequirements().isEmpty()) {
            update.put(ProposalState.COMPLIANCE, ComplianceReport.fullyCompliant());
            return CompletableFuture.completedFuture(update);
        }
        if (state.getDraft().isBlank()) {
            String note = "No proposal draft to check; manual review required";
            update.put(ProposalState.COMPLIANCE, ComplianceReport.manualReview(0.0, note));
            update.put(ProposalState.ERRORS, state.errorsWith(note));
            return CompletableFuture.completedFuture(update);
        }

        String prompt = ProposalPrompts.compliance(state.getDraft(), state.getRequirements(), draftChars);
        Extraction<ComplianceReport> extraction = reasoning.ask(prompt, MAX_OUTPUT_TOKENS,
                Shapes.compliance(fallbackScore));
        ComplianceReport report = extraction.value();

        update.put(ProposalState.COMPLIANCE, report);
        if (extraction.degraded()) {
            update.put(ProposalState.ERRORS, state.errorsWith(extraction.note()));
        }
        long open = report.issues().stream().filter(i -> i.status() != ComplianceStatus.ADDRESSED).count();
        log.info("Compliance check complete: score {}, {} of {} issues open",
                report.complianceScore(), open, report.issues().size());
        return CompletableFuture.completedFuture(update);
    }
}
