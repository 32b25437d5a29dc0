package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.prompt.QualificationPrompts;
import com.eainde.dealflow.state.QualificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Qualification stage 3: capability-gap assessment against the organization
 * profile and the roster.
 */
@Slf4j
@Component
public class AnalyzeNode implements AsyncNodeAction<QualificationState> {

    public static final String NAME = "analyze";
    static final int MAX_OUTPUT_TOKENS = 2048;

    private final StructuredReasoning reasoning;
    private final int rosterPromptLimit;

    public AnalyzeNode(StructuredReasoning reasoning,
                       @Value("${dealflow.qualification.roster-prompt-limit:20}") int rosterPromptLimit) {
        this.reasoning = reasoning;
        this.rosterPromptLimit = rosterPromptLimit;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(QualificationState state) {
        Map<String, Object> update = new HashMap<>();

        if (state.getRequirements().isEmpty()) {
            String note = "No requirements extracted; gap analysis skipped";
            update.put(QualificationState.GAP_ANALYSIS, GapAnalysis.unavailable(note));
            update.put(QualificationState.ERRORS, state.errorsWith(note));
            return CompletableFuture.completedFuture(update);
        }

        String prompt = QualificationPrompts.gapAnalysis(state.getRequirements(), state.getEntities(),
                state.getProfile(), state.getRoster(), rosterPromptLimit);
        Extraction<GapAnalysis> extraction = reasoning.ask(prompt, MAX_OUTPUT_TOKENS, Shapes.GAP_ANALYSIS);

        update.put(QualificationState.GAP_ANALYSIS, extraction.value());
        if (extraction.degraded()) {
            update.put(QualificationState.ERRORS, state.errorsWith(extraction.note()));
        }
        log.info("Gap analysis complete: capability match {}%", extraction.value().capabilityMatchPercent());
        return CompletableFuture.completedFuture(update);
    }
}
