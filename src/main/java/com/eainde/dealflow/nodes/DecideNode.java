package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.QualificationDecision;
import com.eainde.dealflow.prompt.QualificationPrompts;
import com.eainde.dealflow.state.QualificationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Qualification stage 5: go / no-go / conditional-go with confidence and rationale.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecideNode implements AsyncNodeAction<QualificationState> {

    public static final String NAME = "decide";
    static final int MAX_OUTPUT_TOKENS = 1024;

    private final StructuredReasoning reasoning;

    @Override
    public CompletableFuture<Map<String, Object>> apply(QualificationState state) {
        String prompt = QualificationPrompts.decision(state.getRequirements(), state.getEntities(),
                state.getGapAnalysis(), state.getRoleMatches(), state.getProfile(), state.getRoster());
        Extraction<QualificationDecision> extraction = reasoning.ask(prompt, MAX_OUTPUT_TOKENS, Shapes.DECISION);
        QualificationDecision decision = extraction.value();

        Map<String, Object> update = new HashMap<>();
        update.put(QualificationState.DECISION, decision);
        if (extraction.degraded()) {
            update.put(QualificationState.ERRORS, state.errorsWith(extraction.note()));
        }
        log.info("Decision: {} (confidence {})", decision.recommendation().value(), decision.confidenceScore());
        return CompletableFuture.completedFuture(update);
    }
}
