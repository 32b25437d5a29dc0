package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.Shapes;
import com.eainde.dealflow.model.DealEntities;
import com.eainde.dealflow.model.RequirementExtraction;
import com.eainde.dealflow.prompt.QualificationPrompts;
import com.eainde.dealflow.state.QualificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Qualification stage 2: typed requirements and deal entities from the document text.
 */
@Slf4j
@Component
public class ExtractNode implements AsyncNodeAction<QualificationState> {

    public static final String NAME = "extract";
    static final int MAX_OUTPUT_TOKENS = 4096;
    static final String TRUNCATION_NOTICE = "\n\n[Document truncated for processing]";

    private final StructuredReasoning reasoning;
    private final int maxDocumentChars;

    public ExtractNode(StructuredReasoning reasoning,
                       @Value("${dealflow.qualification.max-document-chars:50000}") int maxDocumentChars) {
        this.reasoning = reasoning;
        this.maxDocumentChars = maxDocumentChars;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(QualificationState state) {
        String text = state.getDocumentText();
        Map<String, Object> update = new HashMap<>();

        if (text.isBlank()) {
            update.put(QualificationState.REQUIREMENTS, List.of());
            update.put(QualificationState.ENTITIES, DealEntities.empty());
            update.put(QualificationState.ERRORS, state.errorsWith("Extraction skipped: no document text"));
            return CompletableFuture.completedFuture(update);
        }

        Extraction<RequirementExtraction> extraction = reasoning.ask(
                QualificationPrompts.extraction(truncate(text)), MAX_OUTPUT_TOKENS, Shapes.REQUIREMENTS);
        RequirementExtraction result = extraction.value();

        update.put(QualificationState.REQUIREMENTS, result.requirements());
        update.put(QualificationState.ENTITIES, result.entities());
        if (extraction.degraded()) {
            update.put(QualificationState.ERRORS, state.errorsWith(extraction.note()));
        }
        log.info("Extracted {} requirements (strategy {})", result.requirements().size(), extraction.strategy());
        return CompletableFuture.completedFuture(update);
    }

    String truncate(String text) {
        if (text.length() <= maxDocumentChars) {
            return text;
        }
        log.info("Document truncated from {} to {} chars", text.length(), maxDocumentChars);
        return text.substring(0, maxDocumentChars) + TRUNCATION_NOTICE;
    }
}
