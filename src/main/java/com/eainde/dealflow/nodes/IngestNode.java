package com.eainde.dealflow.nodes;

import com.eainde.dealflow.state.QualificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Qualification stage 1: checks the assembled document text and records basic stats.
 */
@Slf4j
@Component
public class IngestNode implements AsyncNodeAction<QualificationState> {

    public static final String NAME = "ingest";

    @Override
    public CompletableFuture<Map<String, Object>> apply(QualificationState state) {
        String text = state.getDocumentText();
        Map<String, Object> update = new HashMap<>();
        update.put(QualificationState.DOCUMENT_COUNT, state.getDocuments().size());

        if (text.isBlank()) {
            log.warn("No document text provided");
            update.put(QualificationState.WORD_COUNT, 0);
            update.put(QualificationState.CHAR_COUNT, 0);
            update.put(QualificationState.ERRORS, state.errorsWith("No document text provided"));
            return CompletableFuture.completedFuture(update);
        }

        int words = text.strip().split("\\s+").length;
        update.put(QualificationState.WORD_COUNT, words);
        update.put(QualificationState.CHAR_COUNT, text.length());
        log.info("Document ingested: {} documents, {} words, {} chars",
                state.getDocuments().size(), words, text.length());
        return CompletableFuture.completedFuture(update);
    }
}
