package com.eainde.dealflow.nodes;

import com.eainde.dealflow.collaborator.RetrievalService;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RetrievedSection;
import com.eainde.dealflow.state.ProposalState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Proposal stage 1: supporting context from the retrieval collaborator. A failing
 * retrieval leaves the proposal without context, it never stops the run.
 */
@Slf4j
@Component
public class RetrieveNode implements AsyncNodeAction<ProposalState> {

    public static final String NAME = "retrieve";

    private final RetrievalService retrievalService;
    private final int retrievalResults;

    public RetrieveNode(RetrievalService retrievalService,
                        @Value("${dealflow.proposal.retrieval-results:10}") int retrievalResults) {
        this.retrievalService = retrievalService;
        this.retrievalResults = retrievalResults;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProposalState state) {
        List<String> requirementTexts = state.getRequirements().stream().map(Requirement::text).toList();
        Map<String, Object> update = new HashMap<>();

        List<RetrievedSection> sections;
        try {
            List<RetrievedSection> found = retrievalService.retrieve(context(state.getDeal()), requirementTexts,
                    retrievalResults);
            sections = found != null ? List.copyOf(found) : List.of();
            log.info("Retrieved {} proposal sections", sections.size());
        } catch (RuntimeException e) {
            log.warn("Retrieval failed, continuing without context: {}", e.getMessage());
            sections = List.of();
            update.put(ProposalState.ERRORS, state.errorsWith("Retrieval failed: " + e.getMessage()));
        }
        update.put(ProposalState.RETRIEVED_SECTIONS, sections);
        return CompletableFuture.completedFuture(update);
    }

    static String context(Deal deal) {
        if (deal == null) {
            return "";
        }
        StringBuilder context = new StringBuilder();
        append(context, "Title", deal.title());
        append(context, "Client", deal.clientName());
        append(context, "Description", deal.description());
        return context.toString().strip();
    }

    private static void append(StringBuilder context, String label, String value) {
        if (value != null && !value.isBlank()) {
            context.append(label).append(": ").append(value).append('\n');
        }
    }
}
