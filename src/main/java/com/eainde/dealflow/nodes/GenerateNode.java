package com.eainde.dealflow.nodes;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.ProposalSection;
import com.eainde.dealflow.prompt.ProposalGuidance;
import com.eainde.dealflow.prompt.ProposalGuidanceRules;
import com.eainde.dealflow.prompt.ProposalPrompts;
import com.eainde.dealflow.reasoning.ReasoningException;
import com.eainde.dealflow.reasoning.ReasoningPort;
import com.eainde.dealflow.state.ProposalState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Proposal stage 2: the markdown draft, split into sections on {@code #} and
 * {@code ##} headings.
 */
@Slf4j
@Component
public class GenerateNode implements AsyncNodeAction<ProposalState> {

    public static final String NAME = "generate";
    static final int MAX_OUTPUT_TOKENS = 8192;
    static final String LEADING_SECTION = "Introduction";

    private final ReasoningPort reasoningPort;
    private final int retrievalPromptLimit;

    public GenerateNode(ReasoningPort reasoningPort,
                        @Value("${dealflow.proposal.retrieval-prompt-limit:7}") int retrievalPromptLimit) {
        this.reasoningPort = reasoningPort;
        this.retrievalPromptLimit = retrievalPromptLimit;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProposalState state) {
        Deal deal = state.getDeal();
        ProposalGuidance guidance = ProposalGuidanceRules.evaluate(state.getRequirements());
        log.info("Proposal guidance rules fired: {}", guidance.firedRules());

        String prompt = ProposalPrompts.draft(deal, state.getRequirements(), state.getTeam(),
                state.getRetrievedSections(), retrievalPromptLimit, state.getProfile(), guidance);

        Map<String, Object> update = new HashMap<>();
        update.put(ProposalState.TITLE, ProposalPrompts.title(deal));

        String draft;
        try {
            draft = reasoningPort.submit(prompt, MAX_OUTPUT_TOKENS);
        } catch (ReasoningException e) {
            log.warn("Proposal draft generation failed: {}", e.getMessage());
            draft = "";
            update.put(ProposalState.ERRORS, state.errorsWith("Proposal generation failed: " + e.getMessage()));
        }

        List<ProposalSection> sections = splitSections(draft);
        update.put(ProposalState.DRAFT, draft);
        update.put(ProposalState.SECTIONS, sections);
        log.info("Proposal draft generated: {} chars, {} sections", draft.length(), sections.size());
        return CompletableFuture.completedFuture(update);
    }

    /**
     * Sections start at lines beginning with {@code "# "} or {@code "## "}; text
     * before the first heading goes into an "Introduction" section. Sections
     * without content are dropped.
     */
    static List<ProposalSection> splitSections(String draft) {
        List<ProposalSection> sections = new ArrayList<>();
        String title = LEADING_SECTION;
        StringBuilder content = new StringBuilder();
        for (String line : draft.split("\n", -1)) {
            if (line.startsWith("# ") || line.startsWith("## ")) {
                addIfNotBlank(sections, title, content);
                title = line.replaceFirst("^#+", "").strip();
                content = new StringBuilder();
            } else {
                content.append(line).append('\n');
            }
        }
        addIfNotBlank(sections, title, content);
        return List.copyOf(sections);
    }

    private static void addIfNotBlank(List<ProposalSection> sections, String title, StringBuilder content) {
        if (!content.toString().isBlank()) {
            sections.add(new ProposalSection(title, content.toString()));
        }
    }
}
