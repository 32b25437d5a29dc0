package com.eainde.dealflow.flow;

import com.eainde.dealflow.collaborator.DealStore;
import com.eainde.dealflow.collaborator.RosterProvider;
import com.eainde.dealflow.matching.CapabilityMatcher;
import com.eainde.dealflow.matching.MatchResult;
import com.eainde.dealflow.matching.StaffingPlan;
import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.DocumentRef;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.QualificationDecision;
import com.eainde.dealflow.model.QualificationOutcome;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.model.SourceDocument;
import com.eainde.dealflow.model.StaffingAssignment;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.QualificationState;
import com.eainde.dealflow.util.NullSafe;
import com.eainde.dealflow.workflow.StageGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Qualification of a deal from its documents.
 * <p>
 * Inputs: every processed document of the deal, concatenated in creation order
 * under a {@code === [CATEGORY] title ===} header, plus a roster snapshot and the
 * organization profile. After the last stage the roster is ranked against the
 * requirements and gap assessment and the best candidates are auto-assigned.
 * </p>
 */
@Slf4j
@Component
public class QualificationFlow implements DealFlow<QualificationState> {

    public static final String ARG_DOCUMENT_ID = "documentId";

    private final StageGraph<QualificationState> graph;
    private final DealStore dealStore;
    private final RosterProvider rosterProvider;
    private final CapabilityMatcher matcher;
    private final int maxAutoAssignments;

    public QualificationFlow(@Qualifier("qualificationWorkflow") StageGraph<QualificationState> graph,
                             DealStore dealStore,
                             RosterProvider rosterProvider,
                             CapabilityMatcher matcher,
                             @Value("${dealflow.staffing.max-auto-assignments:5}") int maxAutoAssignments) {
        this.graph = graph;
        this.dealStore = dealStore;
        this.rosterProvider = rosterProvider;
        this.matcher = matcher;
        this.maxAutoAssignments = maxAutoAssignments;
    }

    @Override
    public FlowType flowType() {
        return FlowType.QUALIFICATION;
    }

    @Override
    public StageGraph<QualificationState> graph() {
        return graph;
    }

    @Override
    public Map<String, Object> resolveInputs(String runId, String dealId, Map<String, Object> args) {
        Deal deal = dealStore.findDeal(dealId)
                .orElseThrow(() -> new InputResolutionException("Deal not found"));

        List<SourceDocument> documents = selectDocuments(dealId, args.get(ARG_DOCUMENT_ID));
        if (documents.isEmpty()) {
            throw new InputResolutionException("No processed documents found for this deal");
        }

        List<String> parts = new ArrayList<>();
        List<DocumentRef> refs = new ArrayList<>();
        for (SourceDocument document : documents) {
            if (!NullSafe.hasText(document.extractedText())) {
                continue;
            }
            String category = NullSafe.nvl(document.category(), "general").toUpperCase(Locale.ROOT);
            parts.add("=== [" + category + "] " + document.displayTitle() + " ===\n" + document.extractedText());
            refs.add(DocumentRef.of(document));
        }
        String documentText = String.join("\n\n", parts);
        if (documentText.isBlank()) {
            throw new InputResolutionException("Documents found but no text could be extracted");
        }

        List<String> errors = new ArrayList<>();
        List<CapabilityRecord> roster = RosterInputs.roster(rosterProvider, dealId, errors);
        OrganizationProfile profile = RosterInputs.profile(rosterProvider, dealId, errors);
        log.info("Qualification inputs for deal {}: {} documents, {} chars, {} roster entries",
                dealId, refs.size(), documentText.length(), roster.size());

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put(DealState.RUN_ID, runId);
        inputs.put(DealState.DEAL_ID, dealId);
        inputs.put(DealState.DEAL, deal);
        inputs.put(QualificationState.DOCUMENT_TEXT, documentText);
        inputs.put(QualificationState.DOCUMENTS, List.copyOf(refs));
        inputs.put(QualificationState.ROSTER, roster);
        inputs.put(QualificationState.PROFILE, profile);
        if (!errors.isEmpty()) {
            inputs.put(DealState.ERRORS, List.copyOf(errors));
        }
        return inputs;
    }

    private List<SourceDocument> selectDocuments(String dealId, Object requestedId) {
        List<SourceDocument> selected = new ArrayList<>(dealStore.documents(dealId).stream()
                .filter(SourceDocument::processed)
                .toList());
        if (requestedId instanceof String documentId && NullSafe.hasText(documentId)
                && selected.stream().noneMatch(d -> documentId.equals(d.id()))) {
            dealStore.findDocument(documentId)
                    .filter(d -> NullSafe.hasText(d.extractedText()))
                    .ifPresent(d -> selected.add(0, d));
        }
        return selected;
    }

    @Override
    public RunResult complete(String runId, String dealId, QualificationState state) {
        GapAnalysis gapAnalysis = state.getGapAnalysis();
        QualificationDecision decision = state.getDecision();

        List<MatchResult> ranked = matcher.rank(staffingKeywords(state), state.getRoster());
        // no match at all leaves the earlier automatic picks in place
        List<StaffingAssignment> assignments = dealStore.assignments(dealId);
        int autoAssigned = 0;
        if (!ranked.isEmpty()) {
            StaffingPlan plan = matcher.autoAssign(dealId, ranked, assignments, maxAutoAssignments);
            assignments = plan.all();
            autoAssigned = plan.automatic().size();
        }

        dealStore.saveQualification(dealId, new QualificationOutcome(
                state.getRequirements(),
                state.getEntities(),
                gapAnalysis,
                state.getRoleMatches(),
                decision,
                assignments));

        log.info("Qualification of deal {} done: recommendation={}, matched={}, auto_assigned={}",
                dealId, decision.recommendation().value(), ranked.size(), autoAssigned);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("recommendation", decision.recommendation().value());
        summary.put("confidence_score", decision.confidenceScore());
        summary.put("requirements_found", state.getRequirements().size());
        summary.put("matched_employees", ranked.size());
        summary.put("auto_assigned", autoAssigned);
        summary.put("key_roles", gapAnalysis.keyRoles());
        return new RunResult("Qualification complete", summary);
    }

    /**
     * Requirement text and category, strong and gap areas, and key roles.
     */
    static Set<String> staffingKeywords(QualificationState state) {
        Set<String> keywords = new LinkedHashSet<>(CapabilityMatcher.requirementKeywords(state.getRequirements()));
        GapAnalysis gapAnalysis = state.getGapAnalysis();
        gapAnalysis.strongAreas().forEach(area -> keywords.addAll(CapabilityMatcher.keywords(area)));
        gapAnalysis.gapAreas().forEach(area -> keywords.addAll(CapabilityMatcher.keywords(area)));
        gapAnalysis.keyRoles().forEach(role -> keywords.addAll(CapabilityMatcher.keywords(role)));
        return keywords;
    }
}
