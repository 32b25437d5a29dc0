package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.MonitoringOutcome;
import com.eainde.dealflow.model.ProposalOutcome;
import com.eainde.dealflow.model.QualificationOutcome;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.SourceDocument;
import com.eainde.dealflow.model.StaffingAssignment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link DealStore}, used when no persistent store is configured.
 * Saving an outcome updates the data later runs read (requirements after
 * qualification, health after monitoring).
 */
@Slf4j
public class InMemoryDealStore implements DealStore {

    private final Map<String, Deal> deals = new ConcurrentHashMap<>();
    private final Map<String, List<SourceDocument>> documents = new ConcurrentHashMap<>();
    private final Map<String, List<Requirement>> requirements = new ConcurrentHashMap<>();
    private final Map<String, List<StaffingAssignment>> assignments = new ConcurrentHashMap<>();

    private final Map<String, QualificationOutcome> qualifications = new ConcurrentHashMap<>();
    private final Map<String, List<ProposalOutcome>> proposals = new ConcurrentHashMap<>();
    private final Map<String, List<MonitoringOutcome>> monitoring = new ConcurrentHashMap<>();

    public InMemoryDealStore putDeal(Deal deal) {
        deals.put(deal.id(), deal);
        return this;
    }

    public InMemoryDealStore addDocument(String dealId, SourceDocument document) {
        documents.computeIfAbsent(dealId, k -> new CopyOnWriteArrayList<>()).add(document);
        return this;
    }

    public InMemoryDealStore putRequirements(String dealId, List<Requirement> values) {
        requirements.put(dealId, List.copyOf(values));
        return this;
    }

    public InMemoryDealStore putAssignments(String dealId, List<StaffingAssignment> values) {
        assignments.put(dealId, List.copyOf(values));
        return this;
    }

    @Override
    public Optional<Deal> findDeal(String dealId) {
        return Optional.ofNullable(dealId).map(deals::get);
    }

    @Override
    public List<SourceDocument> documents(String dealId) {
        List<SourceDocument> all = new ArrayList<>(documents.getOrDefault(dealId, List.of()));
        all.sort(Comparator.comparing(SourceDocument::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return List.copyOf(all);
    }

    @Override
    public Optional<SourceDocument> findDocument(String documentId) {
        return documents.values().stream()
                .flatMap(List::stream)
                .filter(d -> d.id().equals(documentId))
                .findFirst();
    }

    @Override
    public List<Requirement> requirements(String dealId) {
        return requirements.getOrDefault(dealId, List.of());
    }

    @Override
    public List<StaffingAssignment> assignments(String dealId) {
        return assignments.getOrDefault(dealId, List.of());
    }

    @Override
    public void saveQualification(String dealId, QualificationOutcome outcome) {
        qualifications.put(dealId, outcome);
        requirements.put(dealId, List.copyOf(outcome.requirements()));
        assignments.put(dealId, List.copyOf(outcome.assignments()));
        deals.computeIfPresent(dealId, (id, deal) -> withStage(deal, "qualification"));
        log.info("Deal {}: stored qualification ({} requirements, recommendation {})",
                dealId, outcome.requirements().size(), outcome.decision().recommendation().value());
    }

    @Override
    public void saveProposal(String dealId, ProposalOutcome outcome) {
        proposals.computeIfAbsent(dealId, k -> new CopyOnWriteArrayList<>()).add(outcome);
        deals.computeIfPresent(dealId, (id, deal) -> withStage(deal, "proposal"));
        log.info("Deal {}: stored proposal {}", dealId, outcome.proposalId());
    }

    @Override
    public void saveMonitoring(String dealId, MonitoringOutcome outcome) {
        monitoring.computeIfAbsent(dealId, k -> new CopyOnWriteArrayList<>()).add(outcome);
        deals.computeIfPresent(dealId, (id, deal) -> new Deal(deal.id(), deal.title(), deal.clientName(),
                deal.description(), deal.dealValue(), outcome.healthScore(), deal.healthScore(), deal.stage()));
        log.info("Deal {}: stored monitoring result (health {}, {} alerts)",
                dealId, outcome.healthScore(), outcome.alerts().size());
    }

    public Optional<QualificationOutcome> qualification(String dealId) {
        return Optional.ofNullable(qualifications.get(dealId));
    }

    public List<ProposalOutcome> proposals(String dealId) {
        return List.copyOf(proposals.getOrDefault(dealId, List.of()));
    }

    public List<MonitoringOutcome> monitoringHistory(String dealId) {
        return List.copyOf(monitoring.getOrDefault(dealId, List.of()));
    }

    private static Deal withStage(Deal deal, String stage) {
        return new Deal(deal.id(), deal.title(), deal.clientName(), deal.description(), deal.dealValue(),
                deal.healthScore(), deal.previousHealthScore(), stage);
    }
}
