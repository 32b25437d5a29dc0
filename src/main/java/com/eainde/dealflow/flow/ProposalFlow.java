package com.eainde.dealflow.flow;

import com.eainde.dealflow.collaborator.DealStore;
import com.eainde.dealflow.collaborator.RosterProvider;
import com.eainde.dealflow.model.AssignmentSource;
import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.ComplianceReport;
import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.ProposalOutcome;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.model.StaffingAssignment;
import com.eainde.dealflow.model.TeamMember;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.ProposalState;
import com.eainde.dealflow.util.NullSafe;
import com.eainde.dealflow.workflow.StageGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Proposal drafting from the requirements recorded by the latest qualification
 * and the team currently staffed on the deal.
 */
@Slf4j
@Component
public class ProposalFlow implements DealFlow<ProposalState> {

    private final StageGraph<ProposalState> graph;
    private final DealStore dealStore;
    private final RosterProvider rosterProvider;

    public ProposalFlow(@Qualifier("proposalWorkflow") StageGraph<ProposalState> graph,
                        DealStore dealStore,
                        RosterProvider rosterProvider) {
        this.graph = graph;
        this.dealStore = dealStore;
        this.rosterProvider = rosterProvider;
    }

    @Override
    public FlowType flowType() {
        return FlowType.PROPOSAL;
    }

    @Override
    public StageGraph<ProposalState> graph() {
        return graph;
    }

    @Override
    public Map<String, Object> resolveInputs(String runId, String dealId, Map<String, Object> args) {
        Deal deal = dealStore.findDeal(dealId)
                .orElseThrow(() -> new InputResolutionException("Deal not found"));

        List<Requirement> requirements = List.copyOf(dealStore.requirements(dealId));
        List<String> errors = new ArrayList<>();
        List<TeamMember> team = team(dealStore.assignments(dealId), RosterInputs.roster(rosterProvider, dealId, errors));
        OrganizationProfile profile = RosterInputs.profile(rosterProvider, dealId, errors);
        log.info("Proposal inputs for deal {}: {} requirements, {} team members",
                dealId, requirements.size(), team.size());

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put(DealState.RUN_ID, runId);
        inputs.put(DealState.DEAL_ID, dealId);
        inputs.put(DealState.DEAL, deal);
        inputs.put(ProposalState.REQUIREMENTS, requirements);
        inputs.put(ProposalState.TEAM, team);
        inputs.put(ProposalState.PROFILE, profile);
        if (!errors.isEmpty()) {
            inputs.put(DealState.ERRORS, List.copyOf(errors));
        }
        return inputs;
    }

    /**
     * Joins the deal's assignments with the roster. The deal role and rate
     * override win over the roster values; assignments of employees no longer
     * on the roster are left out.
     */
    static List<TeamMember> team(List<StaffingAssignment> assignments, List<CapabilityRecord> roster) {
        Map<String, CapabilityRecord> byId = roster.stream()
                .filter(r -> r.employeeId() != null)
                .collect(Collectors.toMap(CapabilityRecord::employeeId, Function.identity(), (a, b) -> a));

        List<TeamMember> team = new ArrayList<>();
        for (StaffingAssignment assignment : assignments) {
            CapabilityRecord employee = byId.get(assignment.employeeId());
            if (employee == null) {
                log.debug("Assigned employee {} is not on the roster", assignment.employeeId());
                continue;
            }
            double rate = assignment.hourlyRateOverride() != null
                    ? assignment.hourlyRateOverride()
                    : employee.hourlyRate();
            team.add(new TeamMember(
                    employee.name(),
                    NullSafe.hasText(assignment.roleOnDeal()) ? assignment.roleOnDeal() : employee.role(),
                    List.copyOf(employee.skills()),
                    employee.department(),
                    rate,
                    assignment.allocationPercent() > 0 ? assignment.allocationPercent() : 100,
                    NullSafe.nvl(assignment.assignedBy(), AssignmentSource.MANUAL)));
        }
        return List.copyOf(team);
    }

    @Override
    public RunResult complete(String runId, String dealId, ProposalState state) {
        ComplianceReport compliance = state.getCompliance();
        ProposalOutcome outcome = new ProposalOutcome(
                UUID.randomUUID().toString(),
                state.getTitle(),
                state.getDraft(),
                state.getSections(),
                compliance);
        dealStore.saveProposal(dealId, outcome);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("proposal_id", outcome.proposalId());
        summary.put("title", outcome.title());
        summary.put("compliance_score", compliance.complianceScore());
        summary.put("sections", outcome.sections().size());
        return new RunResult("Proposal generated", summary);
    }
}
