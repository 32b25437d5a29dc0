package com.eainde.dealflow.state;

import com.eainde.dealflow.model.ComplianceReport;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.ProposalSection;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RetrievedSection;
import com.eainde.dealflow.model.TeamMember;

import java.util.List;
import java.util.Map;

public class ProposalState extends DealState {

    public static final String REQUIREMENTS = "requirements";
    public static final String TEAM = "team";
    public static final String PROFILE = "organizationProfile";

    public static final String RETRIEVED_SECTIONS = "retrievedSections";
    public static final String TITLE = "proposalTitle";
    public static final String DRAFT = "proposalDraft";
    public static final String SECTIONS = "proposalSections";
    public static final String COMPLIANCE = "compliance";

    public ProposalState(Map<String, Object> initData) {
        super(initData);
    }

    public List<Requirement> getRequirements() {
        return listOf(REQUIREMENTS);
    }

    public List<TeamMember> getTeam() {
        return listOf(TEAM);
    }

    public OrganizationProfile getProfile() {
        return this.<OrganizationProfile>value(PROFILE).orElse(OrganizationProfile.empty());
    }

    public List<RetrievedSection> getRetrievedSections() {
        return listOf(RETRIEVED_SECTIONS);
    }

    public String getTitle() {
        return stringOf(TITLE);
    }

    public String getDraft() {
        return stringOf(DRAFT);
    }

    public List<ProposalSection> getSections() {
        return listOf(SECTIONS);
    }

    public ComplianceReport getCompliance() {
        return this.<ComplianceReport>value(COMPLIANCE).orElse(ComplianceReport.fullyCompliant());
    }
}
