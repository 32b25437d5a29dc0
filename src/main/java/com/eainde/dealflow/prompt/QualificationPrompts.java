package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.DealEntities;
import com.eainde.dealflow.model.GapAnalysis;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RoleMatch;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.eainde.dealflow.prompt.PromptText.bullets;
import static com.eainde.dealflow.prompt.PromptText.joined;
import static com.eainde.dealflow.prompt.PromptText.orUnknown;
import static com.eainde.dealflow.prompt.PromptText.profileBlock;

public final class QualificationPrompts {

    private QualificationPrompts() {
    }

    public static String extraction(String documentText) {
        return """
                # ROLE
                You analyze RFP and tender documents and extract structured information.

                # DOCUMENT
                %s

                # OUTPUT (JSON)
                {
                  "requirements": [
                    {
                      "category": "technical|functional|integration|security|compliance|process|...",
                      "text": "the requirement",
                      "priority": "must_have|should_have|nice_to_have",
                      "confidence": 0.0 to 1.0
                    }
                  ],
                  "entities": {
                    "client_name": "...",
                    "project_name": "...",
                    "budget_range": "...",
                    "timeline": "...",
                    "deadline": "...",
                    "key_stakeholders": ["..."],
                    "industry": "...",
                    "technologies_mentioned": ["..."]
                  }
                }

                Extract ALL requirements you can identify. Return ONLY valid JSON.
                """.formatted(documentText);
    }

    public static String gapAnalysis(List<Requirement> requirements, DealEntities entities,
                                     OrganizationProfile profile, List<CapabilityRecord> roster, int rosterLimit) {
        return """
                # ROLE
                You assess deal viability: compare the client requirements with the company profile and the
                actual team capabilities.

                CLIENT: %s
                INDUSTRY: %s
                BUDGET: %s
                TIMELINE: %s

                # COMPANY PROFILE
                %s

                # TEAM
                %s

                # CLIENT REQUIREMENTS (%d total)
                %s

                # RULES
                A capability is CONFIRMED if it appears in the services, the technology stack OR the team skills.
                Flag gaps only for requirements nothing in the profile or the team covers.

                # OUTPUT (JSON)
                {
                  "capability_match_percent": 0-100,
                  "strong_areas": ["..."],
                  "gap_areas": ["..."],
                  "risk_factors": ["..."],
                  "opportunity_factors": ["..."],
                  "resource_estimate": {
                    "team_size": "...",
                    "duration": "...",
                    "key_roles": ["..."]
                  }
                }

                Return ONLY valid JSON.
                """.formatted(
                orUnknown(entities.clientName()),
                orUnknown(entities.industry()),
                orUnknown(entities.budgetRange()),
                orUnknown(entities.timeline()),
                profileBlock(profile),
                rosterSummary(roster, rosterLimit),
                requirements.size(),
                requirementLines(requirements));
    }

    public static String decision(List<Requirement> requirements, DealEntities entities, GapAnalysis gap,
                                  List<RoleMatch> roleMatches, OrganizationProfile profile,
                                  List<CapabilityRecord> roster) {
        long uniqueSkills = roster.stream().flatMap(r -> r.skills().stream()).distinct().count();
        return """
                # ROLE
                You make the deal qualification decision from the complete analysis below.

                CLIENT: %s
                BUDGET: %s
                TIMELINE: %s
                OUR TEAM: %d employees with %d unique skills

                # COMPANY PROFILE
                %s

                # ANALYSIS
                REQUIREMENTS: %d
                CAPABILITY MATCH: %.0f%%
                STRONG AREAS: %s
                GAP AREAS: %s
                RISKS: %s
                OPPORTUNITIES: %s
                KEY ROLES: %s

                # OUTPUT (JSON)
                {
                  "recommendation": "go|no_go|conditional_go",
                  "confidence_score": 0.0 to 1.0,
                  "positive_factors": ["..."],
                  "risk_factors": ["..."],
                  "conditions": ["conditions that must hold for a conditional go"],
                  "reasoning": "short rationale"
                }

                Return ONLY valid JSON.
                """.formatted(
                orUnknown(entities.clientName()),
                orUnknown(entities.budgetRange()),
                orUnknown(entities.timeline()),
                roster.size(),
                uniqueSkills,
                profileBlock(profile),
                requirements.size(),
                gap.capabilityMatchPercent(),
                joined(gap.strongAreas(), "None identified"),
                joined(gap.gapAreas(), "None identified"),
                joined(gap.riskFactors(), "None identified"),
                joined(gap.opportunityFactors(), "None identified"),
                roleLines(roleMatches));
    }

    static String rosterSummary(List<CapabilityRecord> roster, int limit) {
        if (roster.isEmpty()) {
            return "No roster data available.";
        }
        TreeSet<String> departments = new TreeSet<>();
        TreeSet<String> roles = new TreeSet<>();
        TreeSet<String> skills = new TreeSet<>();
        for (CapabilityRecord record : roster) {
            if (!record.department().isBlank()) {
                departments.add(record.department());
            }
            if (!record.role().isBlank()) {
                roles.add(record.role());
            }
            skills.addAll(record.skills());
        }

        StringBuilder summary = new StringBuilder()
                .append("CURRENT TEAM (").append(roster.size()).append(" employees)\n")
                .append("DEPARTMENTS: ").append(joined(departments, "Not specified")).append('\n')
                .append("ROLES ON STAFF: ").append(joined(roles, "Not specified")).append('\n')
                .append("ALL SKILLS: ").append(joined(skills, "Not specified")).append('\n')
                .append("ROSTER:");
        roster.stream().limit(limit).forEach(r -> summary
                .append("\n- ").append(r.name()).append(" | ").append(r.role())
                .append(" | Skills: ").append(r.skills().stream().limit(8).collect(Collectors.joining(", ")))
                .append(" | Availability: ").append(r.availabilityPercent()).append('%'));
        if (roster.size() > limit) {
            summary.append("\n... and ").append(roster.size() - limit).append(" more employees");
        }
        return summary.toString();
    }

    static String requirementLines(List<Requirement> requirements) {
        if (requirements.isEmpty()) {
            return "No requirements were extracted.";
        }
        return bullets(requirements.stream()
                .map(r -> "[" + r.category() + "/" + r.priority() + "] " + r.text())
                .toList());
    }

    private static String roleLines(List<RoleMatch> roleMatches) {
        if (roleMatches.isEmpty()) {
            return "None estimated";
        }
        return roleMatches.stream()
                .map(m -> m.role() + " (" + m.status() + ")")
                .collect(Collectors.joining(", "));
    }
}
