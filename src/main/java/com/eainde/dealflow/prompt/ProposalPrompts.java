package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.Deal;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RetrievedSection;
import com.eainde.dealflow.model.TeamMember;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.eainde.dealflow.prompt.PromptText.bullets;
import static com.eainde.dealflow.prompt.PromptText.money;
import static com.eainde.dealflow.prompt.PromptText.orUnknown;
import static com.eainde.dealflow.prompt.PromptText.profileBlock;

public final class ProposalPrompts {

    private ProposalPrompts() {
    }

    public static String title(Deal deal) {
        return "Proposal - " + orUnknown(deal.clientName()) + " - " + orUnknown(deal.title());
    }

    public static String draft(Deal deal, List<Requirement> requirements, List<TeamMember> team,
                               List<RetrievedSection> retrieved, int retrievedLimit,
                               OrganizationProfile profile, ProposalGuidance guidance) {
        String company = profile.displayName();
        return """
                # ROLE
                You are a senior proposal writer at %1$s. Write a winning proposal from %1$s to %2$s
                for the "%3$s" project. Write as the proposal team: confident, specific, persuasive.
                Every claim must be backed by the requirements or the team data below.

                CLIENT: %2$s
                PROJECT: %3$s
                DESCRIPTION: %4$s

                # REQUIREMENTS (%5$d total)
                %6$s

                # TEAM
                %7$s

                # CONTEXT FROM PREVIOUS PROPOSALS
                %8$s

                # COMPANY PROFILE
                %9$s

                # STRATEGY
                %10$s

                # OUTLINE
                # Proposal: %3$s

                ## 1. Executive Summary
                ## 2. Understanding of Requirements
                ## 3. Proposed Solution & Technical Approach
                ## 4. Implementation Plan & Timeline
                ## 5. Proposed Team & Resources
                Use ONLY the team members listed above.
                ## 6. Investment & Commercial Terms
                Use the real rates and allocations of the team.
                ## 7. Why Choose %1$s
                %11$s
                ## %12$d. Next Steps
                This MUST be the final section.

                Output clean markdown with # and ## headers.
                """.formatted(
                company,
                orUnknown(deal.clientName()),
                orUnknown(deal.title()),
                deal.description() != null ? deal.description() : "",
                requirements.size(),
                requirementLines(requirements),
                teamBlock(team),
                retrievedBlock(retrieved, retrievedLimit),
                profileBlock(profile),
                bullets(guidance.hints()),
                extraSectionsBlock(guidance),
                guidance.nextStepsNumber());
    }

    public static String compliance(String draft, List<Requirement> requirements, int draftChars) {
        String excerpt = draft.length() > draftChars ? draft.substring(0, draftChars) : draft;
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < requirements.size(); i++) {
            Requirement r = requirements.get(i);
            lines.append(i + 1).append(". [").append(r.category()).append("] ").append(r.text()).append('\n');
        }
        return """
                # ROLE
                You check a proposal against the client requirements.

                # PROPOSAL
                %s

                # REQUIREMENTS TO CHECK
                %s
                # OUTPUT (JSON)
                {
                  "compliance_score": 0.0 to 1.0,
                  "issues": [
                    {
                      "requirement_index": 1,
                      "requirement_text": "...",
                      "status": "addressed|partially_addressed|not_addressed",
                      "notes": "explanation"
                    }
                  ]
                }

                Return ONLY valid JSON.
                """.formatted(excerpt, lines);
    }

    static String requirementLines(List<Requirement> requirements) {
        if (requirements.isEmpty()) {
            return "No explicit requirements recorded; infer them from the description.";
        }
        return bullets(requirements.stream().map(r -> "[" + r.category() + "] " + r.text()).toList());
    }

    static String teamBlock(List<TeamMember> team) {
        if (team.isEmpty()) {
            return "No team members assigned yet. Describe the team structure generically from the required roles.";
        }
        StringBuilder block = new StringBuilder("ASSIGNED TEAM MEMBERS (use these exact people):");
        double total = 0;
        int i = 1;
        for (TeamMember member : team) {
            double monthly = member.monthlyCost();
            total += monthly;
            String skills = member.skills().isEmpty()
                    ? "General"
                    : member.skills().stream().limit(6).collect(Collectors.joining(", "));
            block.append('\n').append(i++).append(". ").append(member.name()).append(" - ").append(member.role())
                    .append("\n   Skills: ").append(skills)
                    .append("\n   Department: ").append(member.department().isBlank() ? "N/A" : member.department())
                    .append(" | Allocation: ").append(member.allocationPercent()).append('%')
                    .append(" | Rate: $").append(money(member.hourlyRate())).append("/hr")
                    .append(" | Monthly: $").append(money(monthly));
        }
        block.append("\n\nTOTAL ESTIMATED MONTHLY COST: $").append(money(total));
        return block.toString();
    }

    static String retrievedBlock(List<RetrievedSection> retrieved, int limit) {
        if (retrieved.isEmpty()) {
            return "None available.";
        }
        StringBuilder block = new StringBuilder();
        int i = 1;
        for (RetrievedSection section : retrieved.stream().limit(limit).toList()) {
            block.append("--- Section ").append(i++)
                    .append(" (Source: ").append(orUnknown(section.source()))
                    .append(", Relevance: ").append(String.format(Locale.ROOT, "%.2f", section.relevance()))
                    .append(") ---\n")
                    .append(section.text()).append('\n');
        }
        return block.toString().strip();
    }

    static String extraSectionsBlock(ProposalGuidance guidance) {
        StringBuilder block = new StringBuilder();
        int number = ProposalGuidanceRules.FIRST_EXTRA_SECTION;
        for (GuidanceRule.ExtraSection section : guidance.extraSections()) {
            block.append("## ").append(number++).append(". ").append(section.title()).append('\n')
                    .append(section.guidance()).append('\n');
        }
        return block.toString().strip();
    }
}
