package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.Requirement;

import java.util.ArrayList;
import java.util.List;

/**
 * The rule table deciding which strategy hints and extra sections a proposal
 * prompt gets. Evaluated before prompt assembly; the prompt only renders the
 * result.
 */
public final class ProposalGuidanceRules {

    /** The core outline has seven sections; extra ones are numbered from here. */
    public static final int FIRST_EXTRA_SECTION = 8;

    static final String BALANCED_HINT = "Provide a well-balanced proposal covering solution design, "
            + "implementation approach and business value. Emphasize the ability to deliver quality results on time.";

    private static final List<GuidanceRule> RULES = List.of(
            new GuidanceRule("technical",
                    w -> w.technicalShare() > 0.3,
                    "This is a TECHNICALLY HEAVY project. Go deep on architecture, technology choices with "
                            + "justifications, scalability approach and performance targets.",
                    new GuidanceRule.ExtraSection("Technical Architecture Deep-Dive",
                            "Break down the system architecture: components, data flow, API design and the "
                                    + "rationale for each technology choice against these requirements.")),
            new GuidanceRule("security",
                    w -> w.security() > 0,
                    "This project has SECURITY/COMPLIANCE requirements. Explain how compliance will be ensured "
                            + "and reference the relevant standards and certifications.",
                    new GuidanceRule.ExtraSection("Security & Compliance Framework",
                            "Address every security and compliance requirement. Reference standards (ISO 27001, "
                                    + "SOC 2, GDPR) where relevant. Cover audit trail, access control and data protection.")),
            new GuidanceRule("functional",
                    w -> w.functionalShare() > 0.3,
                    "This project is FEATURE-RICH. Focus on user experience, feature prioritization and how each "
                            + "functional requirement maps to a concrete deliverable.",
                    null),
            new GuidanceRule("process",
                    w -> w.process() > 0,
                    "The client cares about PROCESS & METHODOLOGY. Emphasize sprint cycles, communication cadence, "
                            + "reporting, stakeholder involvement and risk mitigation.",
                    null),
            new GuidanceRule("traceability",
                    w -> w.total() > 10,
                    "There are MANY requirements. Organize them into logical groups and make sure every requirement "
                            + "is visibly addressed somewhere in the proposal.",
                    null));

    private ProposalGuidanceRules() {
    }

    public static List<GuidanceRule> rules() {
        return RULES;
    }

    public static ProposalGuidance evaluate(List<Requirement> requirements) {
        return evaluate(CategoryWeights.of(requirements));
    }

    public static ProposalGuidance evaluate(CategoryWeights weights) {
        List<String> fired = new ArrayList<>();
        List<String> hints = new ArrayList<>();
        List<GuidanceRule.ExtraSection> sections = new ArrayList<>();
        for (GuidanceRule rule : RULES) {
            if (rule.applies().test(weights)) {
                fired.add(rule.name());
                hints.add(rule.hint());
                rule.section().ifPresent(sections::add);
            }
        }
        if (hints.isEmpty()) {
            hints.add(BALANCED_HINT);
        }
        return new ProposalGuidance(fired, hints, sections, FIRST_EXTRA_SECTION + sections.size());
    }
}
