package com.eainde.dealflow.prompt;

import java.util.List;

/**
 * Outcome of evaluating the guidance table for one requirement set.
 *
 * @param firedRules      names of the rules that applied, in table order
 * @param hints           strategy hints for the prompt, never empty
 * @param extraSections   sections inserted after the core outline
 * @param nextStepsNumber number of the closing "Next Steps" section
 */
public record ProposalGuidance(List<String> firedRules, List<String> hints,
                               List<GuidanceRule.ExtraSection> extraSections, int nextStepsNumber) {

    public ProposalGuidance {
        firedRules = List.copyOf(firedRules);
        hints = List.copyOf(hints);
        extraSections = List.copyOf(extraSections);
    }
}
