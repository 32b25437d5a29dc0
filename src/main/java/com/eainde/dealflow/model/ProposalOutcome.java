package com.eainde.dealflow.model;

import java.util.List;

public record ProposalOutcome(
        String proposalId,
        String title,
        String content,
        List<ProposalSection> sections,
        ComplianceReport compliance
) {
}
