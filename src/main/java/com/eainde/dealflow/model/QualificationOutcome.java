package com.eainde.dealflow.model;

import java.util.List;

/**
 * What a finished qualification run hands to the deal store.
 *
 * @param assignments the deal's full assignment list after auto-assignment
 */
public record QualificationOutcome(
        List<Requirement> requirements,
        DealEntities entities,
        GapAnalysis gapAnalysis,
        List<RoleMatch> roleMatches,
        QualificationDecision decision,
        List<StaffingAssignment> assignments
) {
}
