package com.eainde.dealflow.model;

import java.io.Serializable;

/**
 * An employee staffed on a deal, either picked by a person or by auto-assignment.
 */
public record StaffingAssignment(
        String dealId,
        String employeeId,
        String employeeName,
        String roleOnDeal,
        int allocationPercent,
        Double hourlyRateOverride,
        AssignmentSource assignedBy,
        Integer matchScore
) implements Serializable {

    public boolean isAutomatic() {
        return assignedBy == AssignmentSource.AUTO;
    }
}
