package com.eainde.dealflow.model;

import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

/**
 * A staffed employee as seen by the proposal flow, with the effective rate.
 */
public record TeamMember(
        String name,
        String role,
        List<String> skills,
        String department,
        double hourlyRate,
        int allocationPercent,
        AssignmentSource assignedBy
) implements Serializable {

    static final int HOURS_PER_MONTH = 160;

    public TeamMember {
        name = NullSafe.nvl(name);
        role = NullSafe.nvl(role);
        department = NullSafe.nvl(department);
        skills = skills != null ? List.copyOf(skills) : List.of();
    }

    public double monthlyCost() {
        return hourlyRate * HOURS_PER_MONTH * (allocationPercent / 100.0);
    }
}
