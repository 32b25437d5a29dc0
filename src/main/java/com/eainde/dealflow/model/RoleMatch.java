package com.eainde.dealflow.model;

import java.io.Serializable;
import java.util.List;

/**
 * Staffing hint for one key role: the best roster candidates and their overlap scores.
 */
public record RoleMatch(String role, String status, List<Candidate> candidates) implements Serializable {

    public static final String COVERED = "covered";
    public static final String UNFILLED = "unfilled";

    public RoleMatch {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public record Candidate(String employeeId, String name, int matchScore) implements Serializable {
    }
}
