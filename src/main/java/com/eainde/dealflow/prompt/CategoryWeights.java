package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.Requirement;

import java.util.List;
import java.util.Set;

/**
 * Requirement counts per category bucket. Categories outside every bucket only
 * count towards {@link #total()}.
 */
public record CategoryWeights(int technical, int security, int functional, int process, int total) {

    static final Set<String> TECHNICAL = Set.of(
            "technical", "architecture", "infrastructure", "performance", "scalability", "integration");
    static final Set<String> SECURITY = Set.of(
            "security", "compliance", "regulatory", "privacy", "data_protection");
    static final Set<String> FUNCTIONAL = Set.of(
            "functional", "feature", "ui", "ux", "user_experience");
    static final Set<String> PROCESS = Set.of(
            "process", "methodology", "agile", "management", "reporting");

    public static CategoryWeights of(List<Requirement> requirements) {
        int technical = 0;
        int security = 0;
        int functional = 0;
        int process = 0;
        for (Requirement requirement : requirements) {
            String category = requirement.category();
            if (TECHNICAL.contains(category)) {
                technical++;
            } else if (SECURITY.contains(category)) {
                security++;
            } else if (FUNCTIONAL.contains(category)) {
                functional++;
            } else if (PROCESS.contains(category)) {
                process++;
            }
        }
        return new CategoryWeights(technical, security, functional, process, requirements.size());
    }

    public double technicalShare() {
        return share(technical);
    }

    public double functionalShare() {
        return share(functional);
    }

    private double share(int count) {
        return total == 0 ? 0.0 : (double) count / total;
    }
}
