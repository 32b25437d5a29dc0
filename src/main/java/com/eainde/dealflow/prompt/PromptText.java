package com.eainde.dealflow.prompt;

import com.eainde.dealflow.model.OrganizationProfile;

import java.util.Collection;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Small formatting helpers shared by the prompt builders.
 */
final class PromptText {

    private PromptText() {
    }

    static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : "Unknown";
    }

    static String joined(Collection<String> values, String whenEmpty) {
        return values == null || values.isEmpty() ? whenEmpty : String.join(", ", values);
    }

    static String bullets(Collection<String> values) {
        return values.stream().map(v -> "- " + v).collect(Collectors.joining("\n"));
    }

    static String money(double amount) {
        return String.format(Locale.ROOT, "%,.0f", amount);
    }

    /** Fact sheet block; empty profiles render a single line saying so. */
    static String profileBlock(OrganizationProfile profile) {
        if (profile.isEmpty()) {
            return "No organization profile available; rely on the team data only.";
        }
        return """
                COMPANY: %s (%s)
                HQ: %s | EMPLOYEES: %s | METHODOLOGY: %s
                CERTIFICATIONS: %s
                SERVICES: %s
                KNOWN TECHNOLOGIES: %s
                INDUSTRIES SERVED: %s
                PRIOR ENGAGEMENTS: %s
                AWARDS: %s""".formatted(
                profile.displayName(),
                orUnknown(profile.legalName()),
                orUnknown(profile.headquarters()),
                profile.employeeCount() != null ? profile.employeeCount() : "N/A",
                profile.methodology() != null ? profile.methodology() : "Agile",
                joined(profile.certifications(), "None listed"),
                joined(profile.services(), "Not specified"),
                joined(profile.technologies(), "Not specified"),
                joined(profile.industries(), "Not specified"),
                joined(profile.priorEngagements(), "Not specified"),
                joined(profile.awards(), "None"));
    }
}
