package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only roster entry. Skills are lower-cased on construction, availability
 * is forced into [0, 100] and the hourly rate is never negative.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapabilityRecord(
        @JsonProperty("employee_id")          String employeeId,
        @JsonProperty("name")                 String name,
        @JsonProperty("role")                 String role,
        @JsonProperty("department")           String department,
        @JsonProperty("skills")               Set<String> skills,
        @JsonProperty("availability_percent") Integer availabilityPercent,
        @JsonProperty("hourly_rate")          double hourlyRate
) implements Serializable {

    public CapabilityRecord {
        role = NullSafe.nvl(role);
        department = NullSafe.nvl(department);
        Set<String> normalized = new LinkedHashSet<>();
        if (skills != null) {
            for (String skill : skills) {
                if (NullSafe.hasText(skill)) {
                    normalized.add(skill.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        skills = Collections.unmodifiableSet(normalized);
        availabilityPercent = NullSafe.clamp(availabilityPercent != null ? availabilityPercent : 100, 0, 100);
        hourlyRate = Math.max(0.0, hourlyRate);
    }
}
