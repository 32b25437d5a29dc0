package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

/**
 * Organization fact sheet. Only ever used to enrich prompts; it never changes
 * deterministic scoring.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrganizationProfile(
        @JsonProperty("brand_name")         String brandName,
        @JsonProperty("legal_name")         String legalName,
        @JsonProperty("headquarters")       String headquarters,
        @JsonProperty("employee_count")     Integer employeeCount,
        @JsonProperty("methodology")        String methodology,
        @JsonProperty("certifications")     List<String> certifications,
        @JsonProperty("services")           List<String> services,
        @JsonProperty("technologies")       List<String> technologies,
        @JsonProperty("industries")         List<String> industries,
        @JsonProperty("prior_engagements")  List<String> priorEngagements,
        @JsonProperty("awards")             List<String> awards
) implements Serializable {

    public OrganizationProfile {
        certifications = NullSafe.list(certifications);
        services = NullSafe.list(services);
        technologies = NullSafe.list(technologies);
        industries = NullSafe.list(industries);
        priorEngagements = NullSafe.list(priorEngagements);
        awards = NullSafe.list(awards);
    }

    public static OrganizationProfile empty() {
        return new OrganizationProfile(null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return brandName == null && services.isEmpty() && technologies.isEmpty() && certifications.isEmpty();
    }

    public String displayName() {
        return NullSafe.hasText(brandName) ? brandName : "our company";
    }
}
