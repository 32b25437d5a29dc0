package com.eainde.dealflow.flow;

import com.eainde.dealflow.collaborator.RosterProvider;
import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.OrganizationProfile;
import com.eainde.dealflow.util.NullSafe;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Roster and profile lookups for flow inputs. A failing roster system leaves
 * the run with an empty roster or profile and a note in {@code errors}.
 */
@Slf4j
final class RosterInputs {

    private RosterInputs() {
    }

    static List<CapabilityRecord> roster(RosterProvider provider, String dealId, List<String> errors) {
        try {
            return List.copyOf(NullSafe.list(provider.roster()));
        } catch (RuntimeException e) {
            log.warn("Loading the roster for deal {} failed, continuing without it: {}", dealId, e.getMessage());
            errors.add("Roster unavailable: " + e.getMessage());
            return List.of();
        }
    }

    static OrganizationProfile profile(RosterProvider provider, String dealId, List<String> errors) {
        try {
            OrganizationProfile profile = provider.profile();
            return profile != null ? profile : OrganizationProfile.empty();
        } catch (RuntimeException e) {
            log.warn("Loading the organization profile for deal {} failed: {}", dealId, e.getMessage());
            errors.add("Organization profile unavailable: " + e.getMessage());
            return OrganizationProfile.empty();
        }
    }
}
