package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.OrganizationProfile;

import java.util.List;

public interface RosterProvider {

    /** Active employees; a run takes one snapshot before its first stage. */
    List<CapabilityRecord> roster();

    /** Fact sheet used in prompts only; {@link OrganizationProfile#empty()} when there is none. */
    OrganizationProfile profile();
}
