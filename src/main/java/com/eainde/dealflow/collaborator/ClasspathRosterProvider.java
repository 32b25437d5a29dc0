package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.OrganizationProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Roster and organization profile read once from classpath JSON files. A
 * missing or unreadable file leaves an empty roster or profile and a warning.
 */
@Slf4j
public class ClasspathRosterProvider implements RosterProvider {

    private final List<CapabilityRecord> roster;
    private final OrganizationProfile profile;

    public ClasspathRosterProvider(ObjectMapper objectMapper, String rosterPath, String profilePath) {
        this.roster = List.copyOf(load(objectMapper, rosterPath,
                new TypeReference<List<CapabilityRecord>>() { }, List.of()));
        this.profile = load(objectMapper, profilePath, new TypeReference<OrganizationProfile>() { },
                OrganizationProfile.empty());
        log.info("Loaded roster with {} employees, organization profile '{}'", roster.size(), profile.displayName());
    }

    @Override
    public List<CapabilityRecord> roster() {
        return roster;
    }

    @Override
    public OrganizationProfile profile() {
        return profile;
    }

    private static <T> T load(ObjectMapper objectMapper, String path, TypeReference<T> type, T fallback) {
        if (path == null || path.isBlank()) {
            return fallback;
        }
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Fixture {} not found on the classpath", path);
            return fallback;
        }
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            return value != null ? value : fallback;
        } catch (IOException e) {
            log.warn("Failed to read fixture {}: {}", path, e.getMessage());
            return fallback;
        }
    }
}
