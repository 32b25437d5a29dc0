package com.eainde.dealflow.matching;

import com.eainde.dealflow.model.AssignmentSource;
import com.eainde.dealflow.model.CapabilityRecord;
import com.eainde.dealflow.model.Requirement;
import com.eainde.dealflow.model.RoleMatch;
import com.eainde.dealflow.model.StaffingAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic keyword-overlap scoring of a roster against requirements.
 * <p>
 * Keywords are lower-cased whitespace tokens longer than three characters. A
 * roster entry's keywords come from its skills and its role; its score is the
 * size of the intersection with the requirement keywords. Entries without any
 * overlap are left out. Ranking is by descending score and keeps roster order
 * for equal scores, so the same inputs always give the same ranking.
 * </p>
 * No I/O, no shared state: safe to call from any number of runs at once.
 */
@Slf4j
@Component
public class CapabilityMatcher {

    static final int MIN_TOKEN_LENGTH = 4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static Set<String> keywords(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /** Keywords of the requirement texts and their categories. */
    public static Set<String> requirementKeywords(Collection<Requirement> requirements) {
        Set<String> tokens = new LinkedHashSet<>();
        for (Requirement requirement : requirements) {
            tokens.addAll(keywords(requirement.text()));
            tokens.addAll(keywords(requirement.category()));
        }
        return tokens;
    }

    public static Set<String> candidateKeywords(CapabilityRecord candidate) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String skill : candidate.skills()) {
            tokens.addAll(keywords(skill));
        }
        tokens.addAll(keywords(candidate.role()));
        return tokens;
    }

    public List<MatchResult> rank(Set<String> requirementKeywords, List<CapabilityRecord> roster) {
        List<MatchResult> results = new ArrayList<>();
        for (CapabilityRecord candidate : roster) {
            Set<String> overlap = new LinkedHashSet<>(candidateKeywords(candidate));
            overlap.retainAll(requirementKeywords);
            if (!overlap.isEmpty()) {
                results.add(new MatchResult(candidate, overlap.size(), Set.copyOf(overlap)));
            }
        }
        // List.sort is stable, equal scores keep roster order
        results.sort(Comparator.comparingInt(MatchResult::score).reversed());
        return List.copyOf(results);
    }

    public List<MatchResult> rank(Collection<Requirement> requirements, List<CapabilityRecord> roster) {
        return rank(requirementKeywords(requirements), roster);
    }

    /**
     * Best candidates for one key role, scored on the role title's keywords.
     *
     * @param limit maximum number of candidates listed in the hint
     */
    public RoleMatch matchRole(String role, List<CapabilityRecord> roster, int limit) {
        List<RoleMatch.Candidate> candidates = rank(keywords(role), roster).stream()
                .limit(limit)
                .map(m -> new RoleMatch.Candidate(m.candidate().employeeId(), m.candidate().name(), m.score()))
                .toList();
        return new RoleMatch(role, candidates.isEmpty() ? RoleMatch.UNFILLED : RoleMatch.COVERED, candidates);
    }

    /**
     * Auto-assigns the top {@code limit} ranked candidates to a deal.
     * <p>
     * Manual assignments are kept as they are and their holders are not picked
     * again. Every earlier automatic assignment is dropped. Allocation is the
     * candidate's availability, at most 100.
     * </p>
     *
     * @param ranked   output of {@link #rank}, best first
     * @param existing current assignments of the deal
     */
    public StaffingPlan autoAssign(String dealId, List<MatchResult> ranked,
                                   List<StaffingAssignment> existing, int limit) {
        List<StaffingAssignment> manual = existing.stream()
                .filter(a -> a.assignedBy() == AssignmentSource.MANUAL)
                .toList();
        Set<String> manuallyStaffed = new LinkedHashSet<>();
        manual.forEach(a -> manuallyStaffed.add(a.employeeId()));

        List<StaffingAssignment> automatic = ranked.stream()
                .filter(m -> !manuallyStaffed.contains(m.candidate().employeeId()))
                .limit(Math.max(0, limit))
                .map(m -> new StaffingAssignment(
                        dealId,
                        m.candidate().employeeId(),
                        m.candidate().name(),
                        m.candidate().role(),
                        Math.min(m.candidate().availabilityPercent(), 100),
                        null,
                        AssignmentSource.AUTO,
                        m.score()))
                .toList();

        int superseded = (int) existing.stream().filter(StaffingAssignment::isAutomatic).count();
        log.info("Deal {}: {} automatic assignments replace {}, {} manual kept",
                dealId, automatic.size(), superseded, manual.size());
        return new StaffingPlan(manual, automatic);
    }
}
