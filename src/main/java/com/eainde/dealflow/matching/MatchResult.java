package com.eainde.dealflow.matching;

import com.eainde.dealflow.model.CapabilityRecord;

import java.util.Set;

/**
 * A roster entry with a non-zero keyword overlap.
 *
 * @param candidate    the roster entry
 * @param score        size of the keyword intersection
 * @param matchedTerms the overlapping keywords, for explanations
 */
public record MatchResult(CapabilityRecord candidate, int score, Set<String> matchedTerms) {
}
