package com.eainde.dealflow.prompt;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * One row of the proposal guidance table: when {@code applies} holds for the
 * requirement mix, the hint goes into the prompt and the optional extra section
 * is added to the outline.
 */
public record GuidanceRule(String name, Predicate<CategoryWeights> applies, String hint, ExtraSection extraSection) {

    public Optional<ExtraSection> section() {
        return Optional.ofNullable(extraSection);
    }

    public record ExtraSection(String title, String guidance) {
    }
}
