package com.eainde.dealflow.extraction;

/**
 * Result of {@link ResilientExtractor#extract}. Never carries a {@code null} value.
 *
 * @param value    the bound record, or the shape's fallback
 * @param strategy name of the strategy that succeeded, {@code "fallback"} otherwise
 * @param degraded true when the fallback was used
 * @param note     why the fallback was used, {@code null} when it was not
 */
public record Extraction<T>(T value, String strategy, boolean degraded, String note) {

    public static final String FALLBACK = "fallback";

    static <T> Extraction<T> parsed(T value, String strategy) {
        return new Extraction<>(value, strategy, false, null);
    }

    static <T> Extraction<T> fallback(T value, String note) {
        return new Extraction<>(value, FALLBACK, true, note);
    }
}
