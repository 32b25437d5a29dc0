package com.eainde.dealflow.util;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Null-tolerant helpers for values that arrive from the reasoning service or
 * from collaborators with optional fields.
 */
public final class NullSafe {

    private NullSafe() {
    }

    public static <T> T nvl(T value, T fallback) {
        return value != null ? value : fallback;
    }

    public static String nvl(String value) {
        return value != null ? value : "";
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /** Immutable copy without null elements; {@code null} becomes an empty list. */
    public static <T> List<T> list(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(v -> v != null).toList();
    }

    public static <K, V> Map<K, V> map(Map<K, V> values) {
        return values != null ? values : Map.of();
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
