package com.eainde.dealflow.extraction;

import java.util.function.Function;

/**
 * What a stage expects back from the reasoning service.
 *
 * @param name     label used in logs and notes
 * @param marker   field the wanted JSON object must contain
 * @param type     record the JSON is bound to
 * @param fallback builds the neutral value from a human readable note
 */
public record ExtractionShape<T>(String name, String marker, Class<T> type, Function<String, T> fallback) {

    public T fallbackValue(String note) {
        return fallback.apply(note);
    }
}
