package com.eainde.dealflow.extraction;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One way of locating structured data inside a raw reasoning response.
 * Implementations are pure and must not throw.
 */
public interface ParseStrategy {

    String name();

    /**
     * @param text   raw response text, never {@code null}
     * @param marker a field name the wanted object is expected to contain
     * @return the parsed object or array, empty when this strategy does not apply
     */
    Optional<JsonNode> parse(String text, String marker);
}
