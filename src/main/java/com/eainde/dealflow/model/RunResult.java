package com.eainde.dealflow.model;

import java.util.Map;

/**
 * Best-effort outcome of a completed run: a short message and a flat summary
 * suitable for progress payloads and status queries.
 */
public record RunResult(String message, Map<String, Object> summary) {

    public RunResult {
        summary = summary != null ? Map.copyOf(summary) : Map.of();
    }
}
