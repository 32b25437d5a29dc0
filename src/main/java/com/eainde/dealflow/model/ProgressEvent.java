package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One observable stage transition of a run.
 *
 * @param runId       run the event belongs to
 * @param stage       stage name, or {@code "start"} / {@code "complete"} / {@code "error"}
 * @param stageIndex  1-based index of the stage; 0 before the first stage
 * @param totalStages fixed stage count of the run's flow type
 * @param status      processing, completed or failed
 * @param message     human readable progress text
 * @param payload     optional structured data, the result summary on completion
 * @param timestamp   publication time
 */
public record ProgressEvent(
        @JsonProperty("run_id")       String runId,
        @JsonProperty("stage")        String stage,
        @JsonProperty("stage_index")  int stageIndex,
        @JsonProperty("total_stages") int totalStages,
        @JsonProperty("status")       EventStatus status,
        @JsonProperty("message")      String message,
        @JsonProperty("payload")      Map<String, Object> payload,
        @JsonProperty("timestamp")    Instant timestamp
) {

    public ProgressEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static ProgressEvent processing(String runId, String stage, int index, int total, String message) {
        return new ProgressEvent(runId, stage, index, total, EventStatus.PROCESSING, message, Map.of(), Instant.now());
    }

    public static ProgressEvent completed(String runId, int total, String message, Map<String, Object> payload) {
        return new ProgressEvent(runId, "complete", total, total, EventStatus.COMPLETED, message, payload, Instant.now());
    }

    public static ProgressEvent failed(String runId, int index, int total, String message) {
        return new ProgressEvent(runId, "error", index, total, EventStatus.FAILED, message, Map.of(), Instant.now());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
