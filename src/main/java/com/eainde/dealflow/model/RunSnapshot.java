package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of one run in the lifecycle table. Every transition produces a
 * new snapshot; illegal transitions are rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSnapshot(
        @JsonProperty("run_id")         String runId,
        @JsonProperty("flow_type")      FlowType flowType,
        @JsonProperty("deal_id")        String dealId,
        @JsonProperty("status")         RunStatus status,
        @JsonProperty("stage")          String stage,
        @JsonProperty("stage_index")    int stageIndex,
        @JsonProperty("total_stages")   int totalStages,
        @JsonProperty("result_summary") Map<String, Object> resultSummary,
        @JsonProperty("error")          String error,
        @JsonProperty("created_at")     Instant createdAt,
        @JsonProperty("updated_at")     Instant updatedAt
) {

    public static RunSnapshot queued(String runId, FlowType flowType, String dealId, int totalStages) {
        Instant now = Instant.now();
        return new RunSnapshot(runId, flowType, dealId, RunStatus.QUEUED, "queued", 0, totalStages,
                null, null, now, now);
    }

    public RunSnapshot running() {
        return transition(RunStatus.RUNNING, "initializing", 0, null, null);
    }

    public RunSnapshot atStage(String stageName, int index) {
        return transition(RunStatus.RUNNING, stageName, index, null, null);
    }

    public RunSnapshot completed(Map<String, Object> summary) {
        return transition(RunStatus.COMPLETED, "complete", totalStages, Map.copyOf(summary), null);
    }

    public RunSnapshot failed(String reason) {
        return transition(RunStatus.FAILED, stage, stageIndex, null, reason);
    }

    private RunSnapshot transition(RunStatus next, String nextStage, int nextIndex,
                                   Map<String, Object> summary, String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + status + " to " + next);
        }
        if (nextIndex < stageIndex) {
            throw new IllegalStateException("Run " + runId + " stage index cannot go back from "
                    + stageIndex + " to " + nextIndex);
        }
        return new RunSnapshot(runId, flowType, dealId, next, nextStage, nextIndex, totalStages,
                summary, reason, createdAt, Instant.now());
    }
}
