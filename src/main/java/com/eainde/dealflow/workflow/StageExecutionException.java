package com.eainde.dealflow.workflow;

import lombok.Getter;

/**
 * An exception escaped a stage. Carries the stage so the run can report where
 * it failed.
 */
@Getter
public class StageExecutionException extends RuntimeException {

    private final String stageName;
    private final int stageIndex;

    public StageExecutionException(String stageName, int stageIndex, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.stageName = stageName;
        this.stageIndex = stageIndex;
    }
}
