package com.eainde.dealflow.workflow;

/**
 * Notified after a stage's update has been merged into the state, before the
 * next stage starts.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = (stage, index, total) -> { };

    /**
     * @param stage the stage that just finished
     * @param index its 1-based position
     * @param total number of stages in the flow
     */
    void stageCompleted(Stage<?> stage, int index, int total);
}
