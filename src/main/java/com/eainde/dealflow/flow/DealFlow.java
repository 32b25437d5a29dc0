package com.eainde.dealflow.flow;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.workflow.StageGraph;

import java.util.Map;

/**
 * One flow type as the run coordinator sees it: the compiled stage graph plus
 * what happens right before the first stage and right after the last one.
 *
 * @param <S> state threaded through the flow's stages
 */
public interface DealFlow<S extends DealState> {

    FlowType flowType();

    StageGraph<S> graph();

    /**
     * Loads everything the stages read and returns it as the initial state.
     *
     * @param args flow specific arguments of the trigger, never {@code null}
     * @throws InputResolutionException when a prerequisite is missing
     */
    Map<String, Object> resolveInputs(String runId, String dealId, Map<String, Object> args);

    /**
     * Hands the final state to the deal store and summarizes the run.
     */
    RunResult complete(String runId, String dealId, S finalState);
}
