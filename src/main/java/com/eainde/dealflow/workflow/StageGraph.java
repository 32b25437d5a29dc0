package com.eainde.dealflow.workflow;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.state.DealState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.state.AgentStateFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * A fixed, linear sequence of stages compiled into a langgraph4j graph
 * ({@code START -> s1 -> ... -> sN -> END}).
 * <p>
 * Every stage always runs. Each stage's update is merged together with
 * {@link DealState#CURRENT_STAGE}; the listener hears about a stage only once
 * that merge is done. An exception escaping a stage ends the execution with a
 * {@link StageExecutionException} naming the stage.
 * </p>
 * A compiled graph holds no per-run data, so one instance serves every run of
 * its flow type concurrently.
 */
@Slf4j
public class StageGraph<S extends DealState> {

    private final FlowType flowType;
    private final List<Stage<S>> stages;
    private final Map<String, Integer> indexByName = new HashMap<>();
    private final CompiledGraph<S> compiled;

    public StageGraph(FlowType flowType, AgentStateFactory<S> stateFactory, List<Stage<S>> stages)
            throws GraphStateException {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("A flow needs at least one stage");
        }
        this.flowType = flowType;
        this.stages = List.copyOf(stages);

        StateGraph<S> workflow = new StateGraph<>(stateFactory);
        String previous = START;
        for (int i = 0; i < this.stages.size(); i++) {
            Stage<S> stage = this.stages.get(i);
            if (indexByName.putIfAbsent(stage.name(), i + 1) != null) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
            workflow.addNode(stage.name(), tracked(stage, i + 1));
            workflow.addEdge(previous, stage.name());
            previous = stage.name();
        }
        workflow.addEdge(previous, END);

        this.compiled = workflow.compile(CompileConfig.builder().build());
    }

    public FlowType flowType() {
        return flowType;
    }

    public List<Stage<S>> stages() {
        return stages;
    }

    public int totalStages() {
        return stages.size();
    }

    /**
     * Runs every stage in order against a fresh state built from {@code initialState}.
     *
     * @return the state after the last stage
     * @throws StageExecutionException when a stage raised
     */
    public S execute(Map<String, Object> initialState, StageListener listener) {
        String threadId = String.valueOf(initialState.getOrDefault(DealState.RUN_ID, flowType.value()));
        RunnableConfig config = RunnableConfig.builder()
                .threadId(threadId)
                .build();

        S last = null;
        int completed = 0;
        try {
            for (NodeOutput<S> output : compiled.stream(initialState, config)) {
                last = output.state();
                Integer index = indexByName.get(output.node());
                if (index == null) {
                    // __START__ and __END__
                    continue;
                }
                completed = index;
                log.debug("{} stage {}/{} '{}' merged", flowType.value(), index, stages.size(), output.node());
                listener.stageCompleted(stages.get(index - 1), index, stages.size());
            }
        } catch (RuntimeException e) {
            throw asStageFailure(e, completed);
        }

        if (last == null || completed != stages.size()) {
            throw new StageExecutionException(stageName(completed + 1), completed + 1,
                    new IllegalStateException("Flow ended after " + completed + " of " + stages.size() + " stages"));
        }
        return last;
    }

    private AsyncNodeAction<S> tracked(Stage<S> stage, int index) {
        return state -> {
            CompletableFuture<Map<String, Object>> update;
            try {
                update = stage.action().apply(state);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(new StageExecutionException(stage.name(), index, e));
            }
            return update.handle((partial, error) -> {
                if (error != null) {
                    throw new StageExecutionException(stage.name(), index, unwrap(error));
                }
                Map<String, Object> merged = new LinkedHashMap<>();
                if (partial != null) {
                    partial.forEach((key, value) -> {
                        if (value != null) {
                            merged.put(key, value);
                        }
                    });
                }
                merged.put(DealState.CURRENT_STAGE, stage.name());
                return merged;
            });
        };
    }

    private StageExecutionException asStageFailure(Throwable error, int completed) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StageExecutionException stageFailure) {
                return stageFailure;
            }
        }
        int failedIndex = Math.min(completed + 1, stages.size());
        return new StageExecutionException(stageName(failedIndex), failedIndex, unwrap(error));
    }

    private String stageName(int index) {
        return index >= 1 && index <= stages.size() ? stages.get(index - 1).name() : "unknown";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
