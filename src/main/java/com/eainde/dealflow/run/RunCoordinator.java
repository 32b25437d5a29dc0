package com.eainde.dealflow.run;

import com.eainde.dealflow.flow.DealFlow;
import com.eainde.dealflow.flow.InputResolutionException;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.ProgressEvent;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.model.RunSnapshot;
import com.eainde.dealflow.progress.ProgressChannel;
import com.eainde.dealflow.progress.ProgressListener;
import com.eainde.dealflow.progress.ProgressStream;
import com.eainde.dealflow.progress.Subscription;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.workflow.StageExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running deal flows.
 * <p>
 * Every {@link DealFlow} bean is registered by its flow type. {@link #start}
 * records the run as queued and hands it to the run executor, so the caller
 * gets the run id back right away. The run then resolves its inputs, streams
 * through its stages and ends completed or failed, publishing progress on the
 * {@link ProgressChannel} as it goes:
 * </p>
 * <ul>
 * <li>{@code processing} at index 0 once the inputs are resolved,</li>
 * <li>{@code processing} after every stage but the last, at that stage's index,</li>
 * <li>{@code completed} at index {@code total} with the result summary,</li>
 * <li>{@code failed} at index 0 for missing inputs or a rejected schedule, at
 * the failing stage's index when a stage raised, otherwise one past the last
 * published index.</li>
 * </ul>
 * Log lines written while a run executes carry {@code runId} and
 * {@code flowType} in the MDC.
 */
@Slf4j
@Service
public class RunCoordinator {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_FLOW_TYPE = "flowType";

    private final Map<FlowType, DealFlow<?>> flows = new EnumMap<>(FlowType.class);
    private final RunRegistry registry;
    private final ProgressChannel channel;
    private final Executor executor;

    public RunCoordinator(List<DealFlow<?>> flows,
                          RunRegistry registry,
                          ProgressChannel channel,
                          @Qualifier("runExecutor") Executor executor) {
        for (DealFlow<?> flow : flows) {
            if (this.flows.putIfAbsent(flow.flowType(), flow) != null) {
                throw new IllegalStateException("Two flows registered for " + flow.flowType().value());
            }
        }
        this.registry = registry;
        this.channel = channel;
        this.executor = executor;
        log.info("Registered flows: {}", this.flows.keySet());
    }

    /**
     * Starts a run under a fresh id.
     *
     * @param args flow specific arguments, may be {@code null}
     * @return the run id
     * @throws IllegalArgumentException when no flow is registered for the type
     */
    public String start(FlowType flowType, String dealId, Map<String, Object> args) {
        return start(UUID.randomUUID().toString(), flowType, dealId, args);
    }

    /**
     * Starts a run under a caller chosen id.
     *
     * @throws IllegalStateException when {@code runId} is already in use
     */
    public String start(String runId, FlowType flowType, String dealId, Map<String, Object> args) {
        DealFlow<?> flow = flows.get(flowType);
        if (flow == null) {
            throw new IllegalArgumentException("No flow registered for " + flowType);
        }
        Map<String, Object> arguments = args != null ? Map.copyOf(args) : Map.of();

        RunSnapshot queued = RunSnapshot.queued(runId, flowType, dealId, flow.graph().totalStages());
        registry.register(queued).forEach(channel::forget);
        log.info("Run {} queued: {} flow for deal {}", runId, flowType.value(), dealId);

        try {
            executor.execute(() -> execute(flow, runId, dealId, arguments));
        } catch (RejectedExecutionException e) {
            log.error("Run {} could not be scheduled: {}", runId, e.getMessage());
            fail(runId, 0, queued.totalStages(), "Run could not be scheduled, the service is busy");
        }
        return runId;
    }

    /**
     * @throws UnknownRunException when the run is not (or no longer) known
     */
    public RunSnapshot status(String runId) {
        return registry.find(runId).orElseThrow(() -> new UnknownRunException(runId));
    }

    public Subscription subscribe(String runId, ProgressListener listener) {
        status(runId);
        return channel.subscribe(runId, listener);
    }

    public ProgressStream stream(String runId) {
        status(runId);
        return channel.stream(runId);
    }

    private <S extends DealState> void execute(DealFlow<S> flow, String runId, String dealId,
                                               Map<String, Object> args) {
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_FLOW_TYPE, flow.flowType().value());
        int total = flow.graph().totalStages();
        AtomicInteger lastPublished = new AtomicInteger(-1);
        try {
            registry.update(runId, RunSnapshot::running);

            Map<String, Object> inputs;
            try {
                inputs = flow.resolveInputs(runId, dealId, args);
            } catch (InputResolutionException e) {
                log.warn("Run {} cannot start: {}", runId, e.getMessage());
                fail(runId, 0, total, e.getMessage());
                return;
            }

            channel.publish(ProgressEvent.processing(runId, "start", 0, total,
                    "Starting " + flow.flowType().value() + " flow..."));
            lastPublished.set(0);

            S finalState = flow.graph().execute(inputs, (stage, index, stageCount) -> {
                registry.update(runId, snapshot -> snapshot.atStage(stage.name(), index));
                if (index < stageCount) {
                    channel.publish(ProgressEvent.processing(runId, stage.name(), index, stageCount, stage.message()));
                    lastPublished.set(index);
                }
            });
            if (!finalState.getErrors().isEmpty()) {
                log.info("Run {} finished with {} degraded steps: {}", runId,
                        finalState.getErrors().size(), finalState.getErrors());
            }

            RunResult result = flow.complete(runId, dealId, finalState);
            registry.update(runId, snapshot -> snapshot.completed(result.summary()));
            channel.publish(ProgressEvent.completed(runId, total, result.message(), result.summary()));
            log.info("Run {} completed: {}", runId, result.summary());
        } catch (StageExecutionException e) {
            log.error("Run {} failed in stage '{}'", runId, e.getStageName(), e);
            fail(runId, e.getStageIndex(), total, "Stage '" + e.getStageName() + "' failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run {} failed", runId, e);
            fail(runId, Math.min(total, lastPublished.get() + 1), total, "Error: " + e.getMessage());
        } finally {
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_FLOW_TYPE);
        }
    }

    private void fail(String runId, int stageIndex, int total, String reason) {
        try {
            registry.update(runId, snapshot -> snapshot.failed(reason));
        } catch (UnknownRunException e) {
            log.warn("Run {} was evicted before it could be marked failed", runId);
        }
        channel.publish(ProgressEvent.failed(runId, stageIndex, total, reason));
    }
}
