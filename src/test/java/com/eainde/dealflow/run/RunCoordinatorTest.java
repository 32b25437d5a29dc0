package com.eainde.dealflow.run;

import com.eainde.dealflow.flow.DealFlow;
import com.eainde.dealflow.flow.InputResolutionException;
import com.eainde.dealflow.model.EventStatus;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.ProgressEvent;
import com.eainde.dealflow.model.RunResult;
import com.eainde.dealflow.model.RunSnapshot;
import com.eainde.dealflow.model.RunStatus;
import com.eainde.dealflow.progress.InMemoryProgressChannel;
import com.eainde.dealflow.progress.ProgressStream;
import com.eainde.dealflow.state.DealState;
import com.eainde.dealflow.state.MonitoringState;
import com.eainde.dealflow.workflow.Stage;
import com.eainde.dealflow.workflow.StageGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunCoordinatorTest {

    private static final String DEAL = "deal-1";

    private InMemoryRunRegistry registry;
    private InMemoryProgressChannel channel;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRunRegistry(100);
        channel = new InMemoryProgressChannel(Runnable::run);
    }

    private RunCoordinator coordinator(DealFlow<?> flow, Executor executor) {
        return new RunCoordinator(List.of(flow), registry, channel, executor);
    }

    private List<ProgressEvent> recordEvents(String runId) {
        List<ProgressEvent> events = new ArrayList<>();
        channel.subscribe(runId, events::add);
        return events;
    }

    /** Four-stage flow whose behaviour each test tweaks. */
    private static class StubFlow implements DealFlow<MonitoringState> {

        private final StageGraph<MonitoringState> graph;
        private boolean missingDeal;
        private RuntimeException completionFailure;
        private MonitoringState completedWith;

        StubFlow(String failingStage) throws GraphStateException {
            List<Stage<MonitoringState>> stages = new ArrayList<>();
            for (String name : List.of("sentiment", "health", "alert", "recovery")) {
                stages.add(new Stage<>(name, name + " done", state -> {
                    if (name.equals(failingStage)) {
                        throw new IllegalStateException(name + " exploded");
                    }
                    return CompletableFuture.completedFuture(Map.of(name, true));
                }));
            }
            graph = new StageGraph<>(FlowType.MONITORING, MonitoringState::new, stages);
        }

        @Override
        public FlowType flowType() {
            return FlowType.MONITORING;
        }

        @Override
        public StageGraph<MonitoringState> graph() {
            return graph;
        }

        @Override
        public Map<String, Object> resolveInputs(String runId, String dealId, Map<String, Object> args) {
            if (missingDeal) {
                throw new InputResolutionException("Deal not found");
            }
            return Map.of(DealState.RUN_ID, runId, DealState.DEAL_ID, dealId);
        }

        @Override
        public RunResult complete(String runId, String dealId, MonitoringState finalState) {
            if (completionFailure != null) {
                throw completionFailure;
            }
            completedWith = finalState;
            return new RunResult("Monitoring complete", Map.of("health_score", 72));
        }
    }

    @Nested
    @DisplayName("successful run")
    class Success {

        @Test
        void start_shouldPublishStrictlyIncreasingIndices_endingWithCompleted() throws Exception {
            StubFlow flow = new StubFlow(null);
            RunCoordinator coordinator = coordinator(flow, Runnable::run);
            List<ProgressEvent> events = recordEvents("run-1");

            coordinator.start("run-1", FlowType.MONITORING, DEAL, null);

            assertThat(events).extracting(ProgressEvent::stageIndex).containsExactly(0, 1, 2, 3, 4);
            assertThat(events).extracting(ProgressEvent::stage)
                    .containsExactly("start", "sentiment", "health", "alert", "complete");
            ProgressEvent last = events.get(events.size() - 1);
            assertThat(last.status()).isEqualTo(EventStatus.COMPLETED);
            assertThat(last.totalStages()).isEqualTo(4);
            assertThat(last.payload()).containsEntry("health_score", 72);
            assertThat(flow.completedWith.getCurrentStage()).isEqualTo("recovery");
        }

        @Test
        void status_shouldReportCompletedSnapshot() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow(null), Runnable::run);

            String runId = coordinator.start(FlowType.MONITORING, DEAL, Map.of());

            RunSnapshot snapshot = coordinator.status(runId);
            assertThat(snapshot.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(snapshot.stageIndex()).isEqualTo(4);
            assertThat(snapshot.resultSummary()).containsEntry("health_score", 72);
            assertThat(snapshot.dealId()).isEqualTo(DEAL);
        }

        @Test
        void stream_shouldReplayTerminalEvent_afterRunEnded() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow(null), Runnable::run);
            String runId = coordinator.start(FlowType.MONITORING, DEAL, null);

            List<ProgressEvent> seen = new ArrayList<>();
            try (ProgressStream stream = coordinator.stream(runId)) {
                stream.forEachRemaining(seen::add);
            }

            assertThat(seen).singleElement().satisfies(e -> assertThat(e.status()).isEqualTo(EventStatus.COMPLETED));
        }
    }

    @Nested
    @DisplayName("failed run")
    class Failure {

        @Test
        void start_shouldFailAtIndexZero_whenInputsCannotBeResolved() throws Exception {
            StubFlow flow = new StubFlow(null);
            flow.missingDeal = true;
            RunCoordinator coordinator = coordinator(flow, Runnable::run);
            List<ProgressEvent> events = recordEvents("run-1");

            coordinator.start("run-1", FlowType.MONITORING, "missing", null);

            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.status()).isEqualTo(EventStatus.FAILED);
                assertThat(e.stageIndex()).isZero();
                assertThat(e.message()).isEqualTo("Deal not found");
            });
            assertThat(coordinator.status("run-1").status()).isEqualTo(RunStatus.FAILED);
            assertThat(coordinator.status("run-1").error()).isEqualTo("Deal not found");
        }

        @Test
        void start_shouldFailAtStageIndex_whenStageThrows() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow("alert"), Runnable::run);
            List<ProgressEvent> events = recordEvents("run-1");

            coordinator.start("run-1", FlowType.MONITORING, DEAL, null);

            assertThat(events).extracting(ProgressEvent::stageIndex).containsExactly(0, 1, 2, 3);
            ProgressEvent failed = events.get(3);
            assertThat(failed.status()).isEqualTo(EventStatus.FAILED);
            assertThat(failed.message()).contains("alert").contains("alert exploded");
        }

        @Test
        void start_shouldFailAfterLastPublishedIndex_whenCompletionThrows() throws Exception {
            StubFlow flow = new StubFlow(null);
            flow.completionFailure = new IllegalStateException("store offline");
            RunCoordinator coordinator = coordinator(flow, Runnable::run);
            List<ProgressEvent> events = recordEvents("run-1");

            coordinator.start("run-1", FlowType.MONITORING, DEAL, null);

            ProgressEvent failed = events.get(events.size() - 1);
            assertThat(failed.status()).isEqualTo(EventStatus.FAILED);
            assertThat(failed.stageIndex()).isEqualTo(4);
            assertThat(failed.message()).isEqualTo("Error: store offline");
        }

        @Test
        void start_shouldFailRun_whenExecutorRejectsIt() throws Exception {
            Executor saturated = task -> {
                throw new RejectedExecutionException("queue full");
            };
            RunCoordinator coordinator = coordinator(new StubFlow(null), saturated);

            String runId = coordinator.start(FlowType.MONITORING, DEAL, null);

            assertThat(coordinator.status(runId).status()).isEqualTo(RunStatus.FAILED);
            assertThat(channel.lastEvent(runId)).hasValueSatisfying(e -> assertThat(e.stageIndex()).isZero());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void start_shouldRejectDuplicateRunId() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow(null), task -> { });
            coordinator.start("run-1", FlowType.MONITORING, DEAL, null);

            assertThatThrownBy(() -> coordinator.start("run-1", FlowType.MONITORING, DEAL, null))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void start_shouldRejectUnregisteredFlowType() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow(null), Runnable::run);

            assertThatThrownBy(() -> coordinator.start(FlowType.PROPOSAL, DEAL, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void start_shouldLeaveRunQueued_untilExecutorRunsIt() throws Exception {
            List<Runnable> pending = new ArrayList<>();
            RunCoordinator coordinator = coordinator(new StubFlow(null), pending::add);

            String runId = coordinator.start(FlowType.MONITORING, DEAL, null);

            assertThat(coordinator.status(runId).status()).isEqualTo(RunStatus.QUEUED);
            pending.forEach(Runnable::run);
            assertThat(coordinator.status(runId).status()).isEqualTo(RunStatus.COMPLETED);
        }

        @Test
        void status_shouldThrowUnknownRun_forUnknownId() throws Exception {
            RunCoordinator coordinator = coordinator(new StubFlow(null), Runnable::run);

            assertThatThrownBy(() -> coordinator.status("nope")).isInstanceOf(UnknownRunException.class);
            assertThatThrownBy(() -> coordinator.subscribe("nope", event -> { }))
                    .isInstanceOf(UnknownRunException.class);
        }

        @Test
        void constructor_shouldRejectTwoFlowsOfSameType() throws Exception {
            List<DealFlow<?>> flows = List.of(new StubFlow(null), new StubFlow(null));

            assertThatThrownBy(() -> new RunCoordinator(flows, registry, channel, Runnable::run))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
