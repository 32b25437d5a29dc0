package com.eainde.dealflow.controller;

import com.eainde.dealflow.flow.QualificationFlow;
import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.ProgressEvent;
import com.eainde.dealflow.model.RunSnapshot;
import com.eainde.dealflow.progress.ProgressListener;
import com.eainde.dealflow.progress.Subscription;
import com.eainde.dealflow.run.RunCoordinator;
import com.eainde.dealflow.run.UnknownRunException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Trigger, status and live progress of deal flow runs.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DealRunController {

    private static final long SSE_TIMEOUT_MS = 30 * 60 * 1000L;

    private final RunCoordinator coordinator;

    @PostMapping("/deals/{dealId}/runs/{flowType}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> start(@PathVariable String dealId,
                                     @PathVariable String flowType,
                                     @RequestParam(required = false) String documentId) {
        FlowType type = FlowType.fromValue(flowType);
        Map<String, Object> args = new HashMap<>();
        if (documentId != null && !documentId.isBlank()) {
            args.put(QualificationFlow.ARG_DOCUMENT_ID, documentId);
        }
        String runId = coordinator.start(type, dealId, args);
        return Map.of(
                "run_id", runId,
                "flow_type", type.value(),
                "deal_id", dealId);
    }

    @GetMapping("/runs/{runId}")
    public RunSnapshot status(@PathVariable String runId) {
        return coordinator.status(runId);
    }

    @GetMapping("/runs/{runId}/events")
    public SseEmitter events(@PathVariable String runId) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        Subscription subscription = coordinator.subscribe(runId, new ProgressListener() {
            @Override
            public void onEvent(ProgressEvent event) throws IOException {
                emitter.send(SseEmitter.event()
                        .name(event.status().value())
                        .data(event));
            }

            @Override
            public void onClose() {
                emitter.complete();
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(error -> subscription.close());
        return emitter;
    }

    @ExceptionHandler(UnknownRunException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> unknownRun(UnknownRunException e) {
        return Map.of("error", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        return Map.of("error", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> conflict(IllegalStateException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return Map.of("error", e.getMessage());
    }
}
