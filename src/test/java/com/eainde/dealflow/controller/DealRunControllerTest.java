package com.eainde.dealflow.controller;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.model.ProgressEvent;
import com.eainde.dealflow.model.RunSnapshot;
import com.eainde.dealflow.progress.ProgressListener;
import com.eainde.dealflow.progress.Subscription;
import com.eainde.dealflow.run.RunCoordinator;
import com.eainde.dealflow.run.UnknownRunException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DealRunControllerTest {

    @Mock
    private RunCoordinator coordinator;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new DealRunController(coordinator)).build();
    }

    @Test
    void start_shouldAcceptRun_andPassDocumentId() throws Exception {
        when(coordinator.start(eq(FlowType.QUALIFICATION), eq("deal-1"), anyMap())).thenReturn("run-1");

        mvc.perform(post("/api/deals/deal-1/runs/qualification").param("documentId", "doc-7"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run_id").value("run-1"))
                .andExpect(jsonPath("$.flow_type").value("qualification"))
                .andExpect(jsonPath("$.deal_id").value("deal-1"));

        verify(coordinator).start(FlowType.QUALIFICATION, "deal-1", Map.of("documentId", "doc-7"));
    }

    @Test
    void start_shouldRejectUnknownFlowType() throws Exception {
        mvc.perform(post("/api/deals/deal-1/runs/forecast"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown flow type: forecast"));
    }

    @Test
    void start_shouldReportConflict_whenRunCannotBeRegistered() throws Exception {
        when(coordinator.start(any(), anyString(), anyMap())).thenThrow(new IllegalStateException("Run id already in use: x"));

        mvc.perform(post("/api/deals/deal-1/runs/monitoring"))
                .andExpect(status().isConflict());
    }

    @Test
    void status_shouldReturnSnapshot() throws Exception {
        when(coordinator.status("run-1")).thenReturn(RunSnapshot.queued("run-1", FlowType.PROPOSAL, "deal-1", 3));

        mvc.perform(get("/api/runs/run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value("run-1"))
                .andExpect(jsonPath("$.flow_type").value("proposal"))
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.total_stages").value(3));
    }

    @Test
    void status_shouldReturnNotFound_forUnknownRun() throws Exception {
        when(coordinator.status("nope")).thenThrow(new UnknownRunException("nope"));

        mvc.perform(get("/api/runs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown run: nope"));
    }

    @Test
    void events_shouldStreamProgressAsServerSentEvents() throws Exception {
        when(coordinator.subscribe(eq("run-1"), any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(1);
            listener.onEvent(ProgressEvent.completed("run-1", 3, "Proposal generated", Map.of("sections", 4)));
            listener.onClose();
            return mock(Subscription.class);
        });

        MvcResult result = mvc.perform(get("/api/runs/run-1/events"))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:completed").contains("\"run_id\":\"run-1\"").contains("\"sections\":4");
    }
}
