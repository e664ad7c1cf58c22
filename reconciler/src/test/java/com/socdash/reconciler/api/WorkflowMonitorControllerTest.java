package com.socdash.reconciler.api;

import com.socdash.reconciler.merge.LogMergeMode;
import com.socdash.reconciler.merge.StepStateMerger;
import com.socdash.reconciler.model.StepStatus;
import com.socdash.reconciler.model.WorkflowAction;
import com.socdash.reconciler.model.WorkflowSnapshot;
import com.socdash.reconciler.parser.StepPatch;
import com.socdash.reconciler.service.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for WorkflowMonitorController.
 *
 * @WebMvcTest spins up only the web layer (no polling, no backend).
 * The registry and dispatcher are mocks.
 */
@WebMvcTest(WorkflowMonitorController.class)
class WorkflowMonitorControllerTest {

    private static final String INCIDENT = "9b1deb4d-3b7d-4bad-9bdd-2b0d7b3dcb6d";

    @Autowired MockMvc mockMvc;
    @MockitoBean MonitorSessionRegistry registry;
    @MockitoBean ActionDispatcher       dispatcher;

    // ------------------------------------------------------------------
    // POST /monitors/{id}
    // ------------------------------------------------------------------

    @Test
    void open_newSession_returns201Loading() throws Exception {
        PollingSession session = sessionWith(new SessionView(INCIDENT, SessionState.POLLING, null, null, null));
        when(registry.find(INCIDENT)).thenReturn(Optional.empty());
        when(registry.open(INCIDENT)).thenReturn(session);

        mockMvc.perform(post("/monitors/{id}", INCIDENT))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.incidentId").value(INCIDENT))
                .andExpect(jsonPath("$.sessionState").value("POLLING"))
                .andExpect(jsonPath("$.loading").value(true))
                .andExpect(jsonPath("$.steps").isEmpty());
    }

    @Test
    void open_existingSession_returns200() throws Exception {
        PollingSession session = sessionWith(new SessionView(INCIDENT, SessionState.POLLING, progressSnapshot(), null, null));
        when(registry.find(INCIDENT)).thenReturn(Optional.of(session));
        when(registry.open(INCIDENT)).thenReturn(session);

        mockMvc.perform(post("/monitors/{id}", INCIDENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loading").value(false));
    }

    // ------------------------------------------------------------------
    // GET /monitors/{id}
    // ------------------------------------------------------------------

    @Test
    void get_rendersStepsInOrderWithProgress() throws Exception {
        PollingSession session = sessionWith(new SessionView(
                INCIDENT, SessionState.POLLING, progressSnapshot(), "fetchStatus failed: HTTP 502", null));
        when(registry.find(INCIDENT)).thenReturn(Optional.of(session));

        mockMvc.perform(get("/monitors/{id}", INCIDENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topLevelState").value("PROGRESS"))
                .andExpect(jsonPath("$.currentStep").value("block_ip"))
                .andExpect(jsonPath("$.completedSteps").value(2))
                .andExpect(jsonPath("$.totalSteps").value(7))
                .andExpect(jsonPath("$.progressPercent").value(29))
                .andExpect(jsonPath("$.steps[0].key").value("lookup_ip"))
                .andExpect(jsonPath("$.steps[0].displayName").value("IP Reputation Lookup"))
                .andExpect(jsonPath("$.steps[0].status").value("completed"))
                .andExpect(jsonPath("$.steps[2].status").value("running"))
                .andExpect(jsonPath("$.steps[6].key").value("collect_memory"))
                .andExpect(jsonPath("$.steps[6].known").value(false))
                .andExpect(jsonPath("$.error").value("fetchStatus failed: HTTP 502"));
    }

    @Test
    void get_unknownIncident_returns404() throws Exception {
        when(registry.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/monitors/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void list_returnsOpenIncidents() throws Exception {
        when(registry.openIncidents()).thenReturn(List.of("a", "b"));

        mockMvc.perform(get("/monitors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("a"))
                .andExpect(jsonPath("$[1]").value("b"));
    }

    // ------------------------------------------------------------------
    // DELETE /monitors/{id}
    // ------------------------------------------------------------------

    @Test
    void close_openSession_returns204() throws Exception {
        when(registry.close(INCIDENT)).thenReturn(true);

        mockMvc.perform(delete("/monitors/{id}", INCIDENT))
                .andExpect(status().isNoContent());
    }

    @Test
    void close_unknownSession_returns404() throws Exception {
        when(registry.close(INCIDENT)).thenReturn(false);

        mockMvc.perform(delete("/monitors/{id}", INCIDENT))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /monitors/{id}/actions
    // ------------------------------------------------------------------

    @Test
    void action_unsupportedByBackend_returns200WithInformationalKind() throws Exception {
        when(dispatcher.dispatch(INCIDENT, WorkflowAction.ADVANCE)).thenReturn(new ActionOutcome(
                WorkflowAction.ADVANCE, ActionOutcome.Kind.UNSUPPORTED,
                "This action is not available for this workflow backend"));

        mockMvc.perform(post("/monitors/{id}/actions", INCIDENT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"force_next\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("force_next"))
                .andExpect(jsonPath("$.kind").value("UNSUPPORTED"));
    }

    @Test
    void action_unknownName_returns400() throws Exception {
        mockMvc.perform(post("/monitors/{id}/actions", INCIDENT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"retry\"}"))
                .andExpect(status().isBadRequest());

        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void action_noSession_returns404() throws Exception {
        when(dispatcher.dispatch(INCIDENT, WorkflowAction.CANCEL))
                .thenThrow(new SessionNotFoundException(INCIDENT));

        mockMvc.perform(post("/monitors/{id}/actions", INCIDENT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"cancel\"}"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PollingSession sessionWith(SessionView view) {
        PollingSession session = mock(PollingSession.class);
        when(session.view()).thenReturn(view);
        return session;
    }

    /** lookup_ip + quarantine_host done, block_ip running, plus one unknown step. */
    private WorkflowSnapshot progressSnapshot() {
        return new StepStateMerger(LogMergeMode.REPLACE).merge(null, List.of(
                StepPatch.of("lookup_ip", StepStatus.COMPLETED),
                StepPatch.of("quarantine_host", StepStatus.COMPLETED),
                StepPatch.of("block_ip", StepStatus.RUNNING),
                StepPatch.of("collect_memory", StepStatus.PENDING)), "PROGRESS");
    }
}
