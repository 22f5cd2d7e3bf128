package com.williamcallahan.corpussync.web;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.corpussync.domain.UnknownSourceException;
import com.williamcallahan.corpussync.sync.CycleAlreadyRunningException;
import com.williamcallahan.corpussync.sync.CycleStatus;
import com.williamcallahan.corpussync.sync.CycleView;
import com.williamcallahan.corpussync.sync.ReconcilerService;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies trigger acceptance, conflict reporting and cycle lookup.
 */
@WebMvcTest(controllers = TriggerController.class)
@Import(ExceptionResponseBuilder.class)
class TriggerControllerTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ReconcilerService reconcilerService;

    @Test
    void acceptsTriggerAsynchronously() throws Exception {
        given(reconcilerService.trigger("news"))
                .willReturn(new CycleView("cycle-1", "news", CycleStatus.RUNNING, STARTED, null));

        mockMvc.perform(post("/trigger/news"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cycleId").value("cycle-1"))
                .andExpect(jsonPath("$.source").value("news"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void reportsRunningCycleOnConflict() throws Exception {
        given(reconcilerService.trigger("news")).willThrow(new CycleAlreadyRunningException("news", "cycle-0"));

        mockMvc.perform(post("/trigger/news"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.cycleId").value("cycle-0"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void unknownSourceIsNotFound() throws Exception {
        given(reconcilerService.trigger("ghost")).willThrow(new UnknownSourceException("ghost"));

        mockMvc.perform(post("/trigger/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void shuttingDownIsServiceUnavailable() throws Exception {
        given(reconcilerService.trigger("news")).willThrow(new IllegalStateException("Reconciler is shutting down"));

        mockMvc.perform(post("/trigger/news"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Reconciler is shutting down"));
    }

    @Test
    void looksUpCycles() throws Exception {
        given(reconcilerService.cycle("cycle-1"))
                .willReturn(Optional.of(new CycleView("cycle-1", "news", CycleStatus.RUNNING, STARTED, null)));
        given(reconcilerService.cycle("missing")).willReturn(Optional.empty());

        mockMvc.perform(get("/cycles/cycle-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("news"))
                .andExpect(jsonPath("$.startedAt").value("2026-03-01T10:00:00Z"));
        mockMvc.perform(get("/cycles/missing"))
                .andExpect(status().isNotFound());
    }
}
