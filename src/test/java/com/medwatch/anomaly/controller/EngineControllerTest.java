package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.engine.AnomalyDetectionEngine;
import com.medwatch.anomaly.exception.BatchExecutionException;
import com.medwatch.anomaly.model.BatchOutcome;
import com.medwatch.anomaly.model.BatchRun;
import com.medwatch.anomaly.model.EngineState;
import com.medwatch.anomaly.model.EngineStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EngineController.class)
class EngineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionEngine engine;

    private static EngineStatus status(EngineState state, boolean running) {
        return new EngineStatus(state, running, false, null, true, true, 30000L, 0.7);
    }

    @Test
    void getStatus_success() throws Exception {
        when(engine.getStatus()).thenReturn(status(EngineState.READY, false));

        mockMvc.perform(get("/api/v1/engine/status"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.state").value("READY"))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.processingIntervalMs").value(30000))
                .andExpect(jsonPath("$.alertThreshold").value(0.7));
    }

    @Test
    void start_success() throws Exception {
        when(engine.initialize()).thenReturn(true);
        when(engine.start()).thenReturn(true);
        when(engine.getStatus()).thenReturn(status(EngineState.RUNNING, true));

        mockMvc.perform(post("/api/v1/engine/start"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.state").value("RUNNING"));
    }

    @Test
    void start_alreadyRunning_conflict() throws Exception {
        when(engine.initialize()).thenReturn(true);
        when(engine.start()).thenReturn(false);

        mockMvc.perform(post("/api/v1/engine/start"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(jsonPath("$.error").value("Engine is already running"));
    }

    @Test
    void start_initializationFailed_conflict() throws Exception {
        when(engine.initialize()).thenReturn(false);
        when(engine.getStatus()).thenReturn(status(EngineState.FAILED, false));

        mockMvc.perform(post("/api/v1/engine/start"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(jsonPath("$.state").value("FAILED"));
        verify(engine, never()).start();
    }

    @Test
    void stop_alwaysReturnsStatus() throws Exception {
        when(engine.getStatus()).thenReturn(status(EngineState.STOPPED, false));

        mockMvc.perform(post("/api/v1/engine/stop"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.state").value("STOPPED"));
        verify(engine).stop();
    }

    @Test
    void run_success() throws Exception {
        BatchRun run = BatchRun.builder().batchId("B-1").outcome(BatchOutcome.SUCCESS)
                .dataPointCount(3).anomalyCount(1).build();
        when(engine.runOnce()).thenReturn(Optional.of(run));

        mockMvc.perform(post("/api/v1/engine/run"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(jsonPath("$.batchId").value("B-1"))
                .andExpect(jsonPath("$.outcome").value("SUCCESS"))
                .andExpect(jsonPath("$.anomalyCount").value(1));
    }

    @Test
    void run_batchInFlight_conflict() throws Exception {
        when(engine.runOnce()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/engine/run"))
                .andExpect(MockMvcResultMatchers.status().isConflict());
    }

    @Test
    void run_batchFailed_serverError() throws Exception {
        when(engine.runOnce()).thenThrow(new BatchExecutionException("Batch run failed: scan timeout",
                new IllegalStateException("scan timeout")));

        mockMvc.perform(post("/api/v1/engine/run"))
                .andExpect(MockMvcResultMatchers.status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Batch run failed: scan timeout"));
    }

    @Test
    void run_notInitialized_conflict() throws Exception {
        when(engine.runOnce()).thenThrow(new IllegalStateException("Anomaly engine is not initialized (state=STOPPED)"));

        mockMvc.perform(post("/api/v1/engine/run"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(jsonPath("$.error").value("Anomaly engine is not initialized (state=STOPPED)"));
    }
}
