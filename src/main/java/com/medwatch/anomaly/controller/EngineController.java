package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.engine.AnomalyDetectionEngine;
import com.medwatch.anomaly.exception.BatchExecutionException;
import com.medwatch.anomaly.model.BatchRun;
import com.medwatch.anomaly.model.EngineStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/engine")
@Tag(name = "Engine", description = "Anomaly engine lifecycle: status, start/stop and manual batch runs")
public class EngineController {

    private final AnomalyDetectionEngine engine;

    public EngineController(AnomalyDetectionEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "Get engine status",
            description = "Returns lifecycle state, whether a batch is in flight, the last batch run and the effective configuration.")
    @GetMapping("/status")
    public ResponseEntity<EngineStatus> getStatus() {
        return ResponseEntity.ok(engine.getStatus());
    }

    @Operation(summary = "Start periodic processing",
            description = "Initializes the engine if needed and arms the batch timer. The first batch runs one interval later.")
    @PostMapping("/start")
    public ResponseEntity<?> start() {
        if (!engine.initialize()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Engine failed to initialize", "state", engine.getStatus().state()));
        }
        if (!engine.start()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Engine is already running"));
        }
        return ResponseEntity.ok(engine.getStatus());
    }

    @Operation(summary = "Stop periodic processing",
            description = "Cancels future batches. A batch already in flight finishes normally. Stopping a stopped engine is a no-op.")
    @PostMapping("/stop")
    public ResponseEntity<EngineStatus> stop() {
        engine.stop();
        return ResponseEntity.ok(engine.getStatus());
    }

    @Operation(summary = "Run one batch now",
            description = "Processes pending medicine data immediately on the request thread and returns the batch record.")
    @PostMapping("/run")
    public ResponseEntity<?> runOnce() {
        try {
            Optional<BatchRun> run = engine.runOnce();
            if (run.isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "Another batch is in flight"));
            }
            return ResponseEntity.ok(run.get());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (BatchExecutionException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }
}
