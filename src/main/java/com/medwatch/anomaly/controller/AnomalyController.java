package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.PagedResponse;
import com.medwatch.anomaly.service.AnomalyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Query detected anomalies and record review outcomes")
public class AnomalyController {

    private final AnomalyService anomalyService;

    public AnomalyController(AnomalyService anomalyService) {
        this.anomalyService = anomalyService;
    }

    @Operation(summary = "List anomalies",
            description = "Newest first, with optional status/severity/medicine filters. " +
                    "Pass the returned nextCursor as 'before' to fetch the next page.")
    @GetMapping
    public ResponseEntity<PagedResponse<Anomaly>> listAnomalies(
            @Parameter(description = "Status filter", example = "active")
            @RequestParam(required = false) String status,
            @Parameter(description = "Severity filter", example = "critical")
            @RequestParam(required = false) String severity,
            @Parameter(description = "Medicine ID filter", example = "MED-0001")
            @RequestParam(required = false) String medicineId,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor from the previous page")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(anomalyService.listAnomalies(status, severity, medicineId, limit, before));
    }

    @Operation(summary = "Get an anomaly by ID")
    @GetMapping("/{anomalyId}")
    public ResponseEntity<Anomaly> getAnomaly(@PathVariable String anomalyId) {
        Anomaly anomaly = anomalyService.getAnomaly(anomalyId);
        if (anomaly == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(anomaly);
    }

    @Operation(summary = "Review an anomaly",
            description = "Set status to acknowledged, resolved or dismissed, optionally assigning it. Stamps reviewedAt.")
    @PostMapping("/{anomalyId}/review")
    public ResponseEntity<?> review(@PathVariable String anomalyId,
                                    @RequestBody Map<String, String> body) {
        String status = body.get("status");
        if (status == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }

        try {
            Anomaly updated = anomalyService.review(anomalyId, status, body.get("assignedTo"));
            if (updated == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(updated);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
