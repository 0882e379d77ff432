package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Canonical anomaly record produced by the detection pipeline")
public class Anomaly {

    @Schema(description = "Unique anomaly identifier", example = "3f2b8c1e-6a7d-4f0e-9b1a-2c3d4e5f6a7b")
    private String anomalyId;

    @Schema(description = "Which detector produced the anomaly", example = "rule-based",
            allowableValues = {"rule-based", "model-based"})
    private String detectionType;

    @Schema(description = "Severity", example = "high", allowableValues = {"low", "medium", "high", "critical"})
    private String severity;

    @Schema(description = "Short human-readable message",
            example = "Stock for Amoxil 500mg (120) is below the critical threshold (200)")
    private String message;

    @Schema(description = "Longer human-readable description")
    private String description;

    @Schema(description = "Detection confidence between 0 and 1", example = "0.8")
    private double confidence;

    @Schema(description = "Anomaly category", example = "low-stock")
    private String type;

    @Schema(description = "Normalized details. Always contains causesOfShortages.")
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @Schema(description = "Source medicine identifier", example = "MED-0001")
    private String medicineDataId;

    @Schema(description = "Disease / category of the source medicine", example = "Bacterial infection")
    private String disease;

    @Schema(description = "Person or team the anomaly is assigned to", example = "")
    private String assignedTo;

    @Schema(description = "Lifecycle status", example = "active",
            allowableValues = {"active", "acknowledged", "resolved", "dismissed"})
    private String status;

    @Schema(description = "Creation time, UTC ISO-8601", example = "2026-10-19T08:00:00Z")
    private String timestamp;

    @Schema(description = "Review time, UTC ISO-8601. Null until reviewed.")
    private String reviewedAt;
}
