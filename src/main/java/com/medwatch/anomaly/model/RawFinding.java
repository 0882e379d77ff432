package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Un-normalized detector output. Lives only for the duration of one batch.
 * {@code details} may be a structured map, a JSON string, or any other value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFinding {
    private String severity;
    private String message;
    private String description;
    private Object details;
    private String type;
    private String causesOfShortages;
    private String assignedTo;
    private Double confidence;
    private DataPoint dataPoint;
}
