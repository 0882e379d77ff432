package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRun {
    private String batchId;
    private Instant startedAt;
    private Instant completedAt;
    private int dataPointCount;
    private int anomalyCount;
    private int failureCount;
    private BatchOutcome outcome;
}
