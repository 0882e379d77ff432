package com.medwatch.anomaly.event;

import com.medwatch.anomaly.model.BatchRun;

/**
 * Published once per non-empty batch that got past preprocessing.
 */
public record BatchProcessedEvent(int batchSize, BatchRun batchRun) {}
