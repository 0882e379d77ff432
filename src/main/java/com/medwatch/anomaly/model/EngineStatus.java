package com.medwatch.anomaly.model;

public record EngineStatus(EngineState state,
                           boolean running,
                           boolean batchInFlight,
                           BatchRun lastBatch,
                           boolean ruleEngineEnabled,
                           boolean mlModelsEnabled,
                           long processingIntervalMs,
                           double alertThreshold) {}
