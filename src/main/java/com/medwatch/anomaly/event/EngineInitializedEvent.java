package com.medwatch.anomaly.event;

import java.time.Instant;

public record EngineInitializedEvent(int ruleCount, boolean modelsLoaded, Instant at) {}
