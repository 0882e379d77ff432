package com.medwatch.anomaly.event;

import java.time.Instant;

public record EngineStoppedEvent(Instant at) {}
