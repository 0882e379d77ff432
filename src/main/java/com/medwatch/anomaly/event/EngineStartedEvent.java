package com.medwatch.anomaly.event;

import java.time.Duration;
import java.time.Instant;

public record EngineStartedEvent(Duration processingInterval, Instant at) {}
