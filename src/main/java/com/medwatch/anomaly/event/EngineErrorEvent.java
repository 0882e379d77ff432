package com.medwatch.anomaly.event;

import java.time.Instant;

/**
 * Published when the engine fails to initialize. The engine stays non-operational afterwards.
 */
public record EngineErrorEvent(Throwable cause, Instant at) {}
