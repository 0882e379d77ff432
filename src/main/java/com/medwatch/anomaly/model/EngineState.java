package com.medwatch.anomaly.model;

/**
 * Lifecycle of the detection engine.
 * STOPPED -> INITIALIZING -> READY -> RUNNING -> STOPPED; FAILED is terminal.
 */
public enum EngineState {
    STOPPED,
    INITIALIZING,
    READY,
    RUNNING,
    FAILED
}
