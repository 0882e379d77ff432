package com.medwatch.anomaly.model;

public enum BatchOutcome {
    EMPTY,
    SUCCESS,
    PARTIAL,    // completed, but at least one detector stage, data point or finding failed
    FAILED
}
