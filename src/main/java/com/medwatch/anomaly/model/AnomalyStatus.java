package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review lifecycle of a persisted anomaly. New anomalies are always ACTIVE.
 */
public enum AnomalyStatus {
    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String label;

    AnomalyStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static AnomalyStatus fromLabel(String value) {
        for (AnomalyStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly status: " + value);
    }
}
