package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionType {
    RULE_BASED("rule-based"),
    MODEL_BASED("model-based");

    private final String label;

    DetectionType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
