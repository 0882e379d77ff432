package com.medwatch.anomaly.model;

import java.util.Map;

/**
 * Model output for one data point, aligned index-for-index with the scored batch.
 * Optional fields (severity, message, type, details) may be null.
 */
public record ModelPrediction(boolean isAnomaly,
                              double confidence,
                              String severity,
                              String message,
                              String type,
                              Map<String, Object> details) {

    public static ModelPrediction normal(double confidence) {
        return new ModelPrediction(false, confidence, null, null, null, null);
    }
}
