package com.medwatch.anomaly.exception;

public class ModelPredictionException extends AnomalyEngineException {

    public ModelPredictionException(String message) {
        super(message);
    }

    public ModelPredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
