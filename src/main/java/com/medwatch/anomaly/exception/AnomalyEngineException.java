package com.medwatch.anomaly.exception;

/**
 * Base type for every failure raised inside the detection pipeline or by one of its collaborators.
 */
public class AnomalyEngineException extends RuntimeException {

    public AnomalyEngineException(String message) {
        super(message);
    }

    public AnomalyEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
