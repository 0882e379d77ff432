package com.medwatch.anomaly.exception;

/**
 * Rule or model loading failed during engine initialization.
 */
public class EngineInitializationException extends AnomalyEngineException {

    public EngineInitializationException(String message) {
        super(message);
    }

    public EngineInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
