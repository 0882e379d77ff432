package com.medwatch.anomaly.exception;

/**
 * A detector could not load its rules or model artifacts.
 */
public class DetectorLoadException extends AnomalyEngineException {

    public DetectorLoadException(String message) {
        super(message);
    }

    public DetectorLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
