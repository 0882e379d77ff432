package com.medwatch.anomaly.exception;

public class AnomalyPersistenceException extends AnomalyEngineException {

    public AnomalyPersistenceException(String message) {
        super(message);
    }

    public AnomalyPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
