package com.medwatch.anomaly.exception;

public class AlertDispatchException extends AnomalyEngineException {

    public AlertDispatchException(String message) {
        super(message);
    }

    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
