package com.medwatch.anomaly.exception;

/**
 * Pending data points could not be fetched from the data source.
 */
public class DataFetchException extends AnomalyEngineException {

    public DataFetchException(String message) {
        super(message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
