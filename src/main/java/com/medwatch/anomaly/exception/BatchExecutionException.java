package com.medwatch.anomaly.exception;

/**
 * A manually triggered batch failed outside the pipeline's own per-stage error handling.
 */
public class BatchExecutionException extends AnomalyEngineException {

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
