package com.medwatch.anomaly.exception;

/**
 * A batch could not be preprocessed.
 */
public class PreprocessException extends AnomalyEngineException {

    public PreprocessException(String message) {
        super(message);
    }

    public PreprocessException(String message, Throwable cause) {
        super(message, cause);
    }
}
