package com.medwatch.anomaly.exception;

public class RuleEvaluationException extends AnomalyEngineException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
