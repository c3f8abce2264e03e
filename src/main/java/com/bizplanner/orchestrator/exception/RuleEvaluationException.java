package com.bizplanner.orchestrator.exception;

/**
 * A skip predicate or trigger condition could not be evaluated.
 * Callers treat this as "predicate does not hold".
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
