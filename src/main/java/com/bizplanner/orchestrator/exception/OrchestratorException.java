package com.bizplanner.orchestrator.exception;

import lombok.Getter;

/**
 * The only orchestration failure that propagates to the caller.
 *
 * Raised when intent resolution or plan creation cannot produce any usable
 * structure. Agent, skill, rule and formula failures are recovered locally and
 * never surface as this exception.
 *
 * @since 2.0.0
 */
@Getter
public class OrchestratorException extends RuntimeException {

    private final ErrorCode code;

    public OrchestratorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public OrchestratorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public enum ErrorCode {
        INTENT_PARSE_FAILED,
        PLAN_CREATION_FAILED,
        ORCHESTRATION_FAILED
    }
}
