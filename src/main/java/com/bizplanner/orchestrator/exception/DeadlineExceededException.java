package com.bizplanner.orchestrator.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A completion or skill call did not finish within its deadline.
 */
@Getter
public class DeadlineExceededException extends RuntimeException {

    private final String operation;
    private final Duration deadline;

    public DeadlineExceededException(String operation, Duration deadline) {
        super(operation + " exceeded deadline of " + deadline.toMillis() + "ms");
        this.operation = operation;
        this.deadline = deadline;
    }
}
