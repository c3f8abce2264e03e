package com.bizplanner.orchestrator.exception;

import lombok.Getter;

@Getter
public class AgentExecutionException extends RuntimeException {

    private final String agentId;

    public AgentExecutionException(String message, String agentId) {
        super(message);
        this.agentId = agentId;
    }

    public AgentExecutionException(String message, String agentId, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }
}
