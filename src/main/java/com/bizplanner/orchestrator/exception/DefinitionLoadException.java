package com.bizplanner.orchestrator.exception;

/**
 * A YAML definition (flow graph, rules, agents, skills, prompts) is missing or malformed.
 * Thrown at start-up only.
 */
public class DefinitionLoadException extends RuntimeException {

    public DefinitionLoadException(String message) {
        super(message);
    }

    public DefinitionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
