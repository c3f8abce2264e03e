package com.bizplanner.orchestrator.model.orchestration;

/**
 * A tool call made by an agent and the payload sent back to the model.
 */
public record ToolCallRecord(String callId, String skillId, String argumentsJson, String resultPayload, boolean success) {
}
