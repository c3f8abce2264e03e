package com.bizplanner.orchestrator.model.rules;

/**
 * Agent queued by a trigger rule with its interpolated prompt.
 */
public record AgentInvocation(String agentId, String prompt) {
}
