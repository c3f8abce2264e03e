package com.bizplanner.orchestrator.client;

/**
 * A model's request to invoke a tool.
 *
 * @param id            call id echoed back with the result
 * @param name          tool (skill) id
 * @param argumentsJson arguments as a JSON object string
 */
public record ToolCallRequest(String id, String name, String argumentsJson) {
}
