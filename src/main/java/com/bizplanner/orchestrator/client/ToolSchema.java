package com.bizplanner.orchestrator.client;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Invocable function offered to the model: a name, a description and a JSON
 * schema (as a map) describing the arguments object.
 */
@Value
@Builder
public class ToolSchema {
    String name;
    String description;

    @Builder.Default
    Map<String, Object> parameters = Map.of("type", "object");
}
