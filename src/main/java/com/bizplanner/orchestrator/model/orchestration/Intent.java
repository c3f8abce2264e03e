package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Which agents and skills run for one turn, and how.
 *
 * <p>{@code agentPrompts} carries per-agent instructions when the intent was
 * built from trigger-rule output; agents without an entry get the generic
 * task description.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Intent {

    String goal;

    @Builder.Default
    List<String> agents = List.of();

    @Builder.Default
    List<String> skills = List.of();

    @Builder.Default
    ExecutionMode executionMode = ExecutionMode.PARALLEL;

    String reasoning;

    @Builder.Default
    List<String> contextRequirements = List.of();

    @Builder.Default
    Map<String, String> agentPrompts = Map.of();
}
