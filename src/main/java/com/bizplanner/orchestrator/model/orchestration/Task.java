package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One agent invocation within a plan.
 *
 * <p>{@code dependencies} holds the id of the previous task under
 * sequential execution and is empty under parallel execution.
 * {@code priority} is the task's position in the plan.
 */
@Value
@Builder
public class Task {
    String id;
    String agentId;
    String agentName;
    String description;

    @Builder.Default
    List<String> skills = List.of();

    @Builder.Default
    List<String> dependencies = List.of();

    int priority;
}
