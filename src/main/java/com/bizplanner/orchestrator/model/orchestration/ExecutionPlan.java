package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExecutionPlan {

    @Builder.Default
    List<Task> tasks = List.of();

    ExecutionMode executionMode;

    /**
     * Rough figure for display; never used for scheduling.
     */
    int estimatedDurationSeconds;

    public static ExecutionPlan empty() {
        return ExecutionPlan.builder().executionMode(ExecutionMode.PARALLEL).build();
    }
}
