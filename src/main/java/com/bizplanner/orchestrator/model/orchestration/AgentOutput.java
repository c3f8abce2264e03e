package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one task. Produced for every task, including failed ones.
 *
 * @since 2.0.0
 */
@Value
@Builder
public class AgentOutput {
    String taskId;
    String agentId;
    String agentName;

    @Builder.Default
    String output = "";

    @Builder.Default
    List<String> skillsUsed = List.of();

    @Builder.Default
    List<ToolCallRecord> toolCalls = List.of();

    long executionTimeMs;
    boolean success;
    String error;

    public static AgentOutput failed(Task task, String error, long executionTimeMs) {
        return AgentOutput.builder()
                .taskId(task.getId())
                .agentId(task.getAgentId())
                .agentName(task.getAgentName())
                .executionTimeMs(executionTimeMs)
                .success(false)
                .error(error == null || error.isBlank() ? "Unknown error" : error)
                .build();
    }
}
