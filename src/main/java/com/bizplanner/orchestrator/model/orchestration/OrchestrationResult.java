package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class OrchestrationResult {
    String synthesis;

    @Builder.Default
    List<AgentOutput> agentOutputs = List.of();

    Intent intent;
    ExecutionPlan plan;
    long executionTimeMs;

    /**
     * Present for questionnaire turns only.
     */
    QuestionConfigSummary questionConfig;
}
