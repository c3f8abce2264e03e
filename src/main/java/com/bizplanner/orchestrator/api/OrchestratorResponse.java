package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.orchestration.OrchestrationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorResponse {

    private boolean success;
    private String error;
    private String errorCode;

    private String synthesis;
    private Intent intent;
    private ExecutionPlan plan;
    private long executionTimeMs;

    @Builder.Default
    private List<AgentOutput> agentOutputs = new ArrayList<>();

    public static OrchestratorResponse success(OrchestrationResult result) {
        return OrchestratorResponse.builder()
            .success(true)
            .synthesis(result.getSynthesis())
            .intent(result.getIntent())
            .plan(result.getPlan())
            .executionTimeMs(result.getExecutionTimeMs())
            .agentOutputs(new ArrayList<>(result.getAgentOutputs()))
            .build();
    }

    public static OrchestratorResponse error(String errorCode, String error) {
        return OrchestratorResponse.builder()
            .success(false)
            .errorCode(errorCode)
            .error(error)
            .build();
    }
}
