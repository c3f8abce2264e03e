package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.agent.AgentRegistry;
import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.exception.OrchestratorException;
import com.bizplanner.orchestrator.model.agent.AgentDefinition;
import com.bizplanner.orchestrator.model.orchestration.ExecutionMode;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.orchestration.Task;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns an intent into an ordered plan, one task per agent in intent order.
 */
@Component
@RequiredArgsConstructor
public class ExecutionPlanner {

    private final AgentRegistry agentRegistry;
    private final OrchestratorConfig config;

    public ExecutionPlan createPlan(Intent intent) {
        if (intent == null || intent.getExecutionMode() == null) {
            throw new OrchestratorException(OrchestratorException.ErrorCode.PLAN_CREATION_FAILED,
                    "Intent has no execution mode");
        }

        boolean sequential = intent.getExecutionMode() == ExecutionMode.SEQUENTIAL;
        List<String> agents = intent.getAgents();
        List<Task> tasks = new ArrayList<>(agents.size());

        for (int i = 0; i < agents.size(); i++) {
            String agentId = agents.get(i);
            String previousTaskId = tasks.isEmpty() ? null : tasks.get(tasks.size() - 1).getId();
            tasks.add(Task.builder()
                    .id(UUID.randomUUID().toString())
                    .agentId(agentId)
                    .agentName(agentRegistry.getAgent(agentId).map(AgentDefinition::getName).orElse(agentId))
                    .description(intent.getAgentPrompts().getOrDefault(agentId, "Execute " + agentId + " agent"))
                    .skills(intent.getSkills())
                    .dependencies(sequential && previousTaskId != null ? List.of(previousTaskId) : List.of())
                    .priority(i)
                    .build());
        }

        return ExecutionPlan.builder()
                .tasks(List.copyOf(tasks))
                .executionMode(intent.getExecutionMode())
                .estimatedDurationSeconds(tasks.size() * config.getAgent().getPerTaskEstimateSeconds())
                .build();
    }
}
