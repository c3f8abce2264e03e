package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.exception.OrchestratorException;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.orchestration.OrchestrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * One orchestration turn: resolve intent, plan, execute, synthesize.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Orchestrator {

    private final IntentResolver intentResolver;
    private final ExecutionPlanner executionPlanner;
    private final TaskExecutionEngine executionEngine;
    private final ResponseSynthesizer synthesizer;

    /**
     * @throws OrchestratorException when no intent or plan can be produced
     */
    public OrchestrationResult processRequest(String message, Map<String, ?> context) {
        long start = System.currentTimeMillis();
        try {
            log.info("Processing request: {}", abbreviate(message));

            log.info("Step 1: Resolving intent...");
            Intent intent = intentResolver.resolveIntent(message, context);

            return run(intent, message, context, start);
        } catch (OrchestratorException e) {
            log.error("Orchestration failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Orchestration failed after {}ms", System.currentTimeMillis() - start, e);
            throw new OrchestratorException(OrchestratorException.ErrorCode.ORCHESTRATION_FAILED,
                    "Failed to process request", e);
        }
    }

    /**
     * Plans, executes and synthesizes an already resolved intent.
     */
    public OrchestrationResult execute(Intent intent, String message, Map<String, ?> context) {
        return run(intent, message, context, System.currentTimeMillis());
    }

    private OrchestrationResult run(Intent intent, String message, Map<String, ?> context, long start) {
        log.info("Step 2: Creating plan for agents {} ({})", intent.getAgents(), intent.getExecutionMode().getCode());
        ExecutionPlan plan = executionPlanner.createPlan(intent);

        log.info("Step 3: Executing {} tasks...", plan.getTasks().size());
        List<AgentOutput> outputs = executionEngine.execute(plan, context);

        log.info("Step 4: Synthesizing results...");
        String synthesis = synthesizer.synthesize(outputs, message,
                ContextKeys.nextQuestion(context).orElse(null),
                ContextKeys.language(context).orElse(null));

        long elapsed = System.currentTimeMillis() - start;
        log.info("Orchestration complete in {}ms ({} of {} agents succeeded)",
                elapsed, outputs.stream().filter(AgentOutput::isSuccess).count(), outputs.size());

        return OrchestrationResult.builder()
                .synthesis(synthesis)
                .agentOutputs(outputs)
                .intent(intent)
                .plan(plan)
                .executionTimeMs(elapsed)
                .build();
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= 100 ? message : message.substring(0, 100) + "...";
    }
}
