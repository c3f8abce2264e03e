package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.exception.OrchestratorException;
import com.bizplanner.orchestrator.model.orchestration.ExecutionMode;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.rules.AgentInvocation;
import com.bizplanner.orchestrator.model.rules.RuleProcessResult;
import com.bizplanner.orchestrator.model.rules.SkillInvocation;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves which agents run for a request.
 *
 * <p>Fast paths, checked in order, skip model inference:
 * <ol>
 *   <li>{@code requestType = suggestion}: {@code business_planner_lead}, sequential</li>
 *   <li>phase 1: {@code context_collector}, parallel</li>
 *   <li>next question already known: {@code business_planner_lead}, parallel</li>
 * </ol>
 * Otherwise the model answers with an intent JSON object, which then goes
 * through the {@link AgentSelectionPolicy}.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentResolver {

    static final String PROMPT = "intent-analysis";

    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;
    private final AgentSelectionPolicy selectionPolicy;
    private final CallDeadlines deadlines;
    private final OrchestratorConfig config;
    private final ObjectMapper objectMapper;

    public Intent resolveIntent(String message, Map<String, ?> context) {
        if (ContextKeys.isSuggestionRequest(context)) {
            log.info("Processing SUGGESTION request");
            return fixedIntent("Generate 3-4 short, specific brainstorming ideas for the user question",
                    "business_planner_lead", ExecutionMode.SEQUENTIAL, "Explicit suggestion request");
        }
        if (context != null && ContextKeys.isFirstPhase(context.get(ContextKeys.CURRENT_PHASE))) {
            log.info("Using FAST PATH for Phase 1");
            return fixedIntent("Collect user information",
                    "context_collector", ExecutionMode.PARALLEL, "Phase 1 fast path");
        }
        if (ContextKeys.nextQuestion(context).isPresent()) {
            log.info("Using ACCELERATED Q&A PATH");
            return fixedIntent("Process answer and transition to next question",
                    "business_planner_lead", ExecutionMode.PARALLEL, "Standard Q&A flow");
        }
        return selectionPolicy.apply(inferIntent(message, context), context);
    }

    /**
     * Asks the model for an intent. The answer must name a goal, an agents
     * array and an execution type.
     *
     * @throws OrchestratorException with {@code INTENT_PARSE_FAILED} on any failure
     */
    Intent inferIntent(String message, Map<String, ?> context) {
        try {
            Map<String, Object> variables = new LinkedHashMap<>();
            variables.put("message", message == null ? "" : message);
            if (context != null && !context.isEmpty()) {
                variables.put("context", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context));
            }

            CompletionRequest request = CompletionRequest.builder()
                    .systemPrompt(promptLibrary.renderSystem(PROMPT, variables))
                    .message(ConversationTurn.user(promptLibrary.renderUser(PROMPT, variables)))
                    .temperature(config.getIntent().getTemperature())
                    .maxTokens(config.getIntent().getMaxTokens())
                    .caller("intent")
                    .build();

            CompletionResponse response = deadlines.call("intent analysis",
                    Duration.ofSeconds(config.getDeadlines().getCompletionSeconds()),
                    () -> completionService.complete(request));

            Intent intent = parseIntent(response.getText());
            log.info("Intent parsed: agents={}, mode={}", intent.getAgents(), intent.getExecutionMode().getCode());
            return intent;
        } catch (OrchestratorException e) {
            throw e;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Intent parsing failed", e);
            throw new OrchestratorException(OrchestratorException.ErrorCode.INTENT_PARSE_FAILED,
                    "Failed to parse intent: " + e.getMessage(), e);
        }
    }

    Intent parseIntent(String content) throws JsonProcessingException {
        if (content == null || content.isBlank()) {
            throw new OrchestratorException(OrchestratorException.ErrorCode.INTENT_PARSE_FAILED,
                    "No response from completion service");
        }

        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new OrchestratorException(OrchestratorException.ErrorCode.INTENT_PARSE_FAILED,
                    "Intent response is not a JSON object");
        }

        JsonNode root = objectMapper.readTree(content.substring(start, end + 1));
        JsonNode goal = root.get("goal");
        JsonNode agents = root.get("agents");
        JsonNode mode = root.has("execution_type") ? root.get("execution_type") : root.get("executionMode");

        if (goal == null || goal.asText().isBlank() || agents == null || !agents.isArray() || mode == null) {
            throw new OrchestratorException(OrchestratorException.ErrorCode.INTENT_PARSE_FAILED,
                    "Invalid intent structure");
        }

        ExecutionMode executionMode = ExecutionMode.parse(mode.asText())
                .orElseThrow(() -> new OrchestratorException(OrchestratorException.ErrorCode.INTENT_PARSE_FAILED,
                        "Unknown execution type: " + mode.asText()));

        return Intent.builder()
                .goal(goal.asText())
                .agents(distinctTexts(agents))
                .skills(distinctTexts(root.get("skills")))
                .executionMode(executionMode)
                .reasoning(root.has("reasoning") ? root.get("reasoning").asText() : null)
                .contextRequirements(distinctTexts(root.has("context_requirements")
                        ? root.get("context_requirements") : root.get("contextRequirements")))
                .build();
    }

    /**
     * Parallel intent over the agents and skills queued by trigger rules, each
     * agent carrying its interpolated prompt.
     */
    public Intent intentFromRules(RuleProcessResult ruleResult) {
        Map<String, String> prompts = new LinkedHashMap<>();
        for (AgentInvocation invocation : ruleResult.getAgentsToTrigger()) {
            prompts.putIfAbsent(invocation.agentId(), invocation.prompt());
        }
        Set<String> skills = new LinkedHashSet<>();
        for (SkillInvocation invocation : ruleResult.getSkillsToExecute()) {
            skills.add(invocation.skillId());
        }

        return Intent.builder()
                .goal("Run agents triggered by the latest answer")
                .agents(List.copyOf(prompts.keySet()))
                .skills(List.copyOf(skills))
                .executionMode(ExecutionMode.PARALLEL)
                .reasoning("Selected by trigger rules")
                .agentPrompts(Map.copyOf(prompts))
                .build();
    }

    private static Intent fixedIntent(String goal, String agent, ExecutionMode mode, String reasoning) {
        return Intent.builder()
                .goal(goal)
                .agents(List.of(agent))
                .executionMode(mode)
                .reasoning(reasoning)
                .build();
    }

    private static List<String> distinctTexts(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        Set<String> values = new LinkedHashSet<>();
        node.forEach(item -> {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        });
        return List.copyOf(values);
    }
}
