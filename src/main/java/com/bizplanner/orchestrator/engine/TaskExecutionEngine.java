package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.agent.AgentRegistry;
import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.client.LanguageCatalog;
import com.bizplanner.orchestrator.client.ToolCallRequest;
import com.bizplanner.orchestrator.client.ToolSchema;
import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.exception.AgentExecutionException;
import com.bizplanner.orchestrator.model.agent.AgentDefinition;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.ExecutionMode;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Task;
import com.bizplanner.orchestrator.model.orchestration.ToolCallRecord;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import com.bizplanner.orchestrator.skill.SkillRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs the tasks of a plan against their agents.
 *
 * <p>Parallel plans fan out on the agent pool and results keep plan order.
 * Sequential plans run task by task and add each output to the context under
 * {@code <agent_id>_output} before the next task starts.
 *
 * <p>Each task makes one completion call with the agent's skills offered as
 * tools. When the model asks for tools, every requested skill in the agent's
 * allow-list is run, results go back keyed by call id, and one final
 * completion round produces the output. Any failure turns into a failed
 * {@link AgentOutput}; a task never aborts the plan.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
public class TaskExecutionEngine {

    static final String LANGUAGE_PROMPT = "language-enforcement";
    static final String SKILL_NOT_AVAILABLE = "Skill not available";

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final AgentRegistry agentRegistry;
    private final SkillRegistry skillRegistry;
    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;
    private final CallDeadlines deadlines;
    private final Executor agentTaskExecutor;
    private final OrchestratorConfig config;
    private final ObjectMapper objectMapper;

    public TaskExecutionEngine(AgentRegistry agentRegistry,
                               SkillRegistry skillRegistry,
                               CompletionService completionService,
                               PromptLibraryService promptLibrary,
                               CallDeadlines deadlines,
                               @Qualifier("agentTaskExecutor") Executor agentTaskExecutor,
                               OrchestratorConfig config,
                               ObjectMapper objectMapper) {
        this.agentRegistry = agentRegistry;
        this.skillRegistry = skillRegistry;
        this.completionService = completionService;
        this.promptLibrary = promptLibrary;
        this.deadlines = deadlines;
        this.agentTaskExecutor = agentTaskExecutor;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    public List<AgentOutput> execute(ExecutionPlan plan, Map<String, ?> context) {
        Map<String, Object> baseContext = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
        if (plan.getExecutionMode() == ExecutionMode.SEQUENTIAL) {
            return executeSequential(plan.getTasks(), baseContext);
        }
        return executeParallel(plan.getTasks(), baseContext);
    }

    private List<AgentOutput> executeParallel(List<Task> tasks, Map<String, Object> context) {
        log.info("Executing {} tasks in parallel", tasks.size());

        List<CompletableFuture<AgentOutput>> futures = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Map<String, Object> taskContext = new LinkedHashMap<>(context);
            CompletableFuture<AgentOutput> future;
            try {
                future = CompletableFuture.supplyAsync(() -> executeTask(task, taskContext), agentTaskExecutor);
            } catch (RuntimeException e) {
                log.error("Could not schedule task for agent {}", task.getAgentId(), e);
                future = CompletableFuture.completedFuture(AgentOutput.failed(task, e.getMessage(), 0));
            }
            futures.add(future.exceptionally(e -> AgentOutput.failed(task, e.getMessage(), 0)));
        }

        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private List<AgentOutput> executeSequential(List<Task> tasks, Map<String, Object> context) {
        log.info("Executing {} tasks sequentially", tasks.size());

        List<AgentOutput> outputs = new ArrayList<>(tasks.size());
        Map<String, Object> accumulated = new LinkedHashMap<>(context);
        for (Task task : tasks) {
            AgentOutput output = executeTask(task, new LinkedHashMap<>(accumulated));
            outputs.add(output);
            accumulated.put(task.getAgentId() + ContextKeys.OUTPUT_SUFFIX, output.getOutput());
        }
        return outputs;
    }

    /**
     * Runs one task. Never throws; failures come back as {@code success=false}.
     */
    public AgentOutput executeTask(Task task, Map<String, ?> context) {
        long start = System.currentTimeMillis();
        try {
            log.info("[{}] Starting execution", task.getAgentId());

            AgentDefinition agent = agentRegistry.getAgent(task.getAgentId())
                    .orElseThrow(() -> new AgentExecutionException("Agent not found: " + task.getAgentId(),
                            task.getAgentId()));

            List<ToolSchema> tools = skillRegistry.getToolDefinitions(agent.getSkills());
            CompletionRequest request = CompletionRequest.builder()
                    .systemPrompt(agent.getSystemPrompt())
                    .message(ConversationTurn.user(buildUserContent(task, context)))
                    .tools(tools)
                    .temperature(Optional.ofNullable(agent.getTemperature())
                            .orElse(config.getAgent().getDefaultTemperature()))
                    .maxTokens(Optional.ofNullable(agent.getMaxTokens())
                            .orElse(config.getAgent().getMaxTokens()))
                    .caller(task.getAgentId())
                    .build();

            CompletionResponse response = complete(task.getAgentId(), request);
            List<ToolCallRecord> toolCalls = List.of();

            if (response.hasToolCalls()) {
                log.info("[{}] Processing {} tool calls", task.getAgentId(), response.getToolCalls().size());
                toolCalls = handleToolCalls(response.getToolCalls(), agent.getSkills());

                CompletionRequest.CompletionRequestBuilder followUp = request.toBuilder()
                        .clearTools()
                        .message(ConversationTurn.assistant(response.getText(), response.getToolCalls()));
                for (ToolCallRecord record : toolCalls) {
                    followUp.message(ConversationTurn.toolResult(record.callId(), record.skillId(), record.resultPayload()));
                }
                response = complete(task.getAgentId(), followUp.build());
            }

            List<ToolCallRecord> calls = toolCalls;
            AgentOutput output = AgentOutput.builder()
                    .taskId(task.getId())
                    .agentId(task.getAgentId())
                    .agentName(task.getAgentName())
                    .output(response.getText() == null ? "" : response.getText())
                    .skillsUsed(agent.getSkills().stream()
                            .filter(skill -> calls.stream().anyMatch(call -> call.skillId().equals(skill)))
                            .collect(Collectors.toList()))
                    .toolCalls(calls)
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .success(true)
                    .build();

            log.info("[{}] Execution complete in {}ms, {} skills used",
                    task.getAgentId(), output.getExecutionTimeMs(), output.getSkillsUsed().size());
            return output;
        } catch (RuntimeException e) {
            log.error("Agent execution failed: {}", task.getAgentId(), e);
            return AgentOutput.failed(task, e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    /**
     * Runs every requested tool in order. Skills outside the allow-list and
     * failing skills produce an error payload for the model instead of an exception.
     */
    List<ToolCallRecord> handleToolCalls(List<ToolCallRequest> toolCalls, List<String> availableSkills) {
        List<ToolCallRecord> records = new ArrayList<>(toolCalls.size());
        for (ToolCallRequest call : toolCalls) {
            String skillId = call.name();
            if (!availableSkills.contains(skillId)) {
                log.warn("Skill not available for agent: {}", skillId);
                records.add(new ToolCallRecord(call.id(), skillId, call.argumentsJson(),
                        errorPayload(SKILL_NOT_AVAILABLE), false));
                continue;
            }

            try {
                Map<String, Object> params = parseArguments(call.argumentsJson());
                Object result = deadlines.call("skill " + skillId,
                        Duration.ofSeconds(config.getDeadlines().getSkillSeconds()),
                        () -> skillRegistry.execute(skillId, params));
                records.add(new ToolCallRecord(call.id(), skillId, call.argumentsJson(),
                        objectMapper.writeValueAsString(result), true));
            } catch (JsonProcessingException | RuntimeException e) {
                log.error("Tool call failed: {}", skillId, e);
                records.add(new ToolCallRecord(call.id(), skillId, call.argumentsJson(),
                        errorPayload(e.getMessage() == null ? "Tool execution failed" : e.getMessage()), false));
            }
        }
        return records;
    }

    String buildUserContent(Task task, Map<String, ?> context) {
        String content = task.getDescription() + "\n\nContext: " + toJson(context);

        Optional<String> language = ContextKeys.language(context);
        if (language.isPresent() && LanguageCatalog.isNonEnglish(language.get())) {
            String languageName = LanguageCatalog.nameOf(language.get()).orElse(language.get());
            Map<String, Object> variables = Map.of(
                    "languageName", languageName,
                    "languageNameUpper", languageName.toUpperCase(Locale.ROOT),
                    "languageCode", language.get(),
                    "content", content);
            content = promptLibrary.renderUser(LANGUAGE_PROMPT, variables);
        }
        return content;
    }

    private CompletionResponse complete(String agentId, CompletionRequest request) {
        return deadlines.call("agent " + agentId,
                Duration.ofSeconds(config.getDeadlines().getCompletionSeconds()),
                () -> completionService.complete(request));
    }

    private Map<String, Object> parseArguments(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        Map<String, Object> params = objectMapper.readValue(json, ARGUMENTS);
        return params == null ? Map.of() : params;
    }

    private String errorPayload(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", message));
        } catch (JsonProcessingException e) {
            return "{\"error\":\"Tool execution failed\"}";
        }
    }

    private String toJson(Map<String, ?> context) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context == null ? Map.of() : context);
        } catch (JsonProcessingException e) {
            log.warn("Context is not serializable, sending its string form: {}", e.getOriginalMessage());
            return String.valueOf(context);
        }
    }
}
