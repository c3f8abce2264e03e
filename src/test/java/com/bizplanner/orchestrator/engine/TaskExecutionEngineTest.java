package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.agent.impl.YamlAgentRegistry;
import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.client.ToolCallRequest;
import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.configuration.AppProperties;
import com.bizplanner.orchestrator.exception.SkillExecutionException;
import com.bizplanner.orchestrator.model.agent.AgentDefinition;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.ExecutionMode;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.orchestration.ToolCallRecord;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import com.bizplanner.orchestrator.skill.SkillRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Task Execution Engine Tests")
class TaskExecutionEngineTest {

    private ExecutorService pool;
    private CompletionService completionService;
    private SkillRegistry skillRegistry;
    private OrchestratorConfig config;
    private ExecutionPlanner planner;
    private TaskExecutionEngine engine;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        completionService = mock(CompletionService.class);
        skillRegistry = mock(SkillRegistry.class);
        when(skillRegistry.getToolDefinitions(anyCollection())).thenReturn(List.of());

        config = new OrchestratorConfig();
        config.getDeadlines().setCompletionSeconds(2);
        config.getDeadlines().setSkillSeconds(2);

        YamlAgentRegistry agents = new YamlAgentRegistry(List.of(
                agent("agent_a"),
                agent("agent_b"),
                agent("agent_c"),
                agent("analyst", "market_sizing_calculator")));

        PromptLibraryService prompts = new PromptLibraryService(new AppProperties());
        prompts.loadPrompts();

        planner = new ExecutionPlanner(agents, config);
        engine = new TaskExecutionEngine(agents, skillRegistry, completionService, prompts,
                new CallDeadlines(pool), pool, config, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("A failing agent does not affect the other parallel tasks")
    void parallelFailureIsIsolated() {
        // Given
        when(completionService.complete(any())).thenAnswer(invocation -> {
            CompletionRequest request = invocation.getArgument(0);
            if ("agent_b".equals(request.getCaller())) {
                throw new IllegalStateException("model unavailable");
            }
            return CompletionResponse.text("insight from " + request.getCaller());
        });
        ExecutionPlan plan = plan(ExecutionMode.PARALLEL, "agent_a", "agent_b", "agent_c");

        // When
        List<AgentOutput> outputs = engine.execute(plan, Map.of());

        // Then
        assertThat(outputs).hasSize(3);
        assertThat(outputs).extracting(AgentOutput::getAgentId).containsExactly("agent_a", "agent_b", "agent_c");
        assertThat(outputs.get(0).isSuccess()).isTrue();
        assertThat(outputs.get(1).isSuccess()).isFalse();
        assertThat(outputs.get(1).getError()).isNotBlank();
        assertThat(outputs.get(2).isSuccess()).isTrue();
        assertThat(outputs.get(2).getOutput()).isEqualTo("insight from agent_c");
    }

    @Test
    @DisplayName("Sequential tasks see the outputs of earlier tasks")
    void sequentialContextAccumulates() {
        // Given
        when(completionService.complete(any())).thenAnswer(invocation -> {
            CompletionRequest request = invocation.getArgument(0);
            return CompletionResponse.text(request.getCaller() + " done");
        });
        ExecutionPlan plan = plan(ExecutionMode.SEQUENTIAL, "agent_a", "agent_b");

        // When
        List<AgentOutput> outputs = engine.execute(plan, Map.of("currentPhase", 3));

        // Then
        assertThat(outputs).allMatch(AgentOutput::isSuccess);
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionService, times(2)).complete(captor.capture());
        String secondPrompt = captor.getAllValues().get(1).getMessages().get(0).getText();
        assertThat(secondPrompt).contains("agent_a_output").contains("agent_a done");
        assertThat(captor.getAllValues().get(0).getMessages().get(0).getText()).doesNotContain("agent_a_output");
    }

    @Test
    @DisplayName("Parallel outputs follow plan order even when later tasks finish first")
    void parallelOutputsKeepPlanOrder() {
        // Given
        Map<String, Long> delays = Map.of("agent_a", 600L, "agent_b", 300L, "agent_c", 0L);
        List<String> finished = new CopyOnWriteArrayList<>();
        when(completionService.complete(any())).thenAnswer(invocation -> {
            CompletionRequest request = invocation.getArgument(0);
            Thread.sleep(delays.get(request.getCaller()));
            finished.add(request.getCaller());
            return CompletionResponse.text("insight from " + request.getCaller());
        });
        ExecutionPlan plan = plan(ExecutionMode.PARALLEL, "agent_a", "agent_b", "agent_c");

        // When
        List<AgentOutput> outputs = engine.execute(plan, Map.of());

        // Then
        assertThat(finished).first().isEqualTo("agent_c");
        assertThat(outputs).extracting(AgentOutput::getAgentId).containsExactly("agent_a", "agent_b", "agent_c");
        assertThat(outputs).extracting(AgentOutput::getOutput)
                .containsExactly("insight from agent_a", "insight from agent_b", "insight from agent_c");
    }

    @Test
    @DisplayName("Unknown agents produce a failed output")
    void missingAgent() {
        ExecutionPlan plan = plan(ExecutionMode.PARALLEL, "ghost");

        List<AgentOutput> outputs = engine.execute(plan, Map.of());

        assertThat(outputs).hasSize(1);
        assertThat(outputs.get(0).isSuccess()).isFalse();
        assertThat(outputs.get(0).getError()).isEqualTo("Agent not found: ghost");
        verify(completionService, never()).complete(any());
    }

    @Test
    @DisplayName("Tool calls run allowed skills and answer the rest with an error payload")
    void toolCallAllowList() {
        // Given
        when(skillRegistry.execute(eq("market_sizing_calculator"), anyMap())).thenReturn(Map.of("tam", 1000));
        when(completionService.complete(any()))
                .thenReturn(CompletionResponse.builder()
                        .toolCalls(List.of(
                                new ToolCallRequest("call-1", "market_sizing_calculator", "{\"industry\":\"SaaS\"}"),
                                new ToolCallRequest("call-2", "compliance_checker", "{}")))
                        .build())
                .thenReturn(CompletionResponse.text("Market is large"));
        ExecutionPlan plan = plan(ExecutionMode.PARALLEL, "analyst");

        // When
        AgentOutput output = engine.execute(plan, Map.of()).get(0);

        // Then
        assertThat(output.isSuccess()).isTrue();
        assertThat(output.getOutput()).isEqualTo("Market is large");
        assertThat(output.getSkillsUsed()).containsExactly("market_sizing_calculator");
        assertThat(output.getToolCalls()).extracting(ToolCallRecord::success).containsExactly(true, false);
        assertThat(output.getToolCalls().get(1).resultPayload()).isEqualTo("{\"error\":\"Skill not available\"}");
        verify(skillRegistry, never()).execute(eq("compliance_checker"), anyMap());

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionService, times(2)).complete(captor.capture());
        CompletionRequest followUp = captor.getAllValues().get(1);
        assertThat(followUp.getTools()).isEmpty();
        assertThat(followUp.getMessages()).extracting(ConversationTurn::getRole).containsExactly(
                ConversationTurn.Role.USER, ConversationTurn.Role.ASSISTANT,
                ConversationTurn.Role.TOOL, ConversationTurn.Role.TOOL);
        assertThat(followUp.getMessages().get(2).getToolCallId()).isEqualTo("call-1");
        assertThat(followUp.getMessages().get(2).getText()).isEqualTo("{\"tam\":1000}");
    }

    @Test
    @DisplayName("A failing skill becomes an error payload for the model")
    void failingSkill() {
        when(skillRegistry.execute(eq("market_sizing_calculator"), anyMap()))
                .thenThrow(new SkillExecutionException("no data for industry", "market_sizing_calculator"));
        when(completionService.complete(any()))
                .thenReturn(CompletionResponse.builder()
                        .toolCalls(List.of(new ToolCallRequest("call-1", "market_sizing_calculator", "{}")))
                        .build())
                .thenReturn(CompletionResponse.text("Could not size the market"));

        AgentOutput output = engine.execute(plan(ExecutionMode.PARALLEL, "analyst"), Map.of()).get(0);

        assertThat(output.isSuccess()).isTrue();
        assertThat(output.getSkillsUsed()).containsExactly("market_sizing_calculator");
        assertThat(output.getToolCalls().get(0).resultPayload()).isEqualTo("{\"error\":\"no data for industry\"}");
    }

    @Test
    @DisplayName("A completion that overruns its deadline fails the task")
    void deadlineExceeded() {
        // Given
        config.getDeadlines().setCompletionSeconds(1);
        when(completionService.complete(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return CompletionResponse.text("too late");
        });

        // When
        List<AgentOutput> outputs = engine.execute(plan(ExecutionMode.PARALLEL, "agent_a"), Map.of());

        // Then
        assertThat(outputs.get(0).isSuccess()).isFalse();
        assertThat(outputs.get(0).getError()).contains("deadline");
    }

    @Test
    @DisplayName("Non-English conversations wrap the task in a language instruction")
    void languageEnforcement() {
        when(completionService.complete(any())).thenReturn(CompletionResponse.text("ठीक है"));

        engine.execute(plan(ExecutionMode.PARALLEL, "agent_a"), Map.of("language", "hi-IN"));

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionService).complete(captor.capture());
        String content = captor.getValue().getMessages().get(0).getText();
        assertThat(content).contains("Hindi (hi-IN)").contains("SIMPLE, EVERYDAY HINDI").contains("Execute agent_a agent");
    }

    private ExecutionPlan plan(ExecutionMode mode, String... agentIds) {
        return planner.createPlan(Intent.builder()
                .goal("test")
                .agents(List.of(agentIds))
                .executionMode(mode)
                .build());
    }

    private static AgentDefinition agent(String id, String... skills) {
        AgentDefinition definition = new AgentDefinition();
        definition.setId(id);
        definition.setName(id);
        definition.setSystemPrompt("You are " + id);
        definition.setSkills(List.of(skills));
        return definition;
    }
}
