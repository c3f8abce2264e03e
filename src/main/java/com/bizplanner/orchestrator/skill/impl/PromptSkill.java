package com.bizplanner.orchestrator.skill.impl;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.model.skill.SkillDefinition;
import com.bizplanner.orchestrator.skill.Skill;
import com.bizplanner.orchestrator.skill.SkillResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Skill whose behavior is a system prompt: the parameters are sent as JSON
 * and the model's text is the result.
 */
public class PromptSkill implements Skill {

    static final Map<String, Object> DEFAULT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "query", Map.of("type", "string",
                            "description", "The specific request or query for this skill"),
                    "context", Map.of("type", "object",
                            "description", "Any relevant business context")),
            "required", List.of("query"));

    private final SkillDefinition definition;
    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    public PromptSkill(SkillDefinition definition, CompletionService completionService, ObjectMapper objectMapper) {
        this.definition = definition;
        this.completionService = completionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return definition.getId();
    }

    @Override
    public String getName() {
        return definition.getName() != null ? definition.getName() : definition.getId().replace('_', ' ');
    }

    @Override
    public String getDescription() {
        return definition.getDescription();
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        if (definition.getParameters() == null || definition.getParameters().isEmpty()) {
            return DEFAULT_SCHEMA;
        }
        Map<String, Object> schema = new LinkedHashMap<>(definition.getParameters());
        schema.putIfAbsent("type", "object");
        return schema;
    }

    @Override
    public SkillResult execute(Map<String, Object> parameters) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            return SkillResult.failure("Parameters are not serializable: " + e.getOriginalMessage());
        }

        CompletionResponse response = completionService.complete(CompletionRequest.builder()
                .systemPrompt(definition.getSystemPrompt())
                .message(ConversationTurn.user("Parameters: " + json + "\n\nExecute the task based on your instructions."))
                .temperature(definition.getTemperature())
                .maxTokens(definition.getMaxTokens())
                .caller("skill:" + getId())
                .build());

        String text = response.getText();
        return SkillResult.success(text == null || text.isBlank() ? "No response generated." : text, "OK");
    }
}
