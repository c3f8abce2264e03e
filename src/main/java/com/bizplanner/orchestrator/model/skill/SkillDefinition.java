package com.bizplanner.orchestrator.model.skill;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prompt-backed skill loaded from {@code classpath:skills/*.yaml}.
 *
 * <p>{@code parameters} is the JSON schema of the arguments object, written
 * as YAML. When absent the skill takes a free-form {@code query} plus an
 * optional {@code context} object.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SkillDefinition {
    private String id;
    private String name;
    private String description;
    private String systemPrompt;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private double temperature = 0.1;
    private int maxTokens = 2000;
}
