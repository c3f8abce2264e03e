package com.bizplanner.orchestrator.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: response-synthesis
 * version: 1.0
 * temperature: 0.7
 * maxTokens: 300
 * systemPrompt: |
 *   You are a friendly business consultant...
 * userPrompt: |
 *   The user answered {{{questionId}}}...
 * </pre>
 *
 * Values are Mustache templates; use triple braces for raw text.
 *
 * @see com.bizplanner.orchestrator.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)  // Allow extra fields like "examples" for documentation
public class PromptTemplate {
    private String name;
    private String version;
    private double temperature;
    private int maxTokens = 1000;
    private String systemPrompt = "";
    private String userPrompt = "";
}
