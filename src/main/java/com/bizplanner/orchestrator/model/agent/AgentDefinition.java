package com.bizplanner.orchestrator.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent persona loaded from {@code classpath:agents/*.yaml}.
 *
 * <pre>
 * id: market_analyst
 * name: Market Analyst
 * description: Sizes the market and reads demand signals
 * phase: market
 * temperature: 0.4
 * skills: [market_sizing_calculator, competitor_analysis]
 * systemPrompt: |
 *   You are a market analyst...
 * </pre>
 *
 * {@code temperature} and {@code maxTokens} are optional; the orchestrator
 * defaults apply when they are absent.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentDefinition {
    private String id;
    private String name;
    private String description;
    private String model;
    private String phase;
    private String systemPrompt;
    private List<String> skills = new ArrayList<>();
    private Double temperature;
    private Integer maxTokens;

    public boolean isValid() {
        return id != null && !id.isBlank()
                && name != null && !name.isBlank()
                && systemPrompt != null && !systemPrompt.isBlank();
    }
}
