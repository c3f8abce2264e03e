package com.bizplanner.orchestrator.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Classpath locations of the YAML definitions loaded at start-up.
 */
@Data
public class DefinitionProperties {

    @NotBlank
    private String questionnaire = "classpath:flow/questionnaire.yaml";

    @NotBlank
    private String triggerRules = "classpath:rules/trigger-rules.yaml";

    @NotBlank
    private String lookupTables = "classpath:rules/lookup-tables.yaml";

    @NotBlank
    private String agents = "classpath:agents/*.yaml";

    @NotBlank
    private String skills = "classpath:skills/*.yaml";

    @NotBlank
    private String prompts = "classpath:prompts/*.yaml";
}
