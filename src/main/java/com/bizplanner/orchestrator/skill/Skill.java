package com.bizplanner.orchestrator.skill;

import com.bizplanner.orchestrator.client.ToolSchema;

import java.util.Map;

/**
 * A capability agents can invoke as a tool.
 *
 * <p>Each skill has a clear contract: an id the model calls it by, a
 * description telling the model when to use it, and a JSON schema for its
 * arguments.
 *
 * <p>Register an implementation as a Spring bean to make it available; beans
 * take precedence over YAML prompt skills with the same id.
 *
 * @since 2.0.0
 */
public interface Skill {

    /**
     * Unique id (e.g., "market_sizing_calculator"). Used by the model to invoke the skill.
     */
    String getId();

    String getName();

    /**
     * Human-readable description for the model.
     */
    String getDescription();

    /**
     * JSON schema of the arguments object.
     */
    Map<String, Object> getParameterSchema();

    /**
     * Execute this skill with the given parameters.
     *
     * @param parameters arguments from the model or a rule's parameter builder
     * @return execution result; failures may be returned or thrown
     */
    SkillResult execute(Map<String, Object> parameters);

    default ToolSchema toToolSchema() {
        return ToolSchema.builder()
                .name(getId())
                .description(getDescription())
                .parameters(getParameterSchema())
                .build();
    }
}
