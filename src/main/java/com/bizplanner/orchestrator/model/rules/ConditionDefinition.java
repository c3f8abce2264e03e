package com.bizplanner.orchestrator.model.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Condition as written in YAML; turned into a {@link TriggerCondition} at load time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionDefinition {
    private String field;
    private String operator;
    private Object value;
}
