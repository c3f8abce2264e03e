package com.bizplanner.orchestrator.model.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code rules/trigger-rules.yaml}. Rules sharing a trigger field
 * apply in file order.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerRulesDefinition {
    private List<TriggerRuleDefinition> rules = new ArrayList<>();
}
