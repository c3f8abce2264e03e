package com.bizplanner.orchestrator.model.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerRuleDefinition {
    private String triggerField;
    private List<ConditionDefinition> conditions = new ArrayList<>();
    private List<AutoPopulateDirective> autoPopulate = new ArrayList<>();
    private List<AgentTrigger> triggerAgents = new ArrayList<>();
    private List<SkillTrigger> triggerSkills = new ArrayList<>();
}
