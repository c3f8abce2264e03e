package com.bizplanner.orchestrator.model.rules;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated trigger rule keyed by the answered field.
 * Fires only when every condition holds.
 */
@Value
@Builder
public class TriggerRule {
    String triggerField;

    @Builder.Default
    List<TriggerCondition> conditions = List.of();

    @Builder.Default
    List<AutoPopulateDirective> autoPopulate = List.of();

    @Builder.Default
    List<AgentTrigger> triggerAgents = List.of();

    @Builder.Default
    List<SkillTrigger> triggerSkills = List.of();
}
