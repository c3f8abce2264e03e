package com.bizplanner.orchestrator.model.rules;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Skill to queue when a rule fires; {@code paramsBuilder} names a
 * {@link com.bizplanner.orchestrator.rules.params.SkillParamBuilder}.
 */
@Value
@Builder
@Jacksonized
public class SkillTrigger {
    String skillId;
    String paramsBuilder;
}
