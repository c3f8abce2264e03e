package com.bizplanner.orchestrator.model.rules;

import java.util.Map;

public record SkillInvocation(String skillId, Map<String, Object> params) {
}
