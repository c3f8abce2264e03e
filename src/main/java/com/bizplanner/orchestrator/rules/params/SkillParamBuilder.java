package com.bizplanner.orchestrator.rules.params;

import java.util.Map;

/**
 * Turns an answer and the answers so far into the parameter object for a
 * queued skill. Trigger rules refer to a builder by {@link #getName()}.
 *
 * @since 2.0.0
 */
public interface SkillParamBuilder {

    String getName();

    Map<String, Object> build(Object answer, Map<String, ?> answers);
}
