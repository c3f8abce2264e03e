package com.bizplanner.orchestrator.skill;

import com.bizplanner.orchestrator.client.ToolSchema;
import com.bizplanner.orchestrator.exception.SkillExecutionException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Skills by id, and their tool definitions for the completion service.
 *
 * @since 2.0.0
 */
public interface SkillRegistry {

    Optional<Skill> getSkill(String skillId);

    Collection<Skill> getAllSkills();

    /**
     * Tool definitions for the given ids in the given order. Unknown ids are
     * skipped.
     */
    List<ToolSchema> getToolDefinitions(Collection<String> skillIds);

    /**
     * Runs a skill and returns its data.
     *
     * @throws SkillExecutionException when the skill is unknown, throws, or
     *                                 reports a failure
     */
    Object execute(String skillId, Map<String, Object> parameters);
}
