package com.bizplanner.orchestrator.skill.impl;

import com.bizplanner.orchestrator.client.ToolSchema;
import com.bizplanner.orchestrator.exception.SkillExecutionException;
import com.bizplanner.orchestrator.skill.Skill;
import com.bizplanner.orchestrator.skill.SkillRegistry;
import com.bizplanner.orchestrator.skill.SkillResult;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable skill registry. Skills are registered in the given order and a
 * later skill with the same id replaces an earlier one.
 *
 * @since 2.0.0
 */
@Slf4j
public class DefaultSkillRegistry implements SkillRegistry {

    private final ImmutableMap<String, Skill> skills;

    public DefaultSkillRegistry(Collection<? extends Skill> skills) {
        Map<String, Skill> byId = new LinkedHashMap<>();
        for (Skill skill : skills) {
            if (byId.put(skill.getId(), skill) != null) {
                log.info("Overridden skill: {}", skill.getId());
            }
            log.debug("Registered skill: {} ({})", skill.getId(), skill.getName());
        }
        this.skills = ImmutableMap.copyOf(byId);
        log.info("Successfully registered {} skills", this.skills.size());
    }

    @Override
    public Optional<Skill> getSkill(String skillId) {
        return skillId == null ? Optional.empty() : Optional.ofNullable(skills.get(skillId));
    }

    @Override
    public Collection<Skill> getAllSkills() {
        return skills.values();
    }

    @Override
    public List<ToolSchema> getToolDefinitions(Collection<String> skillIds) {
        return skillIds.stream()
                .map(id -> {
                    Skill skill = skills.get(id);
                    if (skill == null) {
                        log.warn("Skill not found: {}", id);
                    }
                    return skill;
                })
                .filter(Objects::nonNull)
                .map(Skill::toToolSchema)
                .collect(Collectors.toList());
    }

    @Override
    public Object execute(String skillId, Map<String, Object> parameters) {
        Skill skill = skills.get(skillId);
        if (skill == null) {
            throw new SkillExecutionException("Skill not found: " + skillId, skillId);
        }

        long start = System.currentTimeMillis();
        log.info("Executing skill: {}", skillId);

        SkillResult result;
        try {
            result = skill.execute(parameters == null ? Map.of() : parameters);
        } catch (SkillExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Skill {} failed after {}ms", skillId, System.currentTimeMillis() - start, e);
            throw new SkillExecutionException("Failed to execute skill " + skillId + ": " + e.getMessage(), skillId, e);
        }

        if (!result.isSuccess()) {
            log.warn("Skill {} reported failure: {}", skillId, result.getMessage());
            throw new SkillExecutionException(result.getMessage(), skillId);
        }
        log.info("Skill {} completed in {}ms", skillId, System.currentTimeMillis() - start);
        return result.getData();
    }
}
