package com.bizplanner.orchestrator.skill;

import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.configuration.AppProperties;
import com.bizplanner.orchestrator.model.skill.SkillDefinition;
import com.bizplanner.orchestrator.skill.impl.DefaultSkillRegistry;
import com.bizplanner.orchestrator.skill.impl.PromptSkill;
import com.bizplanner.orchestrator.util.YamlDefinitionReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the skill registry from YAML prompt skills, then Spring {@link Skill}
 * beans so code skills replace prompt skills of the same id.
 */
@Slf4j
@Configuration
public class SkillConfiguration {

    @Bean
    public SkillRegistry skillRegistry(AppProperties appProperties,
                                       CompletionService completionService,
                                       ObjectMapper objectMapper,
                                       ObjectProvider<Skill> skillBeans) {
        String pattern = appProperties.getDefinitions().getSkills();
        List<Skill> skills = new ArrayList<>();

        for (SkillDefinition definition : YamlDefinitionReader.readAll(pattern, SkillDefinition.class)) {
            if (definition.getId() == null || definition.getSystemPrompt() == null) {
                log.warn("Skipping invalid skill definition under {}: id={}", pattern, definition.getId());
                continue;
            }
            skills.add(new PromptSkill(definition, completionService, objectMapper));
        }
        skillBeans.orderedStream().forEach(skills::add);

        return new DefaultSkillRegistry(skills);
    }
}
