package com.bizplanner.orchestrator.agent.impl;

import com.bizplanner.orchestrator.agent.AgentRegistry;
import com.bizplanner.orchestrator.model.agent.AgentDefinition;
import com.bizplanner.orchestrator.util.YamlDefinitionReader;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent registry built once from YAML persona files.
 *
 * <p>Definitions without id, name or system prompt are skipped with a warning.
 * A later file with the same id replaces the earlier one.
 */
@Slf4j
public class YamlAgentRegistry implements AgentRegistry {

    private final ImmutableMap<String, AgentDefinition> agents;

    public YamlAgentRegistry(List<AgentDefinition> definitions) {
        Map<String, AgentDefinition> byId = new LinkedHashMap<>();
        for (AgentDefinition definition : definitions) {
            if (!definition.isValid()) {
                log.warn("Skipping invalid agent definition: id={}, name={}", definition.getId(), definition.getName());
                continue;
            }
            if (byId.put(definition.getId(), definition) != null) {
                log.warn("Agent {} defined more than once, keeping the last definition", definition.getId());
            }
            log.debug("Loaded agent: {} ({})", definition.getId(), definition.getName());
        }
        this.agents = ImmutableMap.copyOf(byId);
    }

    public static YamlAgentRegistry load(String pattern) {
        YamlAgentRegistry registry = new YamlAgentRegistry(YamlDefinitionReader.readAll(pattern, AgentDefinition.class));
        log.info("Successfully loaded {} agents from {}", registry.getAgentCount(), pattern);
        return registry;
    }

    @Override
    public Optional<AgentDefinition> getAgent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public int getAgentCount() {
        return agents.size();
    }

    @Override
    public Collection<AgentDefinition> getAllAgents() {
        return agents.values();
    }
}
