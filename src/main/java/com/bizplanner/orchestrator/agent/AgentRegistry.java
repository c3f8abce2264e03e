package com.bizplanner.orchestrator.agent;

import com.bizplanner.orchestrator.model.agent.AgentDefinition;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only lookup of agent personas by id.
 *
 * @since 2.0.0
 */
public interface AgentRegistry {

    Optional<AgentDefinition> getAgent(String agentId);

    int getAgentCount();

    Collection<AgentDefinition> getAllAgents();
}
