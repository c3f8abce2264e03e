package com.bizplanner.orchestrator.agent;

import com.bizplanner.orchestrator.agent.impl.YamlAgentRegistry;
import com.bizplanner.orchestrator.configuration.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentConfiguration {

    @Bean
    public AgentRegistry agentRegistry(AppProperties appProperties) {
        return YamlAgentRegistry.load(appProperties.getDefinitions().getAgents());
    }
}
