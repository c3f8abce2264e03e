package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.configuration.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlowConfiguration {

    @Bean
    public FlowGraph flowGraph(AppProperties appProperties) {
        return FlowGraphLoader.load(appProperties.getDefinitions().getQuestionnaire());
    }

    @Bean
    public NavigationResolver navigationResolver(FlowGraph flowGraph) {
        return new NavigationResolver(flowGraph);
    }
}
