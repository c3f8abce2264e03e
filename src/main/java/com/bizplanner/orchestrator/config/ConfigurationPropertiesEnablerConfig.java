package com.bizplanner.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes that are not
 * themselves Spring components.
 *
 * <ul>
 *   <li>{@link OrchestratorConfig} - pipeline completion parameters, deadlines, worker pool
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    OrchestratorConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
