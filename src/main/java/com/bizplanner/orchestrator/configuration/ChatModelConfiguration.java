package com.bizplanner.orchestrator.configuration;

import com.bizplanner.orchestrator.client.impl.ChatModelFactory;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model configuration.
 *
 * <p>All stages (intent inference, agents, skills, synthesis, translation)
 * talk to one local Ollama model. Temperature and output limit differ per
 * stage, so the bean is a factory and the completion service caches one model
 * per combination.
 *
 * @since 2.0.0
 */
@Slf4j
@Configuration
public class ChatModelConfiguration {

    @Bean
    public ChatModelFactory chatModelFactory(AppProperties appProperties) {
        OllamaProperties ollama = appProperties.getOllama();

        log.info("🔧 Initializing chat model factory (Ollama - Local)");
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getChatModel());
        log.info("   - Timeout: {}s, retries: {}", ollama.getTimeoutSeconds(), ollama.getMaxRetries());

        return (temperature, maxTokens) -> {
            log.debug("Creating Ollama model {} (temperature={}, numPredict={})",
                    ollama.getChatModel(), temperature, maxTokens);
            return OllamaChatModel.builder()
                    .baseUrl(ollama.getBaseUrl())
                    .modelName(ollama.getChatModel())
                    .temperature(temperature)
                    .numPredict(maxTokens)
                    .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                    .maxRetries(ollama.getMaxRetries())
                    .logRequests(ollama.isLogRequests())
                    .logResponses(ollama.isLogResponses())
                    .build();
        };
    }
}
