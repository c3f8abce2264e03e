package com.bizplanner.orchestrator.client.impl;

import dev.langchain4j.model.chat.ChatLanguageModel;

/**
 * Builds a chat model for a given sampling temperature and output limit.
 */
@FunctionalInterface
public interface ChatModelFactory {

    ChatLanguageModel create(double temperature, int maxTokens);
}
