package com.bizplanner.orchestrator.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class CompletionRequest {

    String systemPrompt;

    @Singular
    List<ConversationTurn> messages;

    @Singular
    List<ToolSchema> tools;

    double temperature;

    int maxTokens;

    /**
     * Caller name for logs only.
     */
    String caller;
}
