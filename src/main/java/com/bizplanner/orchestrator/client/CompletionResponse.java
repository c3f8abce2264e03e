package com.bizplanner.orchestrator.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionResponse {

    String text;

    @Builder.Default
    List<ToolCallRequest> toolCalls = List.of();

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static CompletionResponse text(String text) {
        return CompletionResponse.builder().text(text).build();
    }
}
