package com.bizplanner.orchestrator.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One turn of the message history sent to the model.
 */
@Value
@Builder
public class ConversationTurn {

    public enum Role { USER, ASSISTANT, TOOL }

    Role role;
    String text;

    @Builder.Default
    List<ToolCallRequest> toolCalls = List.of();

    String toolCallId;
    String toolName;

    public static ConversationTurn user(String text) {
        return ConversationTurn.builder().role(Role.USER).text(text).build();
    }

    /**
     * The model's own turn, replayed so tool results can refer to its calls.
     */
    public static ConversationTurn assistant(String text, List<ToolCallRequest> toolCalls) {
        return ConversationTurn.builder().role(Role.ASSISTANT).text(text).toolCalls(toolCalls).build();
    }

    public static ConversationTurn toolResult(String toolCallId, String toolName, String payload) {
        return ConversationTurn.builder()
                .role(Role.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .text(payload)
                .build();
    }
}
