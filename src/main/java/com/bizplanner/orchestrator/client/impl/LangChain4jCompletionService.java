package com.bizplanner.orchestrator.client.impl;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.client.ToolCallRequest;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link CompletionService} over a LangChain4j {@link ChatLanguageModel}.
 *
 * <p>One model instance is kept per (temperature, max tokens) pair since those
 * are fixed at model construction.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LangChain4jCompletionService implements CompletionService {

    private final ChatModelFactory modelFactory;
    private final Map<String, ChatLanguageModel> models = new ConcurrentHashMap<>();

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        ChatLanguageModel model = models.computeIfAbsent(
                request.getTemperature() + "/" + request.getMaxTokens(),
                key -> modelFactory.create(request.getTemperature(), request.getMaxTokens()));

        List<ChatMessage> messages = toMessages(request);
        List<ToolSpecification> tools = request.getTools().stream()
                .map(ToolSchemaConverter::toSpecification)
                .collect(Collectors.toList());

        long start = System.currentTimeMillis();
        Response<AiMessage> response = tools.isEmpty()
                ? model.generate(messages)
                : model.generate(messages, tools);
        AiMessage message = response.content();

        log.debug("[{}] completion in {}ms, {} tool calls, tokens={}",
                request.getCaller(),
                System.currentTimeMillis() - start,
                message.hasToolExecutionRequests() ? message.toolExecutionRequests().size() : 0,
                response.tokenUsage());

        List<ToolCallRequest> toolCalls = message.hasToolExecutionRequests()
                ? message.toolExecutionRequests().stream()
                    .map(r -> new ToolCallRequest(r.id(), r.name(), r.arguments()))
                    .collect(Collectors.toList())
                : List.of();

        return CompletionResponse.builder()
                .text(message.text())
                .toolCalls(toolCalls)
                .build();
    }

    static List<ChatMessage> toMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (ConversationTurn turn : request.getMessages()) {
            messages.add(toMessage(turn));
        }
        return messages;
    }

    private static ChatMessage toMessage(ConversationTurn turn) {
        switch (turn.getRole()) {
            case ASSISTANT:
                if (turn.getToolCalls().isEmpty()) {
                    return AiMessage.from(turn.getText() == null ? "" : turn.getText());
                }
                List<ToolExecutionRequest> requests = turn.getToolCalls().stream()
                        .map(call -> ToolExecutionRequest.builder()
                                .id(call.id())
                                .name(call.name())
                                .arguments(call.argumentsJson())
                                .build())
                        .collect(Collectors.toList());
                return turn.getText() == null || turn.getText().isBlank()
                        ? AiMessage.from(requests)
                        : AiMessage.from(turn.getText(), requests);
            case TOOL:
                return ToolExecutionResultMessage.from(turn.getToolCallId(), turn.getToolName(), turn.getText());
            case USER:
            default:
                return UserMessage.from(turn.getText());
        }
    }
}
