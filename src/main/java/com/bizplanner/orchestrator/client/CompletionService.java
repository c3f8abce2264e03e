package com.bizplanner.orchestrator.client;

/**
 * Language-model completion with a tool-calling protocol.
 *
 * <p>A response may carry final text, tool-call requests, or both. Tool results
 * are sent back as {@link ConversationTurn#toolResult} turns keyed by the
 * call id of the request they answer.
 *
 * <p>Implementations block until the model answers; callers bound the wait.
 *
 * @since 2.0.0
 */
public interface CompletionService {

    CompletionResponse complete(CompletionRequest request);
}
