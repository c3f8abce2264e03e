package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One questionnaire question, immutable after load.
 *
 * <p>Besides the prompt itself a question may carry orchestration hints: the
 * agents and skills to run when it is answered, the context fields the agents
 * should extract, and a short instruction appended to the agent prompt. Empty
 * agent/skill lists mean "use the phase defaults".
 *
 * @since 2.0.0
 */
@Value
@Builder
@Jacksonized
public class Question {

    String id;
    String prompt;
    QuestionType type;

    @Builder.Default
    List<QuestionOption> options = List.of();

    @Builder.Default
    boolean required = true;

    @Builder.Default
    List<String> agents = List.of();

    @Builder.Default
    List<String> skills = List.of();

    @Builder.Default
    List<String> contextFields = List.of();

    String agentPromptContext;
}
