package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Ordered group of questions with the agents and skills used when a question
 * configures none of its own.
 *
 * @since 2.0.0
 */
@Value
@Builder
@Jacksonized
public class Phase {

    String id;
    int number;
    String name;
    String description;

    @Builder.Default
    List<Question> questions = List.of();

    @Builder.Default
    List<String> defaultAgents = List.of();

    @Builder.Default
    List<String> defaultSkills = List.of();
}
