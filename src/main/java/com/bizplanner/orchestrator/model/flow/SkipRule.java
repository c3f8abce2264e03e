package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Hides a question when ANY of its predicates holds for the current answers.
 */
@Value
@Builder
@Jacksonized
public class SkipRule {

    String questionId;
    String reason;

    @Builder.Default
    List<FieldPredicate> when = List.of();
}
