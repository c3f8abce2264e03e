package com.bizplanner.orchestrator.model.orchestration;

import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything one questionnaire answer produced: navigation, rule effects,
 * skill results and the orchestrated reply.
 */
@Value
@Builder
public class AnswerTurnResult {
    AnswerOutcome outcome;
    ProgressSnapshot progress;

    @Builder.Default
    Map<String, Object> autoPopulated = Map.of();

    @Builder.Default
    Map<String, Object> skillResults = Map.of();

    @Builder.Default
    List<String> validationErrors = List.of();

    @Builder.Default
    List<String> thinkingLog = List.of();

    OrchestrationResult orchestration;
}
