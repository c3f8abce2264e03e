package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of recording one answer. The caller persists the answer and the new index.
 *
 * @since 2.0.0
 */
@Value
@Builder
public class AnswerOutcome {

    @Builder.Default
    Map<String, Object> extractedData = Map.of();

    int nextQuestionIndex;

    int remainingCount;

    /**
     * Questions the answer activated when the question is a branch point;
     * empty otherwise.
     */
    @Builder.Default
    List<String> activatedBranchQuestionIds = List.of();
}
