package com.bizplanner.orchestrator.model.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * How the flow graph configured the question behind a questionnaire turn.
 */
@Value
@Builder
public class QuestionConfigSummary {
    boolean skipped;
    String skipReason;

    @Builder.Default
    List<String> configuredAgents = List.of();

    @Builder.Default
    List<String> configuredSkills = List.of();

    @Builder.Default
    List<String> contextFields = List.of();

    boolean branchPoint;

    public static QuestionConfigSummary skipped(String reason) {
        return QuestionConfigSummary.builder().skipped(true).skipReason(reason).build();
    }
}
