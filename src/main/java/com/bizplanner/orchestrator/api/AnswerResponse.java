package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.AnswerTurnResult;
import com.bizplanner.orchestrator.model.orchestration.NextQuestion;
import com.bizplanner.orchestrator.model.orchestration.OrchestrationResult;
import com.bizplanner.orchestrator.model.orchestration.QuestionConfigSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response from the answer endpoint.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

    private boolean success;
    private String error;

    private String reply;
    private int nextQuestionIndex;
    private NextQuestion nextQuestion;
    private int remainingCount;
    private ProgressSnapshot progress;
    private QuestionConfigSummary questionConfig;

    @Builder.Default
    private Map<String, Object> extractedData = new LinkedHashMap<>();

    @Builder.Default
    private List<String> activatedBranchQuestionIds = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> autoPopulated = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> skillResults = new LinkedHashMap<>();

    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();

    @Builder.Default
    private List<String> thinkingLog = new ArrayList<>();

    @Builder.Default
    private List<String> agentsUsed = new ArrayList<>();

    @Builder.Default
    private List<String> skillsUsed = new ArrayList<>();

    public static AnswerResponse success(AnswerTurnResult result, NextQuestion nextQuestion) {
        OrchestrationResult orchestration = result.getOrchestration();
        List<AgentOutput> outputs = orchestration == null ? List.of() : orchestration.getAgentOutputs();

        return AnswerResponse.builder()
            .success(true)
            .reply(orchestration == null ? null : orchestration.getSynthesis())
            .nextQuestionIndex(result.getOutcome().getNextQuestionIndex())
            .nextQuestion(nextQuestion)
            .remainingCount(result.getOutcome().getRemainingCount())
            .progress(result.getProgress())
            .questionConfig(orchestration == null ? null : orchestration.getQuestionConfig())
            .extractedData(new LinkedHashMap<>(result.getOutcome().getExtractedData()))
            .activatedBranchQuestionIds(new ArrayList<>(result.getOutcome().getActivatedBranchQuestionIds()))
            .autoPopulated(new LinkedHashMap<>(result.getAutoPopulated()))
            .skillResults(new LinkedHashMap<>(result.getSkillResults()))
            .validationErrors(new ArrayList<>(result.getValidationErrors()))
            .thinkingLog(new ArrayList<>(result.getThinkingLog()))
            .agentsUsed(outputs.stream().map(AgentOutput::getAgentName).collect(Collectors.toList()))
            .skillsUsed(outputs.stream().flatMap(o -> o.getSkillsUsed().stream()).distinct().collect(Collectors.toList()))
            .build();
    }

    public static AnswerResponse error(String error) {
        return AnswerResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
