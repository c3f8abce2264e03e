package com.bizplanner.orchestrator.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request for free-form orchestration.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorRequest {

    /**
     * The user's message.
     */
    private String message;

    /**
     * Business context: currentPhase, language, requestType, nextQuestion,
     * allAnswers and any other fields the agents should see.
     */
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
}
