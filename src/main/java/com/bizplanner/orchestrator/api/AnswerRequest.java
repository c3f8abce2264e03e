package com.bizplanner.orchestrator.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request for the answer endpoint. The caller owns the session: it sends the
 * answers so far and persists the returned index.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerRequest {

    /**
     * Id of the question being answered.
     */
    private String questionId;

    /**
     * Raw answer: text, number or list of selected option values.
     */
    private Object answer;

    /**
     * Answers given before this one, keyed by question id.
     */
    @Builder.Default
    private Map<String, Object> answers = new LinkedHashMap<>();

    /**
     * Index of the answered question in the configured question order.
     */
    private int currentIndex;

    /**
     * Reply language (e.g. "hi-IN"); falls back to the "language" answer.
     */
    private String language;
}
