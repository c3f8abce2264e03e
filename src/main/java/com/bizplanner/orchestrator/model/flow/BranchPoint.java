package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Question whose answer activates a distinct subset of later questions.
 *
 * <p>Only used to explain which questions an answer opened up. Whether a
 * question is actually asked is decided by the skip rules.
 */
@Value
@Builder
@Jacksonized
public class BranchPoint {

    String questionId;
    String description;

    @Builder.Default
    Map<String, List<String>> branches = new LinkedHashMap<>();
}
