package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QuestionOption {
    String value;
    String label;
    String description;
}
