package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.model.flow.Phase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionsResponse {

    private boolean success;
    private int totalQuestions;

    @Builder.Default
    private List<Phase> phases = new ArrayList<>();
}
