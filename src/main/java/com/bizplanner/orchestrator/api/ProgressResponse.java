package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressResponse {

    private boolean success;
    private String error;
    private ProgressSnapshot progress;

    @Builder.Default
    private List<String> skippedQuestions = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> activeBranches = new LinkedHashMap<>();

    public static ProgressResponse error(String error) {
        return ProgressResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
