package com.bizplanner.orchestrator.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRequest {

    @Builder.Default
    private Map<String, Object> answers = new LinkedHashMap<>();

    /**
     * Index of the question currently shown.
     */
    private int currentIndex;
}
