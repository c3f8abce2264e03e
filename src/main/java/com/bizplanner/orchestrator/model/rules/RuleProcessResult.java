package com.bizplanner.orchestrator.model.rules;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the trigger rules derived from one answer. Nothing here has been
 * executed yet; agents and skills are only queued.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleProcessResult {

    @Builder.Default
    private Map<String, Object> autoPopulated = new LinkedHashMap<>();

    @Builder.Default
    private List<AgentInvocation> agentsToTrigger = new ArrayList<>();

    @Builder.Default
    private List<SkillInvocation> skillsToExecute = new ArrayList<>();

    @Builder.Default
    private List<String> thinkingLog = new ArrayList<>();

    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();

    public static RuleProcessResult empty() {
        return RuleProcessResult.builder().build();
    }
}
