package com.bizplanner.orchestrator.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code flow/questionnaire.yaml}.
 *
 * <pre>
 * phases:
 *   - id: revenue
 *     number: 5
 *     questions: [...]
 * skipRules:
 *   - questionId: churn_rate
 *     reason: One-time revenue does not have churn
 *     when:
 *       - { field: revenue_model, operator: equals, value: one_time }
 * branchPoints:
 *   - questionId: business_path
 *     branches: { existing: [existing_name, ...] }
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionnaireDefinition {
    private List<Phase> phases = new ArrayList<>();
    private List<SkipRule> skipRules = new ArrayList<>();
    private List<BranchPoint> branchPoints = new ArrayList<>();
}
