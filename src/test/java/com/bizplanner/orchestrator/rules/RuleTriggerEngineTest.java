package com.bizplanner.orchestrator.rules;

import com.bizplanner.orchestrator.flow.PredicateEvaluator;
import com.bizplanner.orchestrator.model.rules.AgentInvocation;
import com.bizplanner.orchestrator.model.rules.RuleProcessResult;
import com.bizplanner.orchestrator.model.rules.SkillInvocation;
import com.bizplanner.orchestrator.rules.params.BusinessModelParamBuilder;
import com.bizplanner.orchestrator.rules.params.CompetitorAnalysisParamBuilder;
import com.bizplanner.orchestrator.rules.params.ComplianceCheckParamBuilder;
import com.bizplanner.orchestrator.rules.params.FinancialModelingParamBuilder;
import com.bizplanner.orchestrator.rules.params.MarketSizingParamBuilder;
import com.bizplanner.orchestrator.rules.params.SkillParamBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Trigger rules as shipped in {@code rules/trigger-rules.yaml}.
 */
@DisplayName("Rule Trigger Engine Tests")
class RuleTriggerEngineTest {

    private static RuleTriggerEngine engine;

    @BeforeAll
    static void setUp() {
        List<SkillParamBuilder> builders = List.of(
                new MarketSizingParamBuilder(),
                new FinancialModelingParamBuilder(),
                new CompetitorAnalysisParamBuilder(),
                new ComplianceCheckParamBuilder(),
                new BusinessModelParamBuilder());
        FormulaEvaluator formulaEvaluator = new FormulaEvaluator();
        TriggerRuleRegistry registry = TriggerRuleRegistry.load(
                "classpath:rules/trigger-rules.yaml",
                "classpath:rules/lookup-tables.yaml",
                builders.stream().map(SkillParamBuilder::getName).collect(Collectors.toSet()),
                formulaEvaluator);
        engine = new RuleTriggerEngine(registry,
                builders.stream().collect(Collectors.toMap(SkillParamBuilder::getName, Function.identity())),
                new PredicateEvaluator(),
                formulaEvaluator,
                new TemplateInterpolator());
    }

    @Test
    @DisplayName("LTV answer computes the LTV:CAC ratio")
    void ltvCacRatio() {
        // Given
        Map<String, Object> answers = Map.of("target_cac", 50000);

        // When
        RuleProcessResult result = engine.processAnswer("ltv", 150000, answers);

        // Then
        assertThat(result.getAutoPopulated()).containsEntry("ltv_cac_ratio", 3.0);
        assertThat(result.getValidationErrors()).isEmpty();
    }

    @Test
    @DisplayName("Unanswered placeholders stay literal in agent prompts")
    void literalPlaceholders() {
        RuleProcessResult result = engine.processAnswer("ltv", 150000, Map.of("target_cac", 50000));

        assertThat(result.getAgentsToTrigger()).extracting(AgentInvocation::agentId)
                .containsExactly("unit_economics_calculator");
        assertThat(result.getAgentsToTrigger().get(0).prompt())
                .contains("LTV 150000")
                .contains("CAC 50000")
                .contains("{{churn_rate}}");
    }

    @Test
    @DisplayName("Agent guard blocks the trigger for one-time revenue")
    void guardBlocksAgent() {
        RuleProcessResult result = engine.processAnswer("ltv", 150000,
                Map.of("target_cac", 50000, "revenue_model", "one_time"));

        assertThat(result.getAgentsToTrigger()).isEmpty();
        assertThat(result.getAutoPopulated()).containsKey("ltv_cac_ratio");
    }

    @Test
    @DisplayName("Rule is not applied when a condition fails")
    void conditionNotMet() {
        // When
        RuleProcessResult result = engine.processAnswer("ltv", 150000, Map.of());

        // Then
        assertThat(result.getAutoPopulated()).isEmpty();
        assertThat(result.getAgentsToTrigger()).isEmpty();
    }

    @Test
    @DisplayName("Formula failure becomes a validation error")
    void formulaFailure() {
        RuleProcessResult result = engine.processAnswer("ltv", 150000, Map.of("target_cac", 0));

        assertThat(result.getAutoPopulated()).doesNotContainKey("ltv_cac_ratio");
        assertThat(result.getValidationErrors()).hasSize(1);
        assertThat(result.getValidationErrors().get(0)).contains("ltv_cac_ratio");
    }

    @Test
    @DisplayName("Location lookup falls back to a contained key")
    void lookupSubstring() {
        // When
        RuleProcessResult result = engine.processAnswer("user_location", "Hyderabad, India", Map.of());

        // Then
        assertThat(result.getAutoPopulated())
                .containsEntry("timezone", "Asia/Kolkata")
                .containsEntry("currency", "INR");
    }

    @Test
    @DisplayName("Location lookup matches an exact key first")
    void lookupExact() {
        RuleProcessResult result = engine.processAnswer("user_location", "Dubai", Map.of());

        assertThat(result.getAutoPopulated()).containsEntry("currency", "AED");
    }

    @Test
    @DisplayName("Customer type queues market sizing with built parameters")
    void queuesSkill() {
        // Given
        Map<String, Object> answers = Map.of(
                "primary_market", "India",
                "target_industries", List.of("SaaS", "Retail"));

        // When
        RuleProcessResult result = engine.processAnswer("customer_type", "b2b", answers);

        // Then
        assertThat(result.getSkillsToExecute()).extracting(SkillInvocation::skillId)
                .containsExactly("market_sizing_calculator");
        assertThat(result.getSkillsToExecute().get(0).params())
                .containsEntry("industry", "SaaS")
                .containsEntry("geography", "India")
                .containsEntry("business_model", "b2b");
        assertThat(result.getAgentsToTrigger().get(0).prompt())
                .isEqualTo("Analyze the b2b market for SaaS,Retail in India. Calculate TAM, SAM, SOM and provide market entry strategy.");
    }

    @Test
    @DisplayName("Fields without rules produce an empty result")
    void noRules() {
        RuleProcessResult result = engine.processAnswer("user_name", "Asha", Map.of());

        assertThat(result.getAutoPopulated()).isEmpty();
        assertThat(result.getAgentsToTrigger()).isEmpty();
        assertThat(result.getSkillsToExecute()).isEmpty();
        assertThat(result.getThinkingLog()).containsExactly("Processing answer for user_name...");
    }

    @Test
    @DisplayName("Whole-number answers hit the exact lookup key before substring matching")
    void wholeNumberExactLookup() {
        // Given
        Map<String, Object> bands = new LinkedHashMap<>();
        bands.put("5", "small");
        bands.put("50", "medium");
        RuleTriggerEngine bandEngine = new RuleTriggerEngine(
                new TriggerRuleRegistry(List.of(), Map.of("team_band", bands)),
                Map.of(),
                new PredicateEvaluator(),
                new FormulaEvaluator(),
                new TemplateInterpolator());

        // When / Then
        assertThat(bandEngine.lookup("team_band", 50.0)).contains("medium");
        assertThat(bandEngine.lookup("team_band", 5.0)).contains("small");
        assertThat(bandEngine.lookup("team_band", 50)).contains("medium");
    }
}
