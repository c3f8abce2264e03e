package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.bizplanner.orchestrator.model.flow.FieldPredicate;
import com.bizplanner.orchestrator.model.flow.Phase;
import com.bizplanner.orchestrator.model.flow.PredicateOperator;
import com.bizplanner.orchestrator.model.flow.Question;
import com.bizplanner.orchestrator.model.flow.QuestionType;
import com.bizplanner.orchestrator.model.flow.SkipRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Flow graph behavior against the shipped questionnaire definition.
 */
@DisplayName("Flow Graph Tests")
class FlowGraphTest {

    private static FlowGraph graph;

    @BeforeAll
    static void loadQuestionnaire() {
        graph = FlowGraphLoader.load("classpath:flow/questionnaire.yaml");
    }

    @Test
    @DisplayName("One-time revenue hides churn_rate")
    void oneTimeRevenueSkipsChurn() {
        // Given
        Map<String, Object> answers = Map.of("revenue_model", "one_time");

        // When
        boolean skipped = graph.shouldSkip("churn_rate", answers);

        // Then
        assertThat(skipped).isTrue();
        assertThat(graph.getSkipReason("churn_rate", answers)).hasValue("One-time revenue does not have churn");
    }

    @Test
    @DisplayName("Questions without a skip rule are never skipped")
    void questionWithoutRuleIsAsked() {
        assertThat(graph.shouldSkip("user_name", Map.of("revenue_model", "one_time"))).isFalse();
        assertThat(graph.getSkipReason("user_name", Map.of())).isEmpty();
    }

    @Test
    @DisplayName("Existing-business branch returns the configured questions")
    void existingBranchQuestions() {
        // When
        List<String> questions = graph.getBranchQuestions("business_path", "existing");

        // Then
        assertThat(questions).containsExactly("existing_name", "existing_website", "existing_industry",
                "business_start_date", "current_revenue", "legal_entity", "current_products");
    }

    @Test
    @DisplayName("Unknown branch points and answers give no questions")
    void unknownBranch() {
        assertThat(graph.getBranchQuestions("business_path", "franchise")).isEmpty();
        assertThat(graph.getBranchQuestions("user_name", "existing")).isEmpty();
        assertThat(graph.isBranchPoint("business_path")).isTrue();
        assertThat(graph.isBranchPoint("user_name")).isFalse();
    }

    @Test
    @DisplayName("Active branches list only answered branch points")
    void activeBranches() {
        Map<String, Object> active = graph.getActiveBranches(Map.of("business_path", "new", "customer_type", ""));

        assertThat(active).containsOnlyKeys("business_path");
    }

    @Test
    @DisplayName("Ordered questions follow phase order and ids are unique")
    void orderedQuestions() {
        List<Question> questions = graph.getOrderedQuestions();

        assertThat(questions).isNotEmpty();
        assertThat(questions.get(0).getId()).isEqualTo("language");
        assertThat(questions).extracting(Question::getId).doesNotHaveDuplicates();
        assertThat(graph.getPhaseOf("business_path")).map(Phase::getNumber).hasValue(3);
    }

    @Test
    @DisplayName("A failing skip rule keeps the question visible")
    void skipRuleFailsOpen() {
        // Given
        Question question = Question.builder().id("q1").prompt("Q1").type(QuestionType.TEXT).build();
        Phase phase = Phase.builder().id("p1").number(1).questions(List.of(question)).build();
        SkipRule broken = SkipRule.builder()
                .questionId("q1")
                .reason("broken")
                .when(List.of(FieldPredicate.builder().field("x").operator(PredicateOperator.IN).build()))
                .build();
        FlowGraph local = new FlowGraph(List.of(phase), List.of(broken), List.of(), new PredicateEvaluator());

        // When / Then
        assertThat(local.shouldSkip("q1", Map.of("x", "a"))).isFalse();
        assertThat(local.getSkippedQuestions(Map.of("x", "a"))).isEmpty();
    }

    @Test
    @DisplayName("Agents fall back from question to phase to the global default")
    void agentFallback() {
        Question configured = Question.builder().id("q1").agents(List.of("market_analyst")).build();
        Question plain = Question.builder().id("q2").build();
        Question orphanPhase = Question.builder().id("q3").build();
        Phase withDefaults = Phase.builder().id("p1").number(1)
                .questions(List.of(configured, plain))
                .defaultAgents(List.of("customer_profiler"))
                .defaultSkills(List.of("competitor_analysis"))
                .build();
        Phase bare = Phase.builder().id("p2").number(2).questions(List.of(orphanPhase)).build();
        FlowGraph local = new FlowGraph(List.of(withDefaults, bare), List.of(), List.of(), new PredicateEvaluator());

        assertThat(local.getAgentsForQuestion("q1")).containsExactly("market_analyst");
        assertThat(local.getAgentsForQuestion("q2")).containsExactly("customer_profiler");
        assertThat(local.getAgentsForQuestion("q3")).isEqualTo(FlowGraph.FALLBACK_AGENTS);
        assertThat(local.getSkillsForQuestion("q2")).containsExactly("competitor_analysis");
        assertThat(local.getSkillsForQuestion("q3")).isEmpty();
    }

    @Test
    @DisplayName("Duplicate question ids are rejected")
    void duplicateQuestionIds() {
        Question question = Question.builder().id("dup").build();
        Phase phase = Phase.builder().id("p1").number(1).questions(List.of(question, question)).build();

        assertThatThrownBy(() -> new FlowGraph(List.of(phase), List.of(), List.of(), new PredicateEvaluator()))
                .isInstanceOf(DefinitionLoadException.class)
                .hasMessageContaining("dup");
    }
}
