package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.model.flow.FieldPredicate;
import com.bizplanner.orchestrator.model.flow.Phase;
import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import com.bizplanner.orchestrator.model.flow.Question;
import com.bizplanner.orchestrator.model.flow.SkipRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Navigation Resolver Tests")
class NavigationResolverTest {

    private List<Question> questions;
    private NavigationResolver resolver;

    @BeforeEach
    void setUp() {
        questions = List.of(
                Question.builder().id("revenue_model").build(),
                Question.builder().id("churn_rate").build(),
                Question.builder().id("expansion_revenue").build(),
                Question.builder().id("pricing").build());
        Phase phase = Phase.builder().id("revenue").number(5).questions(questions).build();
        List<SkipRule> rules = List.of(
                SkipRule.builder().questionId("churn_rate").reason("no churn")
                        .when(List.of(FieldPredicate.equalTo("revenue_model", "one_time"))).build(),
                SkipRule.builder().questionId("expansion_revenue").reason("no expansion")
                        .when(List.of(FieldPredicate.equalTo("revenue_model", "one_time"))).build());
        resolver = new NavigationResolver(new FlowGraph(List.of(phase), rules, List.of(), new PredicateEvaluator()));
    }

    @Test
    @DisplayName("Next index jumps over skipped questions")
    void nextIndexSkips() {
        // Given
        Map<String, Object> answers = Map.of("revenue_model", "one_time");

        // When
        int next = resolver.nextQuestionIndex(questions, 1, answers);

        // Then
        assertThat(next).isEqualTo(3);
    }

    @Test
    @DisplayName("Next index is the list size when everything left is skipped")
    void nextIndexPastEnd() {
        assertThat(resolver.nextQuestionIndex(questions, 4, Map.of())).isEqualTo(4);
        assertThat(resolver.nextQuestionIndex(questions, -3, Map.of())).isZero();
    }

    @Test
    @DisplayName("Remaining count ignores skipped questions")
    void remainingCount() {
        assertThat(resolver.countRemaining(questions, 1, Map.of("revenue_model", "one_time"))).isEqualTo(1);
        assertThat(resolver.countRemaining(questions, 1, Map.of("revenue_model", "subscription"))).isEqualTo(3);
    }

    @Test
    @DisplayName("Progress counts only unskipped questions")
    void trueProgress() {
        // Given
        Map<String, Object> answers = Map.of("revenue_model", "one_time");

        // When
        ProgressSnapshot progress = resolver.trueProgress(questions, 3, answers);

        // Then
        assertThat(progress.answered()).isEqualTo(1);
        assertThat(progress.skipped()).isEqualTo(2);
        assertThat(progress.total()).isEqualTo(2);
        assertThat(progress.percentage()).isEqualTo(50);
    }

    @Test
    @DisplayName("Empty question list gives zero progress")
    void emptyProgress() {
        ProgressSnapshot progress = resolver.trueProgress(List.of(), 0, Map.of());

        assertThat(progress.total()).isZero();
        assertThat(progress.percentage()).isZero();
    }
}
