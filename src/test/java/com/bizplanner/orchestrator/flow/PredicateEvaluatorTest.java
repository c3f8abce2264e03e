package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.exception.RuleEvaluationException;
import com.bizplanner.orchestrator.model.flow.FieldPredicate;
import com.bizplanner.orchestrator.model.flow.PredicateOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Predicate Evaluator Tests")
class PredicateEvaluatorTest {

    private final PredicateEvaluator evaluator = new PredicateEvaluator();

    @Test
    @DisplayName("equals compares numbers by value")
    void equalsComparesNumbersByValue() {
        // Given
        FieldPredicate predicate = FieldPredicate.equalTo("team_size", 3);

        // When / Then
        assertThat(evaluator.test(predicate, Map.of("team_size", 3.0))).isTrue();
        assertThat(evaluator.test(predicate, Map.of("team_size", "3"))).isFalse();
    }

    @Test
    @DisplayName("exists treats null and empty string as absent")
    void existsTreatsEmptyAsAbsent() {
        FieldPredicate predicate = FieldPredicate.builder().field("ltv").operator(PredicateOperator.EXISTS).build();

        assertThat(evaluator.test(predicate, Map.of("ltv", ""))).isFalse();
        assertThat(evaluator.test(predicate, Map.of())).isFalse();
        assertThat(evaluator.test(predicate, Map.of("ltv", 0))).isTrue();
    }

    @Test
    @DisplayName("contains works on text and on lists")
    void containsWorksOnTextAndLists() {
        FieldPredicate predicate = FieldPredicate.builder()
                .field("channels").operator(PredicateOperator.CONTAINS).value("seo").build();

        assertThat(evaluator.test(predicate, Map.of("channels", "seo and ads"))).isTrue();
        assertThat(evaluator.test(predicate, Map.of("channels", List.of("ads", "seo")))).isTrue();
        assertThat(evaluator.test(predicate, Map.of("channels", 42))).isFalse();
    }

    @Test
    @DisplayName("in and not_in check membership")
    void inAndNotIn() {
        FieldPredicate in = FieldPredicate.in("customer_type", List.of("b2b", "b2g"));
        FieldPredicate notIn = FieldPredicate.builder()
                .field("customer_type").operator(PredicateOperator.NOT_IN).values(List.of("b2b", "b2g")).build();
        Map<String, Object> answers = Map.of("customer_type", "b2c");

        assertThat(evaluator.test(in, answers)).isFalse();
        assertThat(evaluator.test(notIn, answers)).isTrue();
    }

    @Test
    @DisplayName("in without values is a malformed predicate")
    void inWithoutValuesThrows() {
        FieldPredicate predicate = FieldPredicate.builder()
                .field("customer_type").operator(PredicateOperator.IN).build();

        assertThatThrownBy(() -> evaluator.test(predicate, Map.of()))
                .isInstanceOf(RuleEvaluationException.class);
    }

    @Test
    @DisplayName("anyMatch is true when one predicate holds")
    void anyMatch() {
        List<FieldPredicate> predicates = List.of(
                FieldPredicate.equalTo("revenue_model", "subscription"),
                FieldPredicate.equalTo("revenue_model", "one_time"));

        assertThat(evaluator.anyMatch(predicates, Map.of("revenue_model", "one_time"))).isTrue();
        assertThat(evaluator.anyMatch(predicates, Map.of("revenue_model", "freemium"))).isFalse();
    }
}
