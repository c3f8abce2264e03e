package com.bizplanner.orchestrator.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Declarative test against one answer field, e.g.
 * {@code {field: revenue_model, operator: equals, value: one_time}}.
 *
 * <p>{@code value} is used by equals/not_equals/contains, {@code values} by in/not_in.
 *
 * @see com.bizplanner.orchestrator.flow.PredicateEvaluator
 */
@Value
@Builder
@Jacksonized
public class FieldPredicate {

    String field;
    PredicateOperator operator;
    Object value;
    List<Object> values;

    public static FieldPredicate equalTo(String field, Object value) {
        return FieldPredicate.builder().field(field).operator(PredicateOperator.EQUALS).value(value).build();
    }

    public static FieldPredicate in(String field, List<Object> values) {
        return FieldPredicate.builder().field(field).operator(PredicateOperator.IN).values(values).build();
    }

    @Override
    public String toString() {
        return field + " " + operator.getCode() + " " + (values != null ? values : value);
    }
}
