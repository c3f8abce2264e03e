package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.exception.RuleEvaluationException;
import com.bizplanner.orchestrator.model.flow.FieldPredicate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates {@link FieldPredicate} descriptors against an answer map.
 *
 * <p>Pure and stateless. Numbers compare by value ({@code 3} equals {@code 3.0});
 * everything else compares with {@link Objects#equals}. A descriptor that cannot
 * be evaluated (no field, no operator, in/not_in without values) raises
 * {@link RuleEvaluationException}; callers decide how to recover.
 *
 * @since 2.0.0
 */
public class PredicateEvaluator {

    public boolean test(FieldPredicate predicate, Map<String, ?> answers) {
        if (predicate == null || predicate.getField() == null || predicate.getOperator() == null) {
            throw new RuleEvaluationException("Malformed predicate: " + predicate);
        }

        Object actual = answers.get(predicate.getField());

        switch (predicate.getOperator()) {
            case EXISTS:
                return isPresent(actual);
            case EQUALS:
                return valuesEqual(actual, predicate.getValue());
            case NOT_EQUALS:
                return !valuesEqual(actual, predicate.getValue());
            case CONTAINS:
                return contains(actual, predicate.getValue());
            case IN:
                return memberOf(actual, requireValues(predicate));
            case NOT_IN:
                return !memberOf(actual, requireValues(predicate));
            default:
                throw new RuleEvaluationException("Unsupported operator: " + predicate.getOperator());
        }
    }

    public boolean anyMatch(List<FieldPredicate> predicates, Map<String, ?> answers) {
        for (FieldPredicate predicate : predicates) {
            if (test(predicate, answers)) {
                return true;
            }
        }
        return false;
    }

    static boolean isPresent(Object value) {
        return value != null && !"".equals(value);
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean contains(Object actual, Object expected) {
        if (expected == null) {
            throw new RuleEvaluationException("contains requires a value");
        }
        if (actual instanceof String) {
            return ((String) actual).contains(String.valueOf(expected));
        }
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(item -> valuesEqual(item, expected));
        }
        return false;
    }

    private static boolean memberOf(Object actual, List<Object> values) {
        return values.stream().anyMatch(candidate -> valuesEqual(actual, candidate));
    }

    private static List<Object> requireValues(FieldPredicate predicate) {
        if (predicate.getValues() == null) {
            throw new RuleEvaluationException(predicate.getOperator().getCode() + " requires values: " + predicate);
        }
        return predicate.getValues();
    }
}
