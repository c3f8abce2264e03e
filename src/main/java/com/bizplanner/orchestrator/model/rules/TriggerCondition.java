package com.bizplanner.orchestrator.model.rules;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Precondition of a trigger rule: one of {@link Exists}, {@link Equals} or
 * {@link Contains}. Definitions are converted with {@link #from}, which rejects
 * unknown operators when the rules are loaded.
 *
 * @since 2.0.0
 */
public interface TriggerCondition {

    String field();

    boolean test(Map<String, ?> answers);

    /**
     * Field is present and is neither null nor the empty string.
     */
    record Exists(String field) implements TriggerCondition {
        @Override
        public boolean test(Map<String, ?> answers) {
            Object actual = answers.get(field);
            return actual != null && !"".equals(actual);
        }
    }

    /**
     * Strict equality: a string never equals a number, numbers compare by value.
     */
    record Equals(String field, Object value) implements TriggerCondition {
        @Override
        public boolean test(Map<String, ?> answers) {
            Object actual = answers.get(field);
            if (actual instanceof Number && value instanceof Number) {
                return Double.compare(((Number) actual).doubleValue(), ((Number) value).doubleValue()) == 0;
            }
            return Objects.equals(actual, value);
        }
    }

    /**
     * Substring test; only holds for string answers.
     */
    record Contains(String field, String value) implements TriggerCondition {
        @Override
        public boolean test(Map<String, ?> answers) {
            Object actual = answers.get(field);
            return actual instanceof String && ((String) actual).contains(value);
        }
    }

    static TriggerCondition from(ConditionDefinition definition) {
        if (definition.getField() == null || definition.getField().isBlank()) {
            throw new DefinitionLoadException("Condition without field: " + definition);
        }
        String operator = definition.getOperator() == null ? "" : definition.getOperator().toLowerCase(Locale.ROOT);
        switch (operator) {
            case "exists":
                return new Exists(definition.getField());
            case "equals":
                if (definition.getValue() == null) {
                    throw new DefinitionLoadException("equals condition on " + definition.getField() + " has no value");
                }
                return new Equals(definition.getField(), definition.getValue());
            case "contains":
                if (definition.getValue() == null) {
                    throw new DefinitionLoadException("contains condition on " + definition.getField() + " has no value");
                }
                return new Contains(definition.getField(), String.valueOf(definition.getValue()));
            default:
                throw new DefinitionLoadException("Unknown condition operator '" + definition.getOperator()
                        + "' on field " + definition.getField());
        }
    }
}
