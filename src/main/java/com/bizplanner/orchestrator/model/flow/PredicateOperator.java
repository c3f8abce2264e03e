package com.bizplanner.orchestrator.model.flow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum PredicateOperator {
    EXISTS("exists"),
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    IN("in"),
    NOT_IN("not_in");

    private final String code;

    PredicateOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PredicateOperator fromCode(String code) {
        return Arrays.stream(values())
                .filter(op -> op.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown predicate operator: " + code));
    }
}
