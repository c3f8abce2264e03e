package com.bizplanner.orchestrator.model.flow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Input type of a questionnaire question, as written in the flow definition.
 */
public enum QuestionType {
    TEXT("text"),
    TEXTAREA("textarea"),
    NUMBER("number"),
    EMAIL("email"),
    PHONE("phone"),
    URL("url"),
    DATE("date"),
    CHOICE("choice"),
    MULTISELECT("multiselect"),
    SLIDER("slider"),
    RANGE("range"),
    LIST("list"),
    AMOUNT("amount"),
    PERCENTAGE("percentage"),
    PERCENTAGE_BREAKDOWN("percentage_breakdown"),
    MILESTONE("milestone"),
    RANKING("ranking"),
    CHECKPOINT("checkpoint");

    private final String code;

    QuestionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static QuestionType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + code));
    }
}
