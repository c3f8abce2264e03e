package com.bizplanner.orchestrator.model.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an auto-populated value comes from. {@code AGENT} and {@code SKILL}
 * are accepted in definitions but never produce a value during answer processing.
 */
public enum PopulateSource {
    STATIC,
    LOOKUP,
    CALCULATION,
    AGENT,
    SKILL;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PopulateSource fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
