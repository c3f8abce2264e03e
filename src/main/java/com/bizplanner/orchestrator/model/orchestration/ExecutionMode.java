package com.bizplanner.orchestrator.model.orchestration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ExecutionMode {
    PARALLEL("parallel"),
    SEQUENTIAL("sequential");

    private final String code;

    ExecutionMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ExecutionMode fromCode(String code) {
        return parse(code).orElseThrow(() -> new IllegalArgumentException("Unknown execution mode: " + code));
    }

    public static Optional<ExecutionMode> parse(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(mode -> mode.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
