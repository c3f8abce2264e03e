package com.bizplanner.orchestrator.exception;

import lombok.Getter;

@Getter
public class FormulaEvaluationException extends RuntimeException {

    private final String formula;

    public FormulaEvaluationException(String message, String formula) {
        super(message);
        this.formula = formula;
    }
}
