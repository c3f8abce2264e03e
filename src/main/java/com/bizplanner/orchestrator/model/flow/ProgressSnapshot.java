package com.bizplanner.orchestrator.model.flow;

/**
 * Completion figures computed over the unskipped questions only.
 *
 * @param answered   unskipped questions before the current index that have an answer
 * @param total      answered plus unskipped questions from the current index on
 * @param percentage round(answered / total * 100), 0 when total is 0
 * @param skipped    questions before the current index hidden by skip rules
 */
public record ProgressSnapshot(int answered, int total, int percentage, int skipped) {
}
