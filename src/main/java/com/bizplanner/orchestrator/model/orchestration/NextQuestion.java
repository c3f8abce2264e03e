package com.bizplanner.orchestrator.model.orchestration;

import com.bizplanner.orchestrator.model.flow.Question;

/**
 * The question the synthesized reply should ask next.
 *
 * @param question prompt text
 * @param type     question type code, e.g. "choice"
 */
public record NextQuestion(String question, String type) {

    public static NextQuestion of(Question question) {
        return new NextQuestion(question.getPrompt(), question.getType() == null ? "text" : question.getType().getCode());
    }
}
