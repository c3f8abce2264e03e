package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import com.bizplanner.orchestrator.model.flow.Question;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Walks an ordered question list with the flow graph's skip rules.
 *
 * <p>Every count here is taken over unskipped questions only, so a question
 * hidden by an earlier answer never moves the progress figures.
 *
 * @since 2.0.0
 */
@RequiredArgsConstructor
public class NavigationResolver {

    private final FlowGraph flowGraph;

    /**
     * First index at or after {@code startIndex} whose question is not skipped,
     * or {@code questions.size()} when every remaining question is skipped.
     */
    public int nextQuestionIndex(List<Question> questions, int startIndex, Map<String, ?> answers) {
        int index = Math.max(startIndex, 0);
        while (index < questions.size()) {
            if (!flowGraph.shouldSkip(questions.get(index).getId(), answers)) {
                return index;
            }
            index++;
        }
        return index;
    }

    public int countRemaining(List<Question> questions, int currentIndex, Map<String, ?> answers) {
        int count = 0;
        for (int i = Math.max(currentIndex, 0); i < questions.size(); i++) {
            if (!flowGraph.shouldSkip(questions.get(i).getId(), answers)) {
                count++;
            }
        }
        return count;
    }

    public ProgressSnapshot trueProgress(List<Question> questions, int currentIndex, Map<String, ?> answers) {
        int answered = 0;
        int skipped = 0;

        for (int i = 0; i < currentIndex && i < questions.size(); i++) {
            String id = questions.get(i).getId();
            if (flowGraph.shouldSkip(id, answers)) {
                skipped++;
            } else if (answers.containsKey(id)) {
                answered++;
            }
        }

        int total = answered + countRemaining(questions, currentIndex, answers);
        int percentage = total > 0 ? (int) Math.round(answered * 100.0 / total) : 0;
        return new ProgressSnapshot(answered, total, percentage, skipped);
    }
}
