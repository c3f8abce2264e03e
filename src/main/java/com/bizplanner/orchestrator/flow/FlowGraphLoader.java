package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.bizplanner.orchestrator.model.flow.BranchPoint;
import com.bizplanner.orchestrator.model.flow.Phase;
import com.bizplanner.orchestrator.model.flow.QuestionnaireDefinition;
import com.bizplanner.orchestrator.model.flow.SkipRule;
import com.bizplanner.orchestrator.util.YamlDefinitionReader;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link FlowGraph} from a questionnaire YAML file and checks that
 * every skip rule and branch point refers to a known question.
 */
@Slf4j
public final class FlowGraphLoader {

    private FlowGraphLoader() {
    }

    public static FlowGraph load(String location) {
        QuestionnaireDefinition definition = YamlDefinitionReader.read(location, QuestionnaireDefinition.class);
        FlowGraph graph = fromDefinition(definition);
        log.info("Loaded questionnaire: {} phases, {} questions, {} skip rules",
                graph.getPhases().size(), graph.getOrderedQuestions().size(), graph.getSkipRuleCount());
        return graph;
    }

    public static FlowGraph fromDefinition(QuestionnaireDefinition definition) {
        Set<String> questionIds = definition.getPhases().stream()
                .flatMap(phase -> phase.getQuestions().stream())
                .map(question -> question.getId())
                .collect(Collectors.toSet());

        for (SkipRule rule : definition.getSkipRules()) {
            if (!questionIds.contains(rule.getQuestionId())) {
                throw new DefinitionLoadException("Skip rule targets unknown question: " + rule.getQuestionId());
            }
            if (rule.getWhen().isEmpty()) {
                throw new DefinitionLoadException("Skip rule for " + rule.getQuestionId() + " has no predicates");
            }
        }
        for (BranchPoint point : definition.getBranchPoints()) {
            if (!questionIds.contains(point.getQuestionId())) {
                throw new DefinitionLoadException("Branch point targets unknown question: " + point.getQuestionId());
            }
        }
        for (Phase phase : definition.getPhases()) {
            if (phase.getId() == null) {
                throw new DefinitionLoadException("Phase without id (number " + phase.getNumber() + ")");
            }
        }

        return new FlowGraph(definition.getPhases(), definition.getSkipRules(),
                definition.getBranchPoints(), new PredicateEvaluator());
    }
}
