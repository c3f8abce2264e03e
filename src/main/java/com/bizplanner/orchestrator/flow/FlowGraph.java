package com.bizplanner.orchestrator.flow;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.bizplanner.orchestrator.model.flow.BranchPoint;
import com.bizplanner.orchestrator.model.flow.Phase;
import com.bizplanner.orchestrator.model.flow.Question;
import com.bizplanner.orchestrator.model.flow.SkipRule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only question flow graph: phases, questions, skip rules and branch points.
 *
 * <p>Built once at start-up from {@code flow/questionnaire.yaml} and shared by
 * every session. Skip evaluation is fail-open: when a rule cannot be evaluated
 * the question is asked.
 *
 * @since 2.0.0
 */
@Slf4j
public class FlowGraph {

    static final List<String> FALLBACK_AGENTS = List.of("context_collector", "business_planner_lead");

    private final List<Phase> phases;
    private final List<Question> orderedQuestions;
    private final Map<String, Question> questionsById;
    private final Map<String, Phase> phaseByQuestionId;
    private final Map<String, SkipRule> skipRules;
    private final Map<String, BranchPoint> branchPoints;
    private final PredicateEvaluator evaluator;

    public FlowGraph(List<Phase> phases,
                     List<SkipRule> skipRules,
                     List<BranchPoint> branchPoints,
                     PredicateEvaluator evaluator) {
        this.phases = ImmutableList.copyOf(phases);
        this.evaluator = evaluator;

        ImmutableList.Builder<Question> ordered = ImmutableList.builder();
        Map<String, Question> byId = new LinkedHashMap<>();
        Map<String, Phase> phaseIndex = new LinkedHashMap<>();
        for (Phase phase : phases) {
            for (Question question : phase.getQuestions()) {
                if (byId.putIfAbsent(question.getId(), question) != null) {
                    throw new DefinitionLoadException("Duplicate question id: " + question.getId());
                }
                phaseIndex.put(question.getId(), phase);
                ordered.add(question);
            }
        }
        this.orderedQuestions = ordered.build();
        this.questionsById = ImmutableMap.copyOf(byId);
        this.phaseByQuestionId = ImmutableMap.copyOf(phaseIndex);

        Map<String, SkipRule> rules = new LinkedHashMap<>();
        for (SkipRule rule : skipRules) {
            if (rules.putIfAbsent(rule.getQuestionId(), rule) != null) {
                throw new DefinitionLoadException("Duplicate skip rule for question: " + rule.getQuestionId());
            }
        }
        this.skipRules = ImmutableMap.copyOf(rules);

        Map<String, BranchPoint> points = new LinkedHashMap<>();
        branchPoints.forEach(point -> points.put(point.getQuestionId(), point));
        this.branchPoints = ImmutableMap.copyOf(points);
    }

    public List<Phase> getPhases() {
        return phases;
    }

    public List<Question> getOrderedQuestions() {
        return orderedQuestions;
    }

    public Optional<Question> getQuestion(String questionId) {
        return Optional.ofNullable(questionsById.get(questionId));
    }

    public Optional<Phase> getPhaseOf(String questionId) {
        return Optional.ofNullable(phaseByQuestionId.get(questionId));
    }

    public Optional<Phase> getPhase(String phaseId) {
        return phases.stream().filter(phase -> phase.getId().equals(phaseId)).findFirst();
    }

    /**
     * Whether the question is hidden by its skip rule. No rule means false; a
     * rule that fails to evaluate also means false.
     */
    public boolean shouldSkip(String questionId, Map<String, ?> answers) {
        SkipRule rule = skipRules.get(questionId);
        if (rule == null) {
            return false;
        }
        return evaluateFailOpen(rule, answers);
    }

    public Optional<String> getSkipReason(String questionId, Map<String, ?> answers) {
        SkipRule rule = skipRules.get(questionId);
        if (rule == null || !evaluateFailOpen(rule, answers)) {
            return Optional.empty();
        }
        return Optional.of(rule.getReason());
    }

    /**
     * Ids of every question currently hidden by a skip rule, in rule order.
     */
    public List<String> getSkippedQuestions(Map<String, ?> answers) {
        List<String> skipped = new ArrayList<>();
        for (SkipRule rule : skipRules.values()) {
            if (evaluateFailOpen(rule, answers)) {
                skipped.add(rule.getQuestionId());
            }
        }
        return skipped;
    }

    /**
     * Question ids a branch-point answer activates; empty for unknown points or answers.
     */
    public List<String> getBranchQuestions(String branchPointId, String answer) {
        BranchPoint point = branchPoints.get(branchPointId);
        if (point == null || answer == null) {
            return List.of();
        }
        return point.getBranches().getOrDefault(answer, List.of());
    }

    public boolean isBranchPoint(String questionId) {
        return branchPoints.containsKey(questionId);
    }

    /**
     * Answered branch points and the value chosen for each.
     */
    public Map<String, Object> getActiveBranches(Map<String, ?> answers) {
        Map<String, Object> active = new LinkedHashMap<>();
        for (String pointId : branchPoints.keySet()) {
            Object value = answers.get(pointId);
            if (PredicateEvaluator.isPresent(value)) {
                active.put(pointId, value);
            }
        }
        return active;
    }

    /**
     * Agents configured on the question, else the phase defaults, else the global fallback.
     */
    public List<String> getAgentsForQuestion(String questionId) {
        Question question = questionsById.get(questionId);
        if (question != null && !question.getAgents().isEmpty()) {
            return question.getAgents();
        }
        Phase phase = phaseByQuestionId.get(questionId);
        if (phase != null && !phase.getDefaultAgents().isEmpty()) {
            return phase.getDefaultAgents();
        }
        return FALLBACK_AGENTS;
    }

    public List<String> getSkillsForQuestion(String questionId) {
        Question question = questionsById.get(questionId);
        if (question != null && !question.getSkills().isEmpty()) {
            return question.getSkills();
        }
        Phase phase = phaseByQuestionId.get(questionId);
        return phase != null ? phase.getDefaultSkills() : List.of();
    }

    public List<String> getContextFields(String questionId) {
        return getQuestion(questionId).map(Question::getContextFields).orElse(List.of());
    }

    public int getSkipRuleCount() {
        return skipRules.size();
    }

    private boolean evaluateFailOpen(SkipRule rule, Map<String, ?> answers) {
        try {
            return evaluator.anyMatch(rule.getWhen(), answers);
        } catch (RuntimeException e) {
            log.warn("Skip rule for '{}' failed to evaluate, question stays visible: {}",
                    rule.getQuestionId(), e.getMessage());
            return false;
        }
    }
}
