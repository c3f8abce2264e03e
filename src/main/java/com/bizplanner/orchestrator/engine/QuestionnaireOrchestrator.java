package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.flow.FlowGraph;
import com.bizplanner.orchestrator.flow.NavigationResolver;
import com.bizplanner.orchestrator.model.flow.Phase;
import com.bizplanner.orchestrator.model.flow.ProgressSnapshot;
import com.bizplanner.orchestrator.model.flow.Question;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.AnswerOutcome;
import com.bizplanner.orchestrator.model.orchestration.AnswerTurnResult;
import com.bizplanner.orchestrator.model.orchestration.ExecutionMode;
import com.bizplanner.orchestrator.model.orchestration.ExecutionPlan;
import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.bizplanner.orchestrator.model.orchestration.NextQuestion;
import com.bizplanner.orchestrator.model.orchestration.OrchestrationResult;
import com.bizplanner.orchestrator.model.orchestration.QuestionConfigSummary;
import com.bizplanner.orchestrator.model.orchestration.Task;
import com.bizplanner.orchestrator.model.rules.RuleProcessResult;
import com.bizplanner.orchestrator.model.rules.SkillInvocation;
import com.bizplanner.orchestrator.rules.RuleTriggerEngine;
import com.bizplanner.orchestrator.skill.SkillRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Questionnaire turns on top of the {@link Orchestrator}.
 *
 * <p>Agents and skills come from the question's configuration (and the trigger
 * rules of the answer) instead of model inference. The service keeps no
 * session state; callers own the answer set and the current index.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionnaireOrchestrator {

    private final FlowGraph flowGraph;
    private final NavigationResolver navigationResolver;
    private final RuleTriggerEngine ruleTriggerEngine;
    private final SkillRegistry skillRegistry;
    private final IntentResolver intentResolver;
    private final Orchestrator orchestrator;
    private final AnswerExtractor answerExtractor;
    private final CallDeadlines deadlines;
    private final OrchestratorConfig config;

    /**
     * Records one answer: extraction, next unskipped index, remaining count
     * and the questions a branch point activates.
     */
    public AnswerOutcome processOneAnswer(String questionId,
                                         Object rawAnswer,
                                         Map<String, ?> answers,
                                         List<Question> questions,
                                         int currentIndex) {
        Map<String, Object> updated = new LinkedHashMap<>(answers);
        updated.put(questionId, rawAnswer);

        int next = navigationResolver.nextQuestionIndex(questions, currentIndex + 1, updated);
        int remaining = navigationResolver.countRemaining(questions, next, updated);
        List<String> activated = flowGraph.isBranchPoint(questionId)
                ? flowGraph.getBranchQuestions(questionId, AnswerExtractor.asText(rawAnswer))
                : List.of();

        return AnswerOutcome.builder()
                .extractedData(answerExtractor.extract(questionId, rawAnswer))
                .nextQuestionIndex(next)
                .remainingCount(remaining)
                .activatedBranchQuestionIds(activated)
                .build();
    }

    /**
     * Full answer pipeline over the configured question order: trigger rules,
     * queued skills, navigation and the orchestrated reply.
     *
     * @throws IllegalArgumentException for an unknown question id
     */
    public AnswerTurnResult processUserAnswer(String questionId,
                                              Object answer,
                                              Map<String, ?> answers,
                                              int currentIndex,
                                              String language) {
        Question question = flowGraph.getQuestion(questionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown question: " + questionId));
        List<Question> questions = flowGraph.getOrderedQuestions();

        RuleProcessResult rules = ruleTriggerEngine.processAnswer(questionId, answer, answers);

        Map<String, Object> updated = new LinkedHashMap<>(answers);
        updated.putAll(rules.getAutoPopulated());
        updated.put(questionId, answer);

        List<String> errors = new ArrayList<>(rules.getValidationErrors());
        Map<String, Object> skillResults = runQueuedSkills(rules.getSkillsToExecute(), errors);

        AnswerOutcome outcome = processOneAnswer(questionId, answer, updated, questions, currentIndex);
        NextQuestion nextQuestion = outcome.getNextQuestionIndex() < questions.size()
                ? NextQuestion.of(questions.get(outcome.getNextQuestionIndex()))
                : null;

        OrchestrationResult orchestration = processQuestionRequest(
                AnswerExtractor.asText(answer), question.getId(), updated, nextQuestion, language, rules);

        List<String> thinking = new ArrayList<>(rules.getThinkingLog());
        thinking.addAll(describe(orchestration));

        return AnswerTurnResult.builder()
                .outcome(outcome)
                .progress(getProgress(questions, outcome.getNextQuestionIndex(), updated))
                .autoPopulated(rules.getAutoPopulated())
                .skillResults(skillResults)
                .validationErrors(errors)
                .thinkingLog(thinking)
                .orchestration(orchestration)
                .build();
    }

    /**
     * Orchestrates a turn for one question with its configured agents and
     * skills, plus any agents the trigger rules queued. A skipped question
     * returns an empty result. If the configured run fails, the turn falls
     * back to {@link Orchestrator#processRequest}.
     */
    public OrchestrationResult processQuestionRequest(String message,
                                                      String questionId,
                                                      Map<String, ?> answers,
                                                      NextQuestion nextQuestion,
                                                      String language,
                                                      RuleProcessResult rules) {
        long start = System.currentTimeMillis();
        Phase phase = flowGraph.getPhaseOf(questionId).orElse(null);
        String questionText = flowGraph.getQuestion(questionId).map(Question::getPrompt).orElse(questionId);

        if (flowGraph.shouldSkip(questionId, answers)) {
            String reason = flowGraph.getSkipReason(questionId, answers).orElse("Skipped based on previous answers");
            log.info("Question {} skipped: {}", questionId, reason);
            return OrchestrationResult.builder()
                    .synthesis("")
                    .intent(Intent.builder().goal("Question skipped").reasoning(reason).build())
                    .plan(ExecutionPlan.empty())
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .questionConfig(QuestionConfigSummary.skipped(reason))
                    .build();
        }

        List<String> agents = flowGraph.getAgentsForQuestion(questionId);
        List<String> skills = flowGraph.getSkillsForQuestion(questionId);
        List<String> contextFields = flowGraph.getContextFields(questionId);

        Intent intent = Intent.builder()
                .goal("Process question: " + questionText)
                .agents(agents)
                .skills(skills)
                .executionMode(ExecutionMode.PARALLEL)
                .reasoning("Agents selected from question configuration for " + questionId)
                .contextRequirements(contextFields)
                .build();
        if (rules != null && !rules.getAgentsToTrigger().isEmpty()) {
            intent = merge(intent, intentResolver.intentFromRules(rules));
        }
        log.info("Using configured agents for {}: {}", questionId, intent.getAgents());

        Map<String, Object> context = buildOrchestratorContext(answers,
                phase == null ? null : phase.getId(),
                phase == null ? 0 : phase.getNumber());
        context.put(ContextKeys.QUESTION_ID, questionId);
        context.put(ContextKeys.QUESTION_TEXT, questionText);
        if (nextQuestion != null) {
            context.put(ContextKeys.NEXT_QUESTION, nextQuestion);
        }
        if (language != null && !language.isBlank()) {
            context.put(ContextKeys.LANGUAGE, language);
        }

        QuestionConfigSummary summary = QuestionConfigSummary.builder()
                .configuredAgents(agents)
                .configuredSkills(skills)
                .contextFields(contextFields)
                .branchPoint(flowGraph.isBranchPoint(questionId))
                .build();

        try {
            return orchestrator.execute(intent, message, context).toBuilder()
                    .questionConfig(summary)
                    .build();
        } catch (RuntimeException e) {
            log.error("Configured orchestration for {} failed, falling back to base orchestrator", questionId, e);
            return orchestrator.processRequest(message, context);
        }
    }

    /**
     * Context handed to agents for a questionnaire turn. Commonly needed answers
     * are copied to top-level keys.
     */
    public Map<String, Object> buildOrchestratorContext(Map<String, ?> answers, String phaseId, int phaseNumber) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(ContextKeys.CURRENT_PHASE, phaseNumber);
        context.put(ContextKeys.PHASE_ID, phaseId);
        context.put(ContextKeys.ALL_ANSWERS, answers);

        copyIfPresent(answers, "language", context, ContextKeys.LANGUAGE);
        copyIfPresent(answers, "user_name", context, ContextKeys.USER_NAME);
        copyIfPresent(answers, "business_path", context, ContextKeys.BUSINESS_PATH);
        copyIfPresent(answers, "customer_type", context, ContextKeys.CUSTOMER_TYPE);
        copyIfPresent(answers, "business_model_type", context, ContextKeys.BUSINESS_MODEL_TYPE);
        copyIfPresent(answers, "risk_tolerance", context, ContextKeys.RISK_TOLERANCE);
        return context;
    }

    public ProgressSnapshot getProgress(List<Question> questions, int currentIndex, Map<String, ?> answers) {
        return navigationResolver.trueProgress(questions, currentIndex, answers);
    }

    private Map<String, Object> runQueuedSkills(List<SkillInvocation> invocations, List<String> errors) {
        Map<String, Object> results = new LinkedHashMap<>();
        for (SkillInvocation invocation : invocations) {
            try {
                Object result = deadlines.call("skill " + invocation.skillId(),
                        Duration.ofSeconds(config.getDeadlines().getSkillSeconds()),
                        () -> skillRegistry.execute(invocation.skillId(), invocation.params()));
                results.put(invocation.skillId(), result);
            } catch (RuntimeException e) {
                log.warn("Queued skill {} failed: {}", invocation.skillId(), e.getMessage());
                errors.add("Skill " + invocation.skillId() + " failed: " + e.getMessage());
            }
        }
        return results;
    }

    private static Intent merge(Intent configured, Intent fromRules) {
        Set<String> agents = new LinkedHashSet<>(configured.getAgents());
        agents.addAll(fromRules.getAgents());
        Set<String> skills = new LinkedHashSet<>(configured.getSkills());
        skills.addAll(fromRules.getSkills());

        return configured.toBuilder()
                .agents(List.copyOf(agents))
                .skills(List.copyOf(skills))
                .agentPrompts(fromRules.getAgentPrompts())
                .reasoning(configured.getReasoning() + "; plus agents triggered by answer rules")
                .build();
    }

    private static List<String> describe(OrchestrationResult result) {
        List<String> lines = new ArrayList<>();
        if (result.getPlan() == null || result.getIntent() == null) {
            return lines;
        }
        lines.add("Analyzed request: " + result.getIntent().getGoal());
        lines.add("Plan: " + result.getPlan().getExecutionMode().getCode() + " execution of "
                + result.getPlan().getTasks().size() + " tasks");
        for (Task task : result.getPlan().getTasks()) {
            lines.add("Task: " + task.getDescription());
        }
        for (AgentOutput output : result.getAgentOutputs()) {
            lines.add("Agent " + output.getAgentName() + (output.isSuccess() ? " finished" : " failed")
                    + " (" + output.getExecutionTimeMs() + "ms)");
        }
        lines.add("Synthesis complete");
        return lines;
    }

    private static void copyIfPresent(Map<String, ?> answers, String answerKey, Map<String, Object> context, String key) {
        Object value = answers.get(answerKey);
        if (value != null && !"".equals(value)) {
            context.put(key, value);
        }
    }
}
