package com.bizplanner.orchestrator.rules;

import com.bizplanner.orchestrator.flow.PredicateEvaluator;
import com.bizplanner.orchestrator.model.rules.AgentInvocation;
import com.bizplanner.orchestrator.model.rules.AgentTrigger;
import com.bizplanner.orchestrator.model.rules.AutoPopulateDirective;
import com.bizplanner.orchestrator.model.rules.RuleProcessResult;
import com.bizplanner.orchestrator.model.rules.SkillInvocation;
import com.bizplanner.orchestrator.model.rules.SkillTrigger;
import com.bizplanner.orchestrator.model.rules.TriggerCondition;
import com.bizplanner.orchestrator.model.rules.TriggerRule;
import com.bizplanner.orchestrator.rules.params.SkillParamBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the trigger rules of a just-answered field ("MCP").
 *
 * <p>For every rule whose conditions all hold, three independent steps run:
 * <ol>
 *   <li>auto-populate derived fields (static value, lookup table or formula)</li>
 *   <li>queue agents with prompts interpolated from the answers</li>
 *   <li>queue skills with parameters from the rule's parameter builder</li>
 * </ol>
 * A failing directive is logged and reported in {@code validationErrors};
 * it never stops the other directives or rules. Nothing is executed here.
 *
 * @since 2.0.0
 */
@Slf4j
public class RuleTriggerEngine {

    private final TriggerRuleRegistry registry;
    private final Map<String, SkillParamBuilder> paramBuilders;
    private final PredicateEvaluator predicateEvaluator;
    private final FormulaEvaluator formulaEvaluator;
    private final TemplateInterpolator interpolator;

    public RuleTriggerEngine(TriggerRuleRegistry registry,
                             Map<String, SkillParamBuilder> paramBuilders,
                             PredicateEvaluator predicateEvaluator,
                             FormulaEvaluator formulaEvaluator,
                             TemplateInterpolator interpolator) {
        this.registry = registry;
        this.paramBuilders = Map.copyOf(paramBuilders);
        this.predicateEvaluator = predicateEvaluator;
        this.formulaEvaluator = formulaEvaluator;
        this.interpolator = interpolator;
    }

    public RuleProcessResult processAnswer(String questionId, Object answer, Map<String, ?> allAnswers) {
        RuleProcessResult result = RuleProcessResult.empty();
        result.getThinkingLog().add("Processing answer for " + questionId + "...");
        log.info("Processing answer for {} with trigger rules", questionId);

        Map<String, Object> merged = new HashMap<>(allAnswers);
        merged.put(questionId, answer);

        for (TriggerRule rule : registry.getRules(questionId)) {
            if (!conditionsHold(rule, merged)) {
                log.debug("Conditions not met for rule on {}: {}", questionId, rule.getConditions());
                continue;
            }

            if (!rule.getAutoPopulate().isEmpty()) {
                result.getThinkingLog().add("Auto-populating related fields...");
                for (AutoPopulateDirective directive : rule.getAutoPopulate()) {
                    applyDirective(directive, answer, merged, result);
                }
            }

            if (!rule.getTriggerAgents().isEmpty()) {
                result.getThinkingLog().add("Identifying relevant AI agents...");
                for (AgentTrigger trigger : rule.getTriggerAgents()) {
                    collectAgent(trigger, merged, result);
                }
            }

            if (!rule.getTriggerSkills().isEmpty()) {
                result.getThinkingLog().add("Preparing business calculations...");
                for (SkillTrigger trigger : rule.getTriggerSkills()) {
                    collectSkill(trigger, answer, merged, result);
                }
            }
        }

        log.info("Trigger rules for {}: {} auto-populated, {} agents, {} skills, {} errors",
                questionId,
                result.getAutoPopulated().size(),
                result.getAgentsToTrigger().size(),
                result.getSkillsToExecute().size(),
                result.getValidationErrors().size());
        return result;
    }

    private boolean conditionsHold(TriggerRule rule, Map<String, ?> answers) {
        for (TriggerCondition condition : rule.getConditions()) {
            if (!condition.test(answers)) {
                return false;
            }
        }
        return true;
    }

    private void applyDirective(AutoPopulateDirective directive,
                                Object answer,
                                Map<String, ?> answers,
                                RuleProcessResult result) {
        try {
            resolve(directive, answer, answers).ifPresent(value -> {
                result.getAutoPopulated().put(directive.getTargetField(), value);
                log.debug("Auto-populated {} = {}", directive.getTargetField(), value);
            });
        } catch (RuntimeException e) {
            log.warn("Auto-population of {} failed: {}", directive.getTargetField(), e.getMessage());
            result.getValidationErrors().add("Failed to auto-populate " + directive.getTargetField()
                    + ": " + e.getMessage());
        }
    }

    Optional<Object> resolve(AutoPopulateDirective directive, Object answer, Map<String, ?> answers) {
        switch (directive.getSource()) {
            case STATIC:
                return Optional.ofNullable(directive.getValue());
            case LOOKUP:
                return lookup(directive.getLookupTable(), answer);
            case CALCULATION:
                return Optional.of(formulaEvaluator.evaluate(directive.getFormula(), answers));
            default:
                return Optional.empty();
        }
    }

    /**
     * Exact key match on a scalar answer first, then the first table key
     * (in table order) that the answer text contains, ignoring case. Whole
     * numbers match without a fraction ({@code 5.0} finds key {@code "5"}).
     */
    Optional<Object> lookup(String tableName, Object answer) {
        Optional<Map<String, Object>> table = registry.getLookupTable(tableName);
        if (table.isEmpty() || answer == null) {
            return Optional.empty();
        }

        if (!(answer instanceof Collection) && !(answer instanceof Map)) {
            Object exact = table.get().get(TemplateInterpolator.format(answer));
            if (exact != null) {
                return Optional.of(exact);
            }
        }

        String text = TemplateInterpolator.format(answer).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Object> entry : table.get().entrySet()) {
            if (text.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private void collectAgent(AgentTrigger trigger, Map<String, ?> answers, RuleProcessResult result) {
        try {
            if (trigger.getGuard() != null && !predicateEvaluator.test(trigger.getGuard(), answers)) {
                log.debug("Guard {} blocked agent {}", trigger.getGuard(), trigger.getAgentId());
                return;
            }
            String prompt = interpolator.interpolate(trigger.getPromptTemplate(), answers);
            result.getAgentsToTrigger().add(new AgentInvocation(trigger.getAgentId(), prompt));
        } catch (RuntimeException e) {
            log.warn("Agent trigger {} failed: {}", trigger.getAgentId(), e.getMessage());
            result.getValidationErrors().add("Failed to queue agent " + trigger.getAgentId() + ": " + e.getMessage());
        }
    }

    private void collectSkill(SkillTrigger trigger, Object answer, Map<String, ?> answers, RuleProcessResult result) {
        try {
            SkillParamBuilder builder = paramBuilders.get(trigger.getParamsBuilder());
            if (builder == null) {
                throw new IllegalStateException("No params builder named " + trigger.getParamsBuilder());
            }
            result.getSkillsToExecute().add(new SkillInvocation(trigger.getSkillId(), builder.build(answer, answers)));
        } catch (RuntimeException e) {
            log.warn("Skill trigger {} failed: {}", trigger.getSkillId(), e.getMessage());
            result.getValidationErrors().add("Failed to queue skill " + trigger.getSkillId() + ": " + e.getMessage());
        }
    }

    public List<String> getTriggerFields() {
        return List.copyOf(registry.getTriggerFields());
    }
}
