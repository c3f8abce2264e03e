package com.bizplanner.orchestrator.rules;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.bizplanner.orchestrator.exception.FormulaEvaluationException;
import com.bizplanner.orchestrator.model.rules.AgentTrigger;
import com.bizplanner.orchestrator.model.rules.AutoPopulateDirective;
import com.bizplanner.orchestrator.model.rules.LookupTablesDefinition;
import com.bizplanner.orchestrator.model.rules.SkillTrigger;
import com.bizplanner.orchestrator.model.rules.TriggerCondition;
import com.bizplanner.orchestrator.model.rules.TriggerRule;
import com.bizplanner.orchestrator.model.rules.TriggerRuleDefinition;
import com.bizplanner.orchestrator.model.rules.TriggerRulesDefinition;
import com.bizplanner.orchestrator.util.YamlDefinitionReader;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only trigger rules keyed by trigger field, plus the lookup tables they use.
 *
 * <p>Everything is validated while loading: condition operators, lookup table
 * references, formula syntax and parameter-builder names. A definition error
 * stops start-up instead of surfacing on the first matching answer.
 *
 * @since 2.0.0
 */
@Slf4j
public class TriggerRuleRegistry {

    private final ImmutableListMultimap<String, TriggerRule> rules;
    private final ImmutableMap<String, Map<String, Object>> lookupTables;

    public TriggerRuleRegistry(List<TriggerRule> rules, Map<String, ? extends Map<String, Object>> lookupTables) {
        ImmutableListMultimap.Builder<String, TriggerRule> byField = ImmutableListMultimap.builder();
        rules.forEach(rule -> byField.put(rule.getTriggerField(), rule));
        this.rules = byField.build();

        ImmutableMap.Builder<String, Map<String, Object>> tables = ImmutableMap.builder();
        lookupTables.forEach((name, table) ->
                tables.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(table))));
        this.lookupTables = tables.build();
    }

    public static TriggerRuleRegistry load(String rulesLocation,
                                           String lookupLocation,
                                           Set<String> paramBuilderNames,
                                           FormulaEvaluator formulaEvaluator) {
        TriggerRulesDefinition rulesDefinition = YamlDefinitionReader.read(rulesLocation, TriggerRulesDefinition.class);
        LookupTablesDefinition tablesDefinition = YamlDefinitionReader.read(lookupLocation, LookupTablesDefinition.class);

        List<TriggerRule> rules = rulesDefinition.getRules().stream()
                .map(definition -> toRule(definition, tablesDefinition.getTables().keySet(),
                        paramBuilderNames, formulaEvaluator))
                .collect(Collectors.toList());

        TriggerRuleRegistry registry = new TriggerRuleRegistry(rules, tablesDefinition.getTables());
        log.info("Loaded {} trigger rules over {} fields, {} lookup tables",
                rules.size(), registry.getTriggerFields().size(), registry.lookupTables.size());
        return registry;
    }

    static TriggerRule toRule(TriggerRuleDefinition definition,
                              Set<String> tableNames,
                              Set<String> paramBuilderNames,
                              FormulaEvaluator formulaEvaluator) {
        String field = definition.getTriggerField();
        if (field == null || field.isBlank()) {
            throw new DefinitionLoadException("Trigger rule without triggerField");
        }

        List<TriggerCondition> conditions = definition.getConditions().stream()
                .map(TriggerCondition::from)
                .collect(ImmutableList.toImmutableList());

        for (AutoPopulateDirective directive : definition.getAutoPopulate()) {
            validateDirective(field, directive, tableNames, formulaEvaluator);
        }
        for (AgentTrigger trigger : definition.getTriggerAgents()) {
            if (trigger.getAgentId() == null || trigger.getPromptTemplate() == null) {
                throw new DefinitionLoadException("Agent trigger on " + field + " needs agentId and promptTemplate");
            }
        }
        for (SkillTrigger trigger : definition.getTriggerSkills()) {
            if (!paramBuilderNames.contains(trigger.getParamsBuilder())) {
                throw new DefinitionLoadException("Skill trigger " + trigger.getSkillId() + " on " + field
                        + " uses unknown params builder: " + trigger.getParamsBuilder());
            }
        }

        return TriggerRule.builder()
                .triggerField(field)
                .conditions(conditions)
                .autoPopulate(ImmutableList.copyOf(definition.getAutoPopulate()))
                .triggerAgents(ImmutableList.copyOf(definition.getTriggerAgents()))
                .triggerSkills(ImmutableList.copyOf(definition.getTriggerSkills()))
                .build();
    }

    private static void validateDirective(String field,
                                          AutoPopulateDirective directive,
                                          Set<String> tableNames,
                                          FormulaEvaluator formulaEvaluator) {
        if (directive.getTargetField() == null || directive.getSource() == null) {
            throw new DefinitionLoadException("Auto-populate directive on " + field + " needs targetField and source");
        }
        switch (directive.getSource()) {
            case LOOKUP:
                if (!tableNames.contains(directive.getLookupTable())) {
                    throw new DefinitionLoadException("Directive " + directive.getTargetField()
                            + " references unknown lookup table: " + directive.getLookupTable());
                }
                break;
            case CALCULATION:
                try {
                    formulaEvaluator.validate(directive.getFormula());
                } catch (FormulaEvaluationException e) {
                    throw new DefinitionLoadException("Directive " + directive.getTargetField()
                            + " has an invalid formula: " + e.getMessage(), e);
                }
                break;
            default:
                break;
        }
    }

    /**
     * Rules for a field in registration order; empty when none.
     */
    public List<TriggerRule> getRules(String triggerField) {
        return rules.get(triggerField);
    }

    public Set<String> getTriggerFields() {
        return rules.keySet();
    }

    public Optional<Map<String, Object>> getLookupTable(String name) {
        return Optional.ofNullable(lookupTables.get(name));
    }

    public int size() {
        return rules.size();
    }
}
