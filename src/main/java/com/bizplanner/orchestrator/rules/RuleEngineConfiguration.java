package com.bizplanner.orchestrator.rules;

import com.bizplanner.orchestrator.configuration.AppProperties;
import com.bizplanner.orchestrator.flow.PredicateEvaluator;
import com.bizplanner.orchestrator.rules.params.SkillParamBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Configuration
public class RuleEngineConfiguration {

    @Bean
    public FormulaEvaluator formulaEvaluator() {
        return new FormulaEvaluator();
    }

    @Bean
    public TriggerRuleRegistry triggerRuleRegistry(AppProperties appProperties,
                                                   List<SkillParamBuilder> paramBuilders,
                                                   FormulaEvaluator formulaEvaluator) {
        return TriggerRuleRegistry.load(
                appProperties.getDefinitions().getTriggerRules(),
                appProperties.getDefinitions().getLookupTables(),
                paramBuilders.stream().map(SkillParamBuilder::getName).collect(Collectors.toSet()),
                formulaEvaluator);
    }

    @Bean
    public RuleTriggerEngine ruleTriggerEngine(TriggerRuleRegistry registry,
                                               List<SkillParamBuilder> paramBuilders,
                                               FormulaEvaluator formulaEvaluator) {
        Map<String, SkillParamBuilder> byName = paramBuilders.stream()
                .collect(Collectors.toMap(SkillParamBuilder::getName, Function.identity()));
        return new RuleTriggerEngine(registry, byName, new PredicateEvaluator(),
                formulaEvaluator, new TemplateInterpolator());
    }
}
