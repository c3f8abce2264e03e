package com.bizplanner.orchestrator.rules.params;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CompetitorAnalysisParamBuilder implements SkillParamBuilder {

    @Override
    public String getName() {
        return "competitor_analysis";
    }

    @Override
    public Map<String, Object> build(Object answer, Map<String, ?> answers) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("competitors", ParamBuilderSupport.asList(answer));
        params.put("industry", ParamBuilderSupport.primaryIndustry(answers));
        params.put("geography", ParamBuilderSupport.orDefault(answers, "primary_market", "India"));
        Object business = answers.get("business_idea_detail");
        params.put("your_business", ParamBuilderSupport.isBlank(business) ? answers.get("customer_problem") : business);
        return params;
    }
}
