package com.bizplanner.orchestrator.rules.params;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class MarketSizingParamBuilder implements SkillParamBuilder {

    @Override
    public String getName() {
        return "market_sizing";
    }

    @Override
    public Map<String, Object> build(Object answer, Map<String, ?> answers) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("industry", ParamBuilderSupport.primaryIndustry(answers));
        params.put("geography", ParamBuilderSupport.orDefault(answers, "primary_market", "India"));
        params.put("business_model", answer);
        return params;
    }
}
