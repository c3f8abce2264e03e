package com.bizplanner.orchestrator.rules.params;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ComplianceCheckParamBuilder implements SkillParamBuilder {

    @Override
    public String getName() {
        return "compliance_check";
    }

    @Override
    public Map<String, Object> build(Object answer, Map<String, ?> answers) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("industry", ParamBuilderSupport.primaryIndustry(answers));
        params.put("geography", ParamBuilderSupport.orDefault(answers, "primary_market", "India"));
        params.put("business_type", ParamBuilderSupport.orDefault(answers, "customer_type", "B2C"));
        params.put("licenses", ParamBuilderSupport.asList(answer));
        params.put("regulations", ParamBuilderSupport.orDefault(answers, "regulations", List.of()));
        return params;
    }
}
