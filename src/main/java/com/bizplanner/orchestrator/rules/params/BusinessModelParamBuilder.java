package com.bizplanner.orchestrator.rules.params;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final document generation gets the whole answer set plus output preferences.
 */
@Component
public class BusinessModelParamBuilder implements SkillParamBuilder {

    @Override
    public String getName() {
        return "business_model";
    }

    @Override
    public Map<String, Object> build(Object answer, Map<String, ?> answers) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("all_responses", new LinkedHashMap<>(answers));
        params.put("output_formats", ParamBuilderSupport.orDefault(answers, "output_formats", List.of("pdf")));
        params.put("detail_level", ParamBuilderSupport.orDefault(answers, "detail_level", "standard"));
        params.put("include_ai_recommendations", "yes_include".equals(answers.get("ai_recommendations")));
        return params;
    }
}
