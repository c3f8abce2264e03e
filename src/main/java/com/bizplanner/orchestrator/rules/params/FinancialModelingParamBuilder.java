package com.bizplanner.orchestrator.rules.params;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters for the financial model: revenue target as a number and the
 * growth-rate band mapped to a multiplier.
 */
@Component
public class FinancialModelingParamBuilder implements SkillParamBuilder {

    static final double DEFAULT_GROWTH_RATE = 0.75;

    @Override
    public String getName() {
        return "financial_modeling";
    }

    @Override
    public Map<String, Object> build(Object answer, Map<String, ?> answers) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("revenue_target", parseAmount(answer));
        params.put("industry", ParamBuilderSupport.primaryIndustry(answers));
        params.put("business_model", answers.get("revenue_model"));
        params.put("growth_rate", growthRate(answers.get("growth_rate")));
        return params;
    }

    /**
     * Numbers pass through; text keeps only digits and dots ("₹50,00,000" is 5000000).
     * Anything unparseable is 0.
     */
    static double parseAmount(Object answer) {
        if (answer instanceof Number) {
            return ((Number) answer).doubleValue();
        }
        String digits = String.valueOf(answer).replaceAll("[^0-9.]", "");
        try {
            return digits.isEmpty() ? 0 : Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static double growthRate(Object band) {
        String text = band == null ? "50-100" : String.valueOf(band);
        double rate = DEFAULT_GROWTH_RATE;
        if (text.contains("20-40")) {
            rate = 0.30;
        }
        if (text.contains("50-100")) {
            rate = 0.75;
        }
        if (text.contains("100-200")) {
            rate = 1.50;
        }
        if (text.contains("200+")) {
            rate = 2.00;
        }
        return rate;
    }
}
