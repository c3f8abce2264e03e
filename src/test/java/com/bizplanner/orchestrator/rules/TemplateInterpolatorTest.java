package com.bizplanner.orchestrator.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Template Interpolator Tests")
class TemplateInterpolatorTest {

    private final TemplateInterpolator interpolator = new TemplateInterpolator();

    @Test
    @DisplayName("Replaces known fields and keeps unknown placeholders")
    void keepsMissingPlaceholders() {
        // When
        String result = interpolator.interpolate("LTV {{ltv}}, churn {{churn_rate}}", Map.of("ltv", 150000));

        // Then
        assertThat(result).isEqualTo("LTV 150000, churn {{churn_rate}}");
    }

    @Test
    @DisplayName("Joins lists with commas and prints whole doubles without a fraction")
    void formatsValues() {
        Map<String, Object> context = Map.of("industries", List.of("SaaS", "Retail"), "ratio", 3.0);

        assertThat(interpolator.interpolate("{{industries}} at {{ ratio }}", context)).isEqualTo("SaaS,Retail at 3");
    }

    @Test
    @DisplayName("Values containing dollar signs are inserted literally")
    void literalReplacement() {
        assertThat(interpolator.interpolate("Budget {{budget}}", Map.of("budget", "$5k"))).isEqualTo("Budget $5k");
    }
}
