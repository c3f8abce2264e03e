package com.bizplanner.orchestrator.rules.params;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Financial Modeling Params Tests")
class FinancialModelingParamBuilderTest {

    private final FinancialModelingParamBuilder builder = new FinancialModelingParamBuilder();

    @Test
    @DisplayName("Parses formatted rupee amounts")
    void parsesAmounts() {
        assertThat(FinancialModelingParamBuilder.parseAmount("₹50,00,000")).isEqualTo(5000000.0);
        assertThat(FinancialModelingParamBuilder.parseAmount(1200)).isEqualTo(1200.0);
        assertThat(FinancialModelingParamBuilder.parseAmount("not sure")).isZero();
    }

    @Test
    @DisplayName("Maps growth bands to rates")
    void growthBands() {
        assertThat(FinancialModelingParamBuilder.growthRate("20-40%")).isEqualTo(0.30);
        assertThat(FinancialModelingParamBuilder.growthRate("100-200%")).isEqualTo(1.50);
        assertThat(FinancialModelingParamBuilder.growthRate(null)).isEqualTo(0.75);
        assertThat(FinancialModelingParamBuilder.growthRate("flat")).isEqualTo(FinancialModelingParamBuilder.DEFAULT_GROWTH_RATE);
    }

    @Test
    @DisplayName("Builds parameters from the answer and earlier answers")
    void buildsParams() {
        // Given
        Map<String, Object> answers = Map.of(
                "target_industries", List.of("Healthcare"),
                "revenue_model", "subscription",
                "growth_rate", "200+%");

        // When
        Map<String, Object> params = builder.build("10,00,000", answers);

        // Then
        assertThat(params)
                .containsEntry("revenue_target", 1000000.0)
                .containsEntry("industry", "Healthcare")
                .containsEntry("business_model", "subscription")
                .containsEntry("growth_rate", 2.0);
    }

    @Test
    @DisplayName("Industry defaults to General")
    void defaultIndustry() {
        assertThat(builder.build(100, Map.of())).containsEntry("industry", "General");
    }
}
