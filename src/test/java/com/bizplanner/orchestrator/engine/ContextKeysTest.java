package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.model.orchestration.NextQuestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Context Key Tests")
class ContextKeysTest {

    @Test
    @DisplayName("Recognizes phase 1 as number, text or label")
    void firstPhase() {
        assertThat(ContextKeys.isFirstPhase(1)).isTrue();
        assertThat(ContextKeys.isFirstPhase(1.0)).isTrue();
        assertThat(ContextKeys.isFirstPhase("1")).isTrue();
        assertThat(ContextKeys.isFirstPhase("Phase 1: Profile")).isTrue();
        assertThat(ContextKeys.isFirstPhase("Phase 10")).isFalse();
        assertThat(ContextKeys.isFirstPhase(2)).isFalse();
        assertThat(ContextKeys.isFirstPhase(null)).isFalse();
    }

    @Test
    @DisplayName("Reads phase numbers from numbers and labels")
    void phaseNumber() {
        assertThat(ContextKeys.phaseNumber(4)).hasValue(4);
        assertThat(ContextKeys.phaseNumber("Phase 6 - GTM")).hasValue(6);
        assertThat(ContextKeys.phaseNumber("market")).isEmpty();
    }

    @Test
    @DisplayName("Language falls back to the language answer")
    void languageFallback() {
        assertThat(ContextKeys.language(Map.of("language", "te-IN"))).hasValue("te-IN");
        assertThat(ContextKeys.language(Map.of("allAnswers", Map.of("language", "hi-IN")))).hasValue("hi-IN");
        assertThat(ContextKeys.language(Map.of("language", " "))).isEmpty();
    }

    @Test
    @DisplayName("Next question may be a map from a JSON request")
    void nextQuestionFromMap() {
        assertThat(ContextKeys.nextQuestion(Map.of("nextQuestion", Map.of("question", "Your budget?"))))
                .hasValue(new NextQuestion("Your budget?", "text"));
        assertThat(ContextKeys.nextQuestion(Map.of("nextQuestion", Map.of("type", "number")))).isEmpty();
    }
}
