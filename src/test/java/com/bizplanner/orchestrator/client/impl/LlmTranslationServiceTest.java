package com.bizplanner.orchestrator.client.impl;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.TranslationResult;
import com.bizplanner.orchestrator.configuration.AppProperties;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("LLM Translation Service Tests")
class LlmTranslationServiceTest {

    private CompletionService completionService;
    private LlmTranslationService translationService;

    @BeforeEach
    void setUp() {
        completionService = mock(CompletionService.class);
        PromptLibraryService prompts = new PromptLibraryService(new AppProperties());
        prompts.loadPrompts();
        translationService = new LlmTranslationService(completionService, prompts);
    }

    @Test
    @DisplayName("English and same-language targets pass through")
    void passthrough() {
        assertThat(translationService.translate("Hello", "en-US", "en-US").translatedText()).isEqualTo("Hello");
        assertThat(translationService.translate("नमस्ते", "hi-IN", "hi").translatedText()).isEqualTo("नमस्ते");
        verify(completionService, never()).complete(any());
    }

    @Test
    @DisplayName("Translates with the target language in the prompt")
    void translates() {
        // Given
        when(completionService.complete(any())).thenReturn(CompletionResponse.text(" ధన్యవాదాలు "));

        // When
        TranslationResult result = translationService.translate("Thank you", "te-IN", "en-US");

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.translatedText()).isEqualTo("ధన్యవాదాలు");
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionService).complete(captor.capture());
        assertThat(captor.getValue().getSystemPrompt()).contains("into Telugu");
        assertThat(captor.getValue().getMessages().get(0).getText()).contains("Thank you");
    }

    @Test
    @DisplayName("Completion failures return the original text as a failed result")
    void failure() {
        when(completionService.complete(any())).thenThrow(new IllegalStateException("model offline"));

        TranslationResult result = translationService.translate("Thank you", "ta-IN", "en-US");

        assertThat(result.success()).isFalse();
        assertThat(result.translatedText()).isEqualTo("Thank you");
        assertThat(result.error()).isEqualTo("model offline");
    }
}
