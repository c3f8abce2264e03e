package com.bizplanner.orchestrator.client.impl;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.client.LanguageCatalog;
import com.bizplanner.orchestrator.client.TranslationResult;
import com.bizplanner.orchestrator.client.TranslationService;
import com.bizplanner.orchestrator.model.prompt.PromptTemplate;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Translation through the completion service with the {@code translation} prompt.
 *
 * <p>Same-language and English targets pass through untouched. Errors are
 * returned as a failed result carrying the original text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmTranslationService implements TranslationService {

    static final String PROMPT = "translation";

    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;

    @Override
    public TranslationResult translate(String text, String targetLanguage, String sourceLanguage) {
        if (text == null || text.isBlank()
                || !LanguageCatalog.isNonEnglish(targetLanguage)
                || LanguageCatalog.sameLanguage(targetLanguage, sourceLanguage)) {
            return TranslationResult.passthrough(text, targetLanguage);
        }

        String languageName = LanguageCatalog.nameOf(targetLanguage).orElse(targetLanguage);
        try {
            Map<String, Object> variables = Map.of("language", languageName, "text", text);
            PromptTemplate template = promptLibrary.getTemplate(PROMPT);

            CompletionResponse response = completionService.complete(CompletionRequest.builder()
                    .systemPrompt(promptLibrary.renderSystem(PROMPT, variables))
                    .message(ConversationTurn.user(promptLibrary.renderUser(PROMPT, variables)))
                    .temperature(template.getTemperature())
                    .maxTokens(template.getMaxTokens())
                    .caller("translator")
                    .build());

            if (response.getText() == null || response.getText().isBlank()) {
                return TranslationResult.failed(text, targetLanguage, "Empty translation");
            }
            return TranslationResult.translated(text, response.getText().trim(), targetLanguage);
        } catch (RuntimeException e) {
            log.warn("Translation to {} failed: {}", targetLanguage, e.getMessage());
            return TranslationResult.failed(text, targetLanguage, e.getMessage());
        }
    }
}
