package com.bizplanner.orchestrator.client;

/**
 * Translates user-facing text. Failures are reported in the result, not thrown.
 */
public interface TranslationService {

    TranslationResult translate(String text, String targetLanguage, String sourceLanguage);
}
