package com.bizplanner.orchestrator.client;

public record TranslationResult(String originalText,
                                String translatedText,
                                String targetLanguage,
                                boolean success,
                                String error) {

    public static TranslationResult passthrough(String text, String targetLanguage) {
        return new TranslationResult(text, text, targetLanguage, true, null);
    }

    public static TranslationResult translated(String original, String translated, String targetLanguage) {
        return new TranslationResult(original, translated, targetLanguage, true, null);
    }

    public static TranslationResult failed(String text, String targetLanguage, String error) {
        return new TranslationResult(text, text, targetLanguage, false, error);
    }
}
