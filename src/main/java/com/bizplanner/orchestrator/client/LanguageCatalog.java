package com.bizplanner.orchestrator.client;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Supported conversation languages keyed by locale code, plus the bare
 * language code used for comparisons ("hi-IN" and "hi" are both Hindi).
 */
public final class LanguageCatalog {

    public static final String ENGLISH = "English";

    private static final Map<String, String> NAMES = ImmutableMap.<String, String>builder()
            .put("en-US", ENGLISH)
            .put("hi-IN", "Hindi")
            .put("te-IN", "Telugu")
            .put("ta-IN", "Tamil")
            .put("kn-IN", "Kannada")
            .put("ml-IN", "Malayalam")
            .put("mr-IN", "Marathi")
            .put("bn-IN", "Bengali")
            .put("gu-IN", "Gujarati")
            .build();

    private LanguageCatalog() {
    }

    /**
     * Display name for a locale or bare code; empty for unknown codes.
     */
    public static Optional<String> nameOf(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String name = NAMES.get(code);
        if (name != null) {
            return Optional.of(name);
        }
        String bare = baseCode(code);
        return NAMES.entrySet().stream()
                .filter(entry -> baseCode(entry.getKey()).equals(bare))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * "hi-IN" to "hi"; unknown codes are lower-cased as-is.
     */
    public static String baseCode(String code) {
        int dash = code.indexOf('-');
        return (dash > 0 ? code.substring(0, dash) : code).toLowerCase(Locale.ROOT);
    }

    /**
     * True for a supported language other than English. Unknown codes ("other")
     * are answered in English.
     */
    public static boolean isNonEnglish(String code) {
        return nameOf(code).map(name -> !ENGLISH.equals(name)).orElse(false);
    }

    public static boolean sameLanguage(String first, String second) {
        return first != null && second != null && baseCode(first).equals(baseCode(second));
    }
}
