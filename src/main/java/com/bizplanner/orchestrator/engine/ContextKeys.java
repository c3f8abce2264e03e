package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.model.orchestration.NextQuestion;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Well-known keys of the orchestration context map and typed readers for them.
 *
 * <p>The context is a plain map because agents receive it verbatim as JSON and
 * sequential execution adds {@code <agent_id>_output} entries to it.
 */
public final class ContextKeys {

    public static final String CURRENT_PHASE = "currentPhase";
    public static final String PHASE_ID = "phaseId";
    public static final String ALL_ANSWERS = "allAnswers";
    public static final String LANGUAGE = "language";
    public static final String USER_NAME = "userName";
    public static final String BUSINESS_PATH = "businessPath";
    public static final String CUSTOMER_TYPE = "customerType";
    public static final String BUSINESS_MODEL_TYPE = "businessModelType";
    public static final String RISK_TOLERANCE = "riskTolerance";
    public static final String REQUEST_TYPE = "requestType";
    public static final String NEXT_QUESTION = "nextQuestion";
    public static final String QUESTION_ID = "questionId";
    public static final String QUESTION_TEXT = "questionText";

    public static final String OUTPUT_SUFFIX = "_output";

    private static final Pattern PHASE_LABEL = Pattern.compile("Phase (\\d+)");
    private static final Pattern FIRST_PHASE_LABEL = Pattern.compile("Phase 1(?!\\d)");

    private ContextKeys() {
    }

    /**
     * Phase number from a numeric value or a {@code "Phase N"} label.
     */
    public static OptionalInt phaseNumber(Object raw) {
        if (raw instanceof Number) {
            return OptionalInt.of(((Number) raw).intValue());
        }
        if (raw instanceof String) {
            Matcher matcher = PHASE_LABEL.matcher((String) raw);
            if (matcher.find()) {
                try {
                    return OptionalInt.of(Integer.parseInt(matcher.group(1)));
                } catch (NumberFormatException e) {
                    return OptionalInt.empty();
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * True for phase 1 given as a number, as {@code "1"}, or as a {@code "Phase 1..."} label.
     */
    public static boolean isFirstPhase(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue() == 1.0;
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            return text.equals("1") || FIRST_PHASE_LABEL.matcher(text).find();
        }
        return false;
    }

    /**
     * Target language from the context, or from the {@code language} answer.
     */
    public static Optional<String> language(Map<String, ?> context) {
        if (context == null) {
            return Optional.empty();
        }
        Object language = context.get(LANGUAGE);
        if (language == null && context.get(ALL_ANSWERS) instanceof Map) {
            language = ((Map<?, ?>) context.get(ALL_ANSWERS)).get(LANGUAGE);
        }
        return language == null || String.valueOf(language).isBlank()
                ? Optional.empty()
                : Optional.of(String.valueOf(language));
    }

    public static Optional<NextQuestion> nextQuestion(Map<String, ?> context) {
        Object value = context == null ? null : context.get(NEXT_QUESTION);
        if (value instanceof NextQuestion) {
            return Optional.of((NextQuestion) value);
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Object question = map.get("question");
            if (question != null) {
                Object type = map.get("type");
                return Optional.of(new NextQuestion(String.valueOf(question), type == null ? "text" : String.valueOf(type)));
            }
        }
        return Optional.empty();
    }

    public static boolean isSuggestionRequest(Map<String, ?> context) {
        return context != null && "suggestion".equals(context.get(REQUEST_TYPE));
    }
}
