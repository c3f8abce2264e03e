package com.bizplanner.orchestrator.engine;

import com.google.common.collect.ImmutableMap;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-level structure pulled out of free-text answers.
 *
 * <p>Only a few questions have an extractor; any other answer is recorded as
 * {@code {value, timestamp}}.
 */
@Component
public class AnswerExtractor {

    private static final Map<String, List<String>> IDEA_KEYWORDS = ImmutableMap.<String, List<String>>builder()
            .put("saas", List.of("saas", "software", "platform", "app", "subscription"))
            .put("b2b", List.of("b2b", "business", "enterprise", "companies", "organizations"))
            .put("b2c", List.of("b2c", "consumer", "customer", "people", "individual"))
            .put("ecommerce", List.of("ecommerce", "online store", "selling", "marketplace"))
            .put("ai", List.of("ai", "artificial intelligence", "machine learning", "ml", "automation"))
            .build();

    private static final Map<String, List<String>> MOAT_KEYWORDS = ImmutableMap.<String, List<String>>builder()
            .put("technology", List.of("proprietary", "patent", "algorithm", "technology", "ai", "ml"))
            .put("network", List.of("network", "connections", "relationships", "partnerships"))
            .put("expertise", List.of("experience", "years", "expert", "worked at", "built"))
            .put("data", List.of("data", "insights", "analytics", "information"))
            .put("brand", List.of("brand", "reputation", "trust", "recognition"))
            .build();

    private static final Pattern QUANTIFIED_PAIN =
            Pattern.compile("\\d+%|\\$[\\d,]+|₹[\\d,]+|\\d+\\s*(hours|minutes|days|weeks)");

    private final Clock clock;

    public AnswerExtractor() {
        this(Clock.systemUTC());
    }

    AnswerExtractor(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> extract(String questionId, Object answer) {
        String text = asText(answer);
        switch (questionId == null ? "" : questionId) {
            case "business_idea_detail":
                return extractIdea(text);
            case "customer_problem":
                return extractProblem(text);
            case "unique_advantage":
                return extractAdvantage(text);
            default:
                Map<String, Object> extracted = new LinkedHashMap<>();
                extracted.put("value", answer);
                extracted.put("timestamp", Instant.now(clock).toString());
                return extracted;
        }
    }

    private Map<String, Object> extractIdea(String text) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        extracted.put("raw_idea", text);
        String lower = text.toLowerCase(Locale.ROOT);
        IDEA_KEYWORDS.forEach((key, terms) -> {
            if (terms.stream().anyMatch(lower::contains)) {
                extracted.put("is_" + key, true);
            }
        });
        return extracted;
    }

    private Map<String, Object> extractProblem(String text) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        extracted.put("raw_problem", text);
        extracted.put("has_quantified_pain", false);
        if (QUANTIFIED_PAIN.matcher(text).find()) {
            extracted.put("has_quantified_pain", true);
            extracted.put("pain_urgency", "high");
        }
        return extracted;
    }

    private Map<String, Object> extractAdvantage(String text) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        extracted.put("raw_advantage", text);
        String lower = text.toLowerCase(Locale.ROOT);

        List<String> moats = new ArrayList<>();
        MOAT_KEYWORDS.forEach((type, terms) -> {
            if (terms.stream().anyMatch(lower::contains)) {
                moats.add(type);
            }
        });
        extracted.put("moat_types", moats);
        extracted.put("moat_strength", moats.size() >= 2 ? "strong" : moats.size() == 1 ? "medium" : "weak");
        return extracted;
    }

    static String asText(Object answer) {
        if (answer == null) {
            return "";
        }
        if (answer instanceof Collection) {
            return ((Collection<?>) answer).stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(answer);
    }
}
