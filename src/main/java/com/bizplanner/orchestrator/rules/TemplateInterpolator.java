package com.bizplanner.orchestrator.rules;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces {@code {{field}}} tokens with answer values.
 *
 * <p>A token whose field is absent (or null) stays in the output verbatim.
 * Lists are joined with commas and whole numbers print without a fraction.
 */
public class TemplateInterpolator {

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

    public String interpolate(String template, Map<String, ?> context) {
        if (template == null) {
            return "";
        }
        Matcher matcher = TOKEN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = context.get(matcher.group(1));
            String replacement = value == null ? matcher.group(0) : format(value);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String format(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(TemplateInterpolator::format)
                    .collect(Collectors.joining(","));
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
                return String.valueOf((long) number);
            }
        }
        return String.valueOf(value);
    }
}
