package com.bizplanner.orchestrator.rules.params;

import java.util.List;
import java.util.Map;

final class ParamBuilderSupport {

    private ParamBuilderSupport() {
    }

    /**
     * First selected industry, the raw value when it is not a list, or "General".
     */
    static Object primaryIndustry(Map<String, ?> answers) {
        Object industries = answers.get("target_industries");
        if (industries instanceof List) {
            List<?> list = (List<?>) industries;
            return list.isEmpty() ? "General" : list.get(0);
        }
        return isBlank(industries) ? "General" : industries;
    }

    static Object orDefault(Map<String, ?> answers, String field, Object fallback) {
        Object value = answers.get(field);
        return isBlank(value) ? fallback : value;
    }

    static List<?> asList(Object value) {
        if (value instanceof List) {
            return (List<?>) value;
        }
        return value == null ? List.of() : List.of(value);
    }

    static boolean isBlank(Object value) {
        return value == null || "".equals(value);
    }
}
