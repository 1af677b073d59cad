package com.eainde.atlas.workflow;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A natural-language planning request.
 *
 * @param preferences free-form hints appended to the request text, may be empty
 * @param timeout     deadline of the run, null for the configured default
 */
public record PlanRequest(String query, String userId, String sessionId, Map<String, Object> preferences,
                          Duration timeout) {

    public PlanRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        preferences = preferences == null ? Map.of() : new LinkedHashMap<>(preferences);
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static PlanRequest of(String query) {
        return new PlanRequest(query, null, null, Map.of(), null);
    }

    public PlanRequest withTimeout(Duration value) {
        return new PlanRequest(query, userId, sessionId, preferences, value);
    }

    /**
     * @return the text of the opening user message
     */
    public String userMessage() {
        if (preferences.isEmpty()) {
            return query;
        }
        return query + "\n\nPreferences: " + preferences.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
