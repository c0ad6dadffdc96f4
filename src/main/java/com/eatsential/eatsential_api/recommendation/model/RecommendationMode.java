package com.eatsential.eatsential_api.recommendation.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum RecommendationMode {

    LLM("llm"),
    BASELINE("baseline");

    private final String value;

    RecommendationMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<RecommendationMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(mode -> mode.value.equals(normalized)).findFirst();
    }
}
