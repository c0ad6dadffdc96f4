package com.eatsential.eatsential_api.feedback.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum FeedbackType {

    LIKE("like"),
    DISLIKE("dislike");

    private final String value;

    FeedbackType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<FeedbackType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
    }
}
