package com.animerec.recommendation;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum RecommendationMode {
    COLLABORATIVE("collaborative"),
    CONTENT("content"),
    HYBRID("hybrid");

    private final String value;

    RecommendationMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RecommendationMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) return HYBRID;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported recommendation mode: " + raw + " (expected one of "
                        + Arrays.stream(values()).map(RecommendationMode::value).collect(Collectors.joining(", ")) + ")"));
    }
}
