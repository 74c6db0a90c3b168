package io.limitgraph.model;

import java.util.Locale;

public enum ReviewDecision {
    APPROVE,
    REJECT;

    public static ReviewDecision fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("review decision cannot be empty");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
