package com.z254.agora.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence level attached to a verdict or to a single position.
 */
public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Normalize a free-form confidence label. Anything that is not exactly one of the
     * three levels (ignoring case and surrounding whitespace) becomes {@link #MEDIUM}.
     */
    public static Confidence from(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Confidence confidence : values()) {
            if (confidence.value.equals(normalized)) {
                return confidence;
            }
        }
        return MEDIUM;
    }
}
