package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * User verdict on a reported anomaly.
 */
public enum Verdict {

    FALSE_POSITIVE("false_positive"),
    TRUE_POSITIVE("true_positive");

    private final String id;

    Verdict(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static Verdict fromId(String value) {
        Objects.requireNonNull(value, "Verdict must not be null");
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (Verdict verdict : values()) {
            if (verdict.id.equals(normalised)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown verdict: '" + value
                + "'. Supported: false_positive, true_positive");
    }
}
