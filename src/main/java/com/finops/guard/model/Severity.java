package com.finops.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    MEDIUM,
    HIGH;

    /**
     * HIGH once the score clears the configured threshold by a full standard deviation.
     */
    public static Severity classify(double score, double zscoreThreshold) {
        return score >= zscoreThreshold + 1.0 ? HIGH : MEDIUM;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
