package com.finops.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Effort and risk rating of a recommendation.
 */
public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
