package com.oapce.sentinel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Ordinal urgency of an anomaly. Declaration order is the severity order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity must be provided");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
