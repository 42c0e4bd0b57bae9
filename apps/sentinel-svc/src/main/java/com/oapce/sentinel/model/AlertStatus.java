package com.oapce.sentinel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * Status after an acknowledgement. A resolved alert stays resolved.
     */
    public AlertStatus acknowledge() {
        return this == RESOLVED ? RESOLVED : ACKNOWLEDGED;
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must be provided");
        }
        return AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
