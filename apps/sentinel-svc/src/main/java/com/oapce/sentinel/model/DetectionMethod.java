package com.oapce.sentinel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    ISOLATION_FOREST("isolation_forest"),
    SEASONAL_RESIDUAL("seasonal_residual"),
    ROLLING_ZSCORE("rolling_zscore");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static DetectionMethod fromWireName(String value) {
        for (DetectionMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("unknown detection method: " + value);
    }
}
