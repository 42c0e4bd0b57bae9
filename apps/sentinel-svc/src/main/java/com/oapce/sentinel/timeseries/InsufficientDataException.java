package com.oapce.sentinel.timeseries;

/**
 * Raised when a metric has too few distinct days of history to run detection on.
 */
public class InsufficientDataException extends RuntimeException {

    private final int distinctDays;
    private final int requiredDays;

    public InsufficientDataException(int distinctDays, int requiredDays) {
        super("insufficient data: " + distinctDays + " distinct days, at least " + requiredDays + " required");
        this.distinctDays = distinctDays;
        this.requiredDays = requiredDays;
    }

    public int distinctDays() {
        return distinctDays;
    }

    public int requiredDays() {
        return requiredDays;
    }
}
