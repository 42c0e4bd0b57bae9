package com.oapce.sentinel.alert;

public class AlertNotFoundException extends RuntimeException {

    private final long alertId;

    public AlertNotFoundException(long alertId) {
        super("Alert " + alertId + " not found");
        this.alertId = alertId;
    }

    public long alertId() {
        return alertId;
    }
}
