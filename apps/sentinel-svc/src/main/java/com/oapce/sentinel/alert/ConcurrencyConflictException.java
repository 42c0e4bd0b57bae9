package com.oapce.sentinel.alert;

/**
 * A concurrent writer changed an alert between our read and our write.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
