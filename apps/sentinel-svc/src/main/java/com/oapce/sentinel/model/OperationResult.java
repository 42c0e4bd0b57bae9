package com.oapce.sentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(boolean success, String message, String error) {

    public static OperationResult ok(String message) {
        return new OperationResult(true, message, null);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, null, error);
    }
}
