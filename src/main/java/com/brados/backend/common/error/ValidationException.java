package com.brados.backend.common.error;

public class ValidationException extends ApiException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        this(CODE, message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
