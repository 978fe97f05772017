package com.brados.backend.common.error;

public class ConflictException extends ApiException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message) {
        super(CODE, message);
    }
}
