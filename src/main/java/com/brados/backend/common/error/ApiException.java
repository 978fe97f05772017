package com.brados.backend.common.error;

/**
 * Base of the rejections raised by the lifting core. Every rejection leaves the
 * entity it was aimed at unchanged; {@link #code()} is the stable string the
 * advice puts into {@code errorCode}.
 */
public abstract class ApiException extends RuntimeException {

    private final String code;

    protected ApiException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() { return code; }
}
