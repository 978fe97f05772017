package com.brados.backend.common.error;

public class InvalidTransitionException extends ApiException {

    public static final String CODE = "INVALID_TRANSITION";

    private final String from;
    private final String operation;

    public InvalidTransitionException(String entity, Object from, String operation) {
        super(CODE, "Cannot " + operation + " " + entity + " in status " + from);
        this.from = String.valueOf(from);
        this.operation = operation;
    }

    public InvalidTransitionException(String message) {
        super(CODE, message);
        this.from = null;
        this.operation = null;
    }

    public String from() { return from; }
    public String operation() { return operation; }
}
