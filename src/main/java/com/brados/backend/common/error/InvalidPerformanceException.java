package com.brados.backend.common.error;

/** Previous-week performance does not belong to the week right before the one being computed. */
public class InvalidPerformanceException extends ValidationException {

    public InvalidPerformanceException(String message) {
        super("INVALID_PERFORMANCE", message);
    }
}
