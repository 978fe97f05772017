package com.brados.backend.common.error;

/** Progression profile bounds are unusable (rep range inverted, non-positive increment...). */
public class InvalidProfileException extends ValidationException {

    public InvalidProfileException(String message) {
        super("INVALID_PROFILE", message);
    }
}
