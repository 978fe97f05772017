package com.brados.backend.common.error;

import java.util.Locale;

public class NotFoundException extends ApiException {

    private final String entity;

    public NotFoundException(String entity, Object id) {
        super(entity.toUpperCase(Locale.ROOT) + "_NOT_FOUND", entity + " with id " + id + " not found");
        this.entity = entity;
    }

    public NotFoundException(String entity, String code, String message) {
        super(code, message);
        this.entity = entity;
    }

    public String entity() { return entity; }
}
