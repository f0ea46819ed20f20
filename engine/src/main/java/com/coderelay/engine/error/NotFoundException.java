package com.coderelay.engine.error;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String kind, Object id) {
        super(kind + " not found: " + id);
    }
}
