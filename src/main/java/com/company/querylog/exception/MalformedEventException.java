package com.company.querylog.exception;

/**
 * An incoming query event has a missing or unparsable field. Only that event is rejected.
 */
public class MalformedEventException extends RuntimeException {

    private final String field;

    public MalformedEventException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public MalformedEventException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
