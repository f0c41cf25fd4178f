package com.khoipd8.studentriskdss.exception;

/**
 * A single field of a student record cannot be used for scoring.
 */
public abstract class FieldValidationException extends RiskDssException {

    private final String field;

    protected FieldValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
