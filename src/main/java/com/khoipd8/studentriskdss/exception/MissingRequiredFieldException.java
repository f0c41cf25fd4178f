package com.khoipd8.studentriskdss.exception;

/**
 * A record lacks a field every rule sub-score depends on (G2 or absences).
 */
public class MissingRequiredFieldException extends FieldValidationException {

    public MissingRequiredFieldException(String field) {
        super(field, "Missing required field: " + field);
    }
}
