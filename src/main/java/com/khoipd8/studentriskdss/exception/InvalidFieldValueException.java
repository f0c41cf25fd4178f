package com.khoipd8.studentriskdss.exception;

public class InvalidFieldValueException extends FieldValidationException {

    public InvalidFieldValueException(String field, Object value) {
        super(field, "Invalid value for field " + field + ": '" + value + "'");
    }
}
