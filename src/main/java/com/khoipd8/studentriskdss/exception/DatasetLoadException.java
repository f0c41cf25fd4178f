package com.khoipd8.studentriskdss.exception;

public class DatasetLoadException extends RiskDssException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
