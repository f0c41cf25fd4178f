package com.khoipd8.studentriskdss.exception;

public class ModelPersistenceException extends RiskDssException {

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
