package com.khoipd8.studentriskdss.exception;

/**
 * Base exception for risk assessment errors
 */
public class RiskDssException extends RuntimeException {

    public RiskDssException(String message) {
        super(message);
    }

    public RiskDssException(String message, Throwable cause) {
        super(message, cause);
    }
}
