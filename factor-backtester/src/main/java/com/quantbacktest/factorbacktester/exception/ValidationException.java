package com.quantbacktest.factorbacktester.exception;

/**
 * Rejected task or configuration parameters. A task failing validation is never persisted.
 */
public class ValidationException extends BacktestException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
