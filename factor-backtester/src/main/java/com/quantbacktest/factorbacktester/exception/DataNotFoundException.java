package com.quantbacktest.factorbacktester.exception;

/**
 * Required market or factor data is missing.
 */
public class DataNotFoundException extends BacktestException {

    public DataNotFoundException(String message) {
        super("DATA_NOT_FOUND", message);
    }
}
