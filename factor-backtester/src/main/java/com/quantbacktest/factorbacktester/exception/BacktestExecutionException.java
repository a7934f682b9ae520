package com.quantbacktest.factorbacktester.exception;

/**
 * Unexpected failure inside the replay, scoring or simulation pipeline.
 */
public class BacktestExecutionException extends BacktestException {

    public BacktestExecutionException(String message, Throwable cause) {
        super("EXECUTION_ERROR", message, cause);
    }
}
