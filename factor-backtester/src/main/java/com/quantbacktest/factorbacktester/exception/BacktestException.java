package com.quantbacktest.factorbacktester.exception;

import lombok.Getter;

/**
 * Base class for all backtest failures.
 * Carries a stable error code alongside the human-readable message.
 */
@Getter
public class BacktestException extends RuntimeException {

    private final String errorCode;

    public BacktestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
