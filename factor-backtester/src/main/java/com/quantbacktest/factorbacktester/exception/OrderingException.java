package com.quantbacktest.factorbacktester.exception;

/**
 * Timeline violated: a timestamp did not advance, or data dated after the
 * simulated day reached the replay. Always fatal to the task.
 */
public class OrderingException extends BacktestException {

    public OrderingException(String message) {
        super("ORDERING_ERROR", message);
    }
}
