package com.quantbacktest.factorbacktester.exception;

/**
 * Thrown between snapshot steps once a cancellation request has been observed.
 */
public class TaskCancelledException extends BacktestException {

    public TaskCancelledException(String taskId) {
        super("TASK_CANCELLED", "Task " + taskId + " cancelled on request");
    }
}
