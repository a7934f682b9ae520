package com.quantbacktest.factorbacktester.exception;

import com.quantbacktest.factorbacktester.domain.TaskStatus;
import lombok.Getter;

/**
 * Raised when a task status change is not allowed by the transition table.
 */
@Getter
public class InvalidTransitionException extends BacktestException {

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(TaskStatus from, TaskStatus to) {
        super("INVALID_TRANSITION", "Illegal status transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }
}
