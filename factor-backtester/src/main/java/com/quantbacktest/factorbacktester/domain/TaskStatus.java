package com.quantbacktest.factorbacktester.domain;

import com.quantbacktest.factorbacktester.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a backtest task.
 * The transition table below is the only place that decides which moves are legal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(RUNNING, CANCELLED));
        TRANSITIONS.put(RUNNING, EnumSet.of(COMPLETED, FAILED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
        TRANSITIONS.put(CANCELLED, EnumSet.of(PENDING));
    }

    public Set<TaskStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(TaskStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /**
     * @throws InvalidTransitionException if {@code target} is not reachable from this status
     */
    public void checkTransition(TaskStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(this, target);
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
