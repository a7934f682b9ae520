package com.quantbacktest.factorbacktester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest task metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter tasksSubmittedCounter;
    private final Counter tasksCompletedCounter;
    private final Counter tasksFailedCounter;
    private final Counter tasksCancelledCounter;
    private final Counter tasksRequeuedCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.tasksSubmittedCounter = Counter.builder("backtest.tasks.submitted")
                .description("Total number of backtest tasks submitted")
                .register(meterRegistry);

        this.tasksCompletedCounter = Counter.builder("backtest.tasks.completed")
                .description("Total number of backtest tasks completed successfully")
                .register(meterRegistry);

        this.tasksFailedCounter = Counter.builder("backtest.tasks.failed")
                .description("Total number of backtest tasks failed")
                .register(meterRegistry);

        this.tasksCancelledCounter = Counter.builder("backtest.tasks.cancelled")
                .description("Total number of backtest tasks cancelled")
                .register(meterRegistry);

        this.tasksRequeuedCounter = Counter.builder("backtest.tasks.requeued")
                .description("Total number of backtest tasks requeued")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest task execution time")
                .register(meterRegistry);
    }

    public void recordTaskSubmitted() {
        tasksSubmittedCounter.increment();
    }

    /**
     * Record a successful completion with execution time.
     */
    public void recordTaskCompleted(long executionTimeMs) {
        tasksCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordTaskFailed() {
        tasksFailedCounter.increment();
    }

    public void recordTaskCancelled() {
        tasksCancelledCounter.increment();
    }

    public void recordTaskRequeued() {
        tasksRequeuedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Submitted=%d, Completed=%d, Failed=%d, Cancelled=%d, AvgExecTime=%.2fs",
                (long) tasksSubmittedCounter.count(),
                (long) tasksCompletedCounter.count(),
                (long) tasksFailedCounter.count(),
                (long) tasksCancelledCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
