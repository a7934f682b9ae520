package com.quantbacktest.factorbacktester.infrastructure;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.service.TaskOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of the polling worker.
 * Starts it on application startup and gracefully shuts it down.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PollingWorkerManager {

    private final ExecutorService workerExecutorService;
    private final TaskOrchestrator taskOrchestrator;
    private final BacktestProperties properties;

    private TaskPollingWorker worker;

    @PostConstruct
    public void startWorker() {
        BacktestProperties.Scheduler scheduler = properties.getScheduler();
        if (!scheduler.isEnabled()) {
            log.info("Task polling is disabled");
            return;
        }

        worker = new TaskPollingWorker(taskOrchestrator, scheduler.getPollInterval(),
                scheduler.getErrorBackoff(), "TaskPollingWorker");
        workerExecutorService.submit(worker);

        log.info("Started task polling worker (interval {}, batch size {})",
                scheduler.getPollInterval(), scheduler.getBatchSize());
    }

    @PreDestroy
    public void stopWorker() {
        log.info("Stopping polling worker...");

        if (worker != null) {
            worker.stop();
        }

        workerExecutorService.shutdown();

        try {
            if (!workerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker did not terminate gracefully, forcing shutdown");
                workerExecutorService.shutdownNow();
            } else {
                log.info("Polling worker stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for worker to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    boolean isStarted() {
        return worker != null;
    }
}
