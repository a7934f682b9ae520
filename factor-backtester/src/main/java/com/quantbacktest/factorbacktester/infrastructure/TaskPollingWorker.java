package com.quantbacktest.factorbacktester.infrastructure;

import com.quantbacktest.factorbacktester.service.TaskOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Background worker that runs one scheduler tick, then sleeps for the poll interval.
 * Errors escaping a tick are logged and followed by a short backoff.
 */
@RequiredArgsConstructor
@Slf4j
public class TaskPollingWorker implements Runnable {

    private final TaskOrchestrator taskOrchestrator;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final String workerName;

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started, polling every {}", workerName, pollInterval);

        while (running) {
            try {
                taskOrchestrator.pollAndDispatch();
                sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted", workerName);
                break;
            } catch (Exception e) {
                log.error("{} encountered error while polling tasks: {}", workerName, e.getMessage(), e);

                try {
                    sleep(errorBackoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    private void sleep(Duration duration) throws InterruptedException {
        long remaining = duration.toMillis();
        // Sleep in short slices so stop() takes effect without waiting out a long interval
        while (running && remaining > 0) {
            long slice = Math.min(remaining, 100);
            Thread.sleep(slice);
            remaining -= slice;
        }
    }

    /**
     * Gracefully stop the worker after the current tick.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
