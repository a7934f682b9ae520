package com.quantbacktest.factorbacktester.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executor for the background polling worker.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "workerExecutorService")
    public ExecutorService workerExecutorService() {
        return Executors.newSingleThreadExecutor(
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("TaskPollingWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
