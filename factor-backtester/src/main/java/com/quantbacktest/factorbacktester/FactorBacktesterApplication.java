package com.quantbacktest.factorbacktester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the factor backtester service.
 * A single process holding the task store, the polling worker and the REST surface.
 */
@SpringBootApplication
public class FactorBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactorBacktesterApplication.class, args);
    }

}
