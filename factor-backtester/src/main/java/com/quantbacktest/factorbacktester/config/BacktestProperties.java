package com.quantbacktest.factorbacktester.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed binding of the {@code backtest.*} settings.
 *
 * <pre>
 * backtest:
 *   scheduler:
 *     poll-interval: 30s
 *     batch-size: 50
 *   metrics:
 *     trading-days-per-year: 252
 *     risk-free-rate: 0.03
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private Scheduler scheduler = new Scheduler();
    private Signal signal = new Signal();
    private Risk risk = new Risk();
    private Cost cost = new Cost();
    private Metrics metrics = new Metrics();
    private Replay replay = new Replay();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(30);
        private int batchSize = 50;
        private Duration errorBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Signal {
        private double buyThreshold = 0.6;
        private double sellThreshold = -0.6;
        private double minStrength = 0.1;
        private double maxPositionSize = 1.0;
        /** Signals below this confidence are filtered to HOLD. */
        private double minConfidence = 0.3;
        /** Non-HOLD signals below this strength are filtered to HOLD. */
        private double minFilterStrength = 0.2;
    }

    @Data
    public static class Risk {
        private BigDecimal maxPositionRatio = new BigDecimal("0.10");
        private BigDecimal stopLossRatio = new BigDecimal("0.05");
    }

    @Data
    public static class Cost {
        private BigDecimal commissionRate = new BigDecimal("0.0003");
        private BigDecimal minCommission = new BigDecimal("5");
        private BigDecimal stampTaxRate = new BigDecimal("0.001");
        private BigDecimal transferFeeRate = new BigDecimal("0.00002");
        private BigDecimal minTransferFee = new BigDecimal("1");
        private BigDecimal slippageRate = new BigDecimal("0.001");
        private int lotSize = 100;
    }

    @Data
    public static class Metrics {
        private int tradingDaysPerYear = 252;
        private double riskFreeRate = 0.03;
        private double varConfidence = 0.95;
    }

    @Data
    public static class Replay {
        private String exchange = "SSE";
        /** {@code memory} or {@code redis}. */
        private String cacheType = "memory";
        private String redisKeyPrefix = "backtest:snapshot";
    }
}
