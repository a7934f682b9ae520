package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * End-of-run performance figures. Ratios are fractions, not percentages.
 * Sharpe, Sortino and VaR are null when they are undefined for the run.
 */
@Value
@Builder
@Jacksonized
public class PerformanceReport {

    BigDecimal totalReturn;
    BigDecimal annualReturn;
    BigDecimal maxDrawdown;
    BigDecimal volatility;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    BigDecimal winRate;
    BigDecimal avgWin;
    BigDecimal avgLoss;
    BigDecimal profitLossRatio;
    int tradeCount;
    BigDecimal var95;
}
