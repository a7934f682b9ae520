package com.quantbacktest.factorbacktester.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetrics calculations.
 */
class PerformanceMetricsTest {

    @Test
    void testCalculateTotalReturn_WithProfit() {
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(
                new BigDecimal("10000"), new BigDecimal("12000"));

        assertEquals(0, new BigDecimal("0.2").compareTo(totalReturn));
    }

    @Test
    void testCalculateTotalReturn_WithLoss() {
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(
                new BigDecimal("10000"), new BigDecimal("8000"));

        assertEquals(0, new BigDecimal("-0.2").compareTo(totalReturn));
    }

    @Test
    void testCalculateTotalReturn_ZeroInitialCapital() {
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(BigDecimal.ZERO, new BigDecimal("1000"));

        assertEquals(BigDecimal.ZERO, totalReturn);
    }

    @Test
    void testCalculateAnnualReturn_LinearScaling() {
        BigDecimal annual = PerformanceMetrics.calculateAnnualReturn(new BigDecimal("0.01"), 63, 252);

        assertEquals(0, new BigDecimal("0.04").compareTo(annual));
    }

    @Test
    void testCalculateMaxDrawdown_PeakToTrough() {
        List<BigDecimal> values = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("11000"),
                new BigDecimal("9900"),
                new BigDecimal("10500"),
                new BigDecimal("12000"));

        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(values);

        // 11000 -> 9900
        assertEquals(0, new BigDecimal("0.1").compareTo(maxDrawdown));
    }

    @Test
    void testCalculateMaxDrawdown_NeverDecreasesAsSeriesGrows() {
        List<BigDecimal> values = Arrays.asList(
                new BigDecimal("100"), new BigDecimal("90"), new BigDecimal("95"),
                new BigDecimal("80"), new BigDecimal("120"), new BigDecimal("110"));

        BigDecimal previous = BigDecimal.ZERO;
        for (int end = 1; end <= values.size(); end++) {
            BigDecimal current = PerformanceMetrics.calculateMaxDrawdown(values.subList(0, end));
            assertTrue(current.compareTo(previous) >= 0, "Drawdown decreased at point " + end);
            assertTrue(current.signum() >= 0);
            previous = current;
        }
    }

    @Test
    void testCalculateMaxDrawdown_MonotonicIncrease() {
        List<BigDecimal> values = Arrays.asList(new BigDecimal("100"), new BigDecimal("101"), new BigDecimal("102"));

        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateMaxDrawdown(values)));
    }

    @Test
    void testCalculateVolatility_FewerThanTwoReturns() {
        BigDecimal volatility = PerformanceMetrics.calculateVolatility(new double[] { 0.01 }, 252);

        assertEquals(0, BigDecimal.ZERO.compareTo(volatility));
    }

    @Test
    void testCalculateSharpeRatio_ZeroVolatilityIsNull() {
        double[] flat = { 0.0, 0.0, 0.0 };
        BigDecimal volatility = PerformanceMetrics.calculateVolatility(flat, 252);

        assertNull(PerformanceMetrics.calculateSharpeRatio(new BigDecimal("0.05"), volatility, 0.03));
    }

    @Test
    void testCalculateSharpeRatio_Positive() {
        double[] returns = { 0.01, 0.02, -0.005, 0.015 };
        BigDecimal volatility = PerformanceMetrics.calculateVolatility(returns, 252);

        BigDecimal sharpe = PerformanceMetrics.calculateSharpeRatio(new BigDecimal("0.5"), volatility, 0.03);

        assertNotNull(sharpe);
        assertTrue(sharpe.signum() > 0);
    }

    @Test
    void testCalculateSortinoRatio_NoNegativeReturnsIsNull() {
        double[] returns = { 0.01, 0.02, 0.03 };

        assertNull(PerformanceMetrics.calculateSortinoRatio(returns, new BigDecimal("0.2"), 0.03, 252));
    }

    @Test
    void testCalculateSortinoRatio_SingleNegativeReturnIsNull() {
        double[] returns = { 0.01, -0.02, 0.03 };

        // One negative return has zero deviation
        assertNull(PerformanceMetrics.calculateSortinoRatio(returns, new BigDecimal("0.2"), 0.03, 252));
    }

    @Test
    void testCalculateValueAtRisk_LinearInterpolation() {
        double[] returns = { -0.05, -0.02, 0.0, 0.01, 0.03 };

        // 5th percentile: rank 0.2 between -0.05 and -0.02 -> -0.044
        BigDecimal var = PerformanceMetrics.calculateValueAtRisk(returns, 0.95);

        assertEquals(0, new BigDecimal("0.044").compareTo(var));
    }

    @Test
    void testCalculateValueAtRisk_EmptyIsNull() {
        assertNull(PerformanceMetrics.calculateValueAtRisk(new double[0], 0.95));
    }

    @Test
    void testCalculateTradeStats_WinRateFromSells() {
        List<Trade> trades = List.of(
                trade(Trade.TradeType.BUY, null),
                trade(Trade.TradeType.SELL, new BigDecimal("300")),
                trade(Trade.TradeType.BUY, null),
                trade(Trade.TradeType.SELL, new BigDecimal("-100")));

        PerformanceMetrics.TradeStats stats = PerformanceMetrics.calculateTradeStats(trades);

        assertEquals(0, new BigDecimal("0.5").compareTo(stats.getWinRate()));
        assertEquals(0, new BigDecimal("300").compareTo(stats.getAvgWin()));
        assertEquals(0, new BigDecimal("100").compareTo(stats.getAvgLoss()));
        assertEquals(0, new BigDecimal("3").compareTo(stats.getProfitLossRatio()));
    }

    @Test
    void testCalculateTradeStats_NoClosedTrades() {
        PerformanceMetrics.TradeStats stats = PerformanceMetrics.calculateTradeStats(
                List.of(trade(Trade.TradeType.BUY, null)));

        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getWinRate()));
    }

    @Test
    void testCalculateDailyReturns() {
        double[] returns = PerformanceMetrics.calculateDailyReturns(Arrays.asList(
                new BigDecimal("100"), new BigDecimal("110"), new BigDecimal("99")));

        assertEquals(2, returns.length);
        assertEquals(0.1, returns[0], 1e-9);
        assertEquals(-0.1, returns[1], 1e-9);
    }

    private static Trade trade(Trade.TradeType type, BigDecimal pnl) {
        return Trade.builder()
                .date(LocalDate.of(2024, 1, 2))
                .stockCode("600000.SH")
                .type(type)
                .price(BigDecimal.TEN)
                .shares(100)
                .realizedPnl(pnl)
                .build();
    }
}
