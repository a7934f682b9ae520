package com.quantbacktest.factorbacktester.domain;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Calculator for backtest performance metrics.
 * All ratios are returned as fractions with {@value #SCALE} decimal places.
 */
@Slf4j
public class PerformanceMetrics {

    public static final int SCALE = 6;

    private PerformanceMetrics() {
    }

    /**
     * Calculate total return as a fraction of initial capital.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialCapital)
                .divide(initialCapital, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Linear annualisation: total return scaled by trading days per year over the simulated days.
     */
    public static BigDecimal calculateAnnualReturn(BigDecimal totalReturn, int tradingDays, int tradingDaysPerYear) {
        if (tradingDays <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return totalReturn.multiply(BigDecimal.valueOf(tradingDaysPerYear))
                .divide(BigDecimal.valueOf(tradingDays), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate day-over-day returns of a value series.
     */
    public static double[] calculateDailyReturns(List<BigDecimal> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            BigDecimal prevValue = values.get(i - 1);
            BigDecimal currentValue = values.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) == 0) {
                returns.add(0.0);
            } else {
                returns.add(currentValue.subtract(prevValue)
                        .divide(prevValue, 10, RoundingMode.HALF_UP)
                        .doubleValue());
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Calculate maximum drawdown as a positive fraction of the running peak.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO.setScale(SCALE);
        BigDecimal peak = values.get(0);

        for (BigDecimal value : values) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .divide(peak, SCALE, RoundingMode.HALF_UP);

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown;
    }

    /**
     * Annualised population standard deviation of daily returns. Zero with fewer than two returns.
     */
    public static BigDecimal calculateVolatility(double[] dailyReturns, int tradingDaysPerYear) {
        if (dailyReturns.length < 2) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal volatility = toDecimal(standardDeviation(dailyReturns) * Math.sqrt(tradingDaysPerYear));
        return volatility == null ? BigDecimal.ZERO.setScale(SCALE) : volatility;
    }

    /**
     * Sharpe ratio, or null when volatility is zero.
     */
    public static BigDecimal calculateSharpeRatio(BigDecimal annualReturn, BigDecimal volatility, double riskFreeRate) {
        if (volatility.signum() <= 0) {
            return null;
        }
        return toDecimal((annualReturn.doubleValue() - riskFreeRate) / volatility.doubleValue());
    }

    /**
     * Sortino ratio using the deviation of negative daily returns only.
     * Null when there are no negative returns or their deviation is zero.
     */
    public static BigDecimal calculateSortinoRatio(double[] dailyReturns, BigDecimal annualReturn,
            double riskFreeRate, int tradingDaysPerYear) {
        double[] negative = Arrays.stream(dailyReturns).filter(r -> r < 0).toArray();
        if (negative.length == 0) {
            return null;
        }

        double downsideDeviation = standardDeviation(negative) * Math.sqrt(tradingDaysPerYear);
        if (downsideDeviation == 0) {
            return null;
        }
        return toDecimal((annualReturn.doubleValue() - riskFreeRate) / downsideDeviation);
    }

    /**
     * Historical value at risk: absolute value of the (1 - confidence) percentile of daily returns,
     * linearly interpolated between closest ranks. Null for an empty series.
     */
    public static BigDecimal calculateValueAtRisk(double[] dailyReturns, double confidence) {
        if (dailyReturns.length == 0) {
            return null;
        }
        return toDecimal(Math.abs(percentile(dailyReturns, 1.0 - confidence)));
    }

    /**
     * Win/loss statistics over closed (sell) trades.
     */
    public static TradeStats calculateTradeStats(List<Trade> trades) {
        int wins = 0;
        int closed = 0;
        BigDecimal totalWin = BigDecimal.ZERO;
        BigDecimal totalLoss = BigDecimal.ZERO;
        int losses = 0;

        for (Trade trade : trades) {
            if (trade.getType() != Trade.TradeType.SELL || trade.getRealizedPnl() == null) {
                continue;
            }
            closed++;
            BigDecimal pnl = trade.getRealizedPnl();
            if (pnl.signum() > 0) {
                wins++;
                totalWin = totalWin.add(pnl);
            } else if (pnl.signum() < 0) {
                losses++;
                totalLoss = totalLoss.add(pnl.abs());
            }
        }

        if (closed == 0) {
            BigDecimal zero = BigDecimal.ZERO.setScale(SCALE);
            return new TradeStats(zero, zero, zero, zero);
        }

        BigDecimal winRate = BigDecimal.valueOf(wins)
                .divide(BigDecimal.valueOf(closed), SCALE, RoundingMode.HALF_UP);
        BigDecimal avgWin = wins == 0 ? BigDecimal.ZERO.setScale(SCALE)
                : totalWin.divide(BigDecimal.valueOf(wins), SCALE, RoundingMode.HALF_UP);
        BigDecimal avgLoss = losses == 0 ? BigDecimal.ZERO.setScale(SCALE)
                : totalLoss.divide(BigDecimal.valueOf(losses), SCALE, RoundingMode.HALF_UP);
        BigDecimal profitLossRatio = avgLoss.signum() == 0 ? BigDecimal.ZERO.setScale(SCALE)
                : avgWin.divide(avgLoss, SCALE, RoundingMode.HALF_UP);

        return new TradeStats(winRate, avgWin, avgLoss, profitLossRatio);
    }

    static double standardDeviation(double[] values) {
        double mean = Arrays.stream(values).average().orElse(0.0);
        double sumSquaredDiff = 0.0;
        for (double value : values) {
            sumSquaredDiff += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    static double percentile(double[] values, double fraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    private static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.warn("Non-finite metric value {}", value);
            return null;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }

    @Value
    public static class TradeStats {
        BigDecimal winRate;
        BigDecimal avgWin;
        BigDecimal avgLoss;
        BigDecimal profitLossRatio;
    }
}
