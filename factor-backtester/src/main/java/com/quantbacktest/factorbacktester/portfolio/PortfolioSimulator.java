package com.quantbacktest.factorbacktester.portfolio;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.NavPoint;
import com.quantbacktest.factorbacktester.domain.PerformanceMetrics;
import com.quantbacktest.factorbacktester.domain.PerformanceReport;
import com.quantbacktest.factorbacktester.domain.PortfolioPosition;
import com.quantbacktest.factorbacktester.domain.SignalType;
import com.quantbacktest.factorbacktester.domain.Trade;
import com.quantbacktest.factorbacktester.domain.TradingSignal;
import com.quantbacktest.factorbacktester.domain.TransactionCost;
import com.quantbacktest.factorbacktester.exception.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash, positions, NAV series and trade ledger of a single backtest run.
 * One instance per run; not thread-safe and never shared between tasks.
 */
@Slf4j
public class PortfolioSimulator {

    private final BigDecimal initialCapital;
    private final TransactionCostModel costModel;
    private final RiskControls riskControls;
    private final BacktestProperties.Metrics metricsSettings;
    private final int lotSize;

    private BigDecimal cash;
    private final Map<String, PortfolioPosition> positions = new LinkedHashMap<>();
    private final List<NavPoint> navSeries = new ArrayList<>();
    private final List<Trade> trades = new ArrayList<>();

    public PortfolioSimulator(BigDecimal initialCapital, TransactionCostModel costModel, RiskControls riskControls,
            BacktestProperties.Metrics metricsSettings, int lotSize) {
        this.initialCapital = initialCapital;
        this.costModel = costModel;
        this.riskControls = riskControls;
        this.metricsSettings = metricsSettings;
        this.lotSize = lotSize;
        this.cash = initialCapital;
        this.navSeries.add(new NavPoint(null, initialCapital, initialCapital));
    }

    /**
     * Applies one signal at the day's price: risk controls, sizing, costs, then state and NAV update.
     *
     * @return the executed trade, if any
     */
    public Optional<Trade> onSignal(TradingSignal signal, BigDecimal price) {
        String stockCode = signal.getStockCode();
        RiskDecision decision = riskControls.apply(signal, positions.get(stockCode), price, cash);
        TradingSignal controlled = decision.getSignal();

        Trade trade = null;
        if (controlled.getSignalType() == SignalType.BUY) {
            trade = buy(controlled, price);
        } else if (controlled.getSignalType() == SignalType.SELL) {
            trade = sell(controlled, price, decision.isStopLossTriggered());
        }

        PortfolioPosition position = positions.get(stockCode);
        if (position != null) {
            position.setCurrentPrice(price);
            if (position.getShares() == 0) {
                positions.remove(stockCode);
            }
        }

        navSeries.add(new NavPoint(signal.getTimestamp(), cash, getNetAssetValue()));
        return Optional.ofNullable(trade);
    }

    private Trade buy(TradingSignal signal, BigDecimal price) {
        long shares = BigDecimal.valueOf(signal.getPositionSize())
                .multiply(cash)
                .divide(price, 8, RoundingMode.DOWN)
                .divide(BigDecimal.valueOf(lotSize), 0, RoundingMode.DOWN)
                .longValue() * lotSize;

        TransactionCost cost = shares > 0 ? costModel.calculate(Trade.TradeType.BUY, price, shares) : null;
        // Minimum fees can push a small order over the available cash
        while (shares > 0 && isUnaffordable(price, shares, cost)) {
            shares -= lotSize;
            cost = shares > 0 ? costModel.calculate(Trade.TradeType.BUY, price, shares) : null;
        }
        if (shares <= 0) {
            log.debug("{} BUY sized to zero shares at {}", signal.getTimestamp(), price);
            return null;
        }

        BigDecimal notional = price.multiply(BigDecimal.valueOf(shares));
        withdraw(notional.add(cost.getTotal()));

        PortfolioPosition position = positions.computeIfAbsent(signal.getStockCode(),
                code -> PortfolioPosition.builder().stockCode(code).build());
        position.addShares(shares, price);

        Trade trade = record(signal.getTimestamp(), signal.getStockCode(), Trade.TradeType.BUY, price, shares,
                notional, cost, null, false);
        log.debug("{} BUY {} x {} cost {}", signal.getTimestamp(), shares, price, cost.getTotal());
        return trade;
    }

    private void withdraw(BigDecimal amount) {
        if (amount.compareTo(cash) > 0) {
            throw new InsufficientFundsException(amount, cash);
        }
        cash = cash.subtract(amount);
    }

    private boolean isUnaffordable(BigDecimal price, long shares, TransactionCost cost) {
        return price.multiply(BigDecimal.valueOf(shares)).add(cost.getTotal()).compareTo(cash) > 0;
    }

    private Trade sell(TradingSignal signal, BigDecimal price, boolean stopLoss) {
        PortfolioPosition position = positions.get(signal.getStockCode());
        if (position == null || position.getShares() <= 0) {
            return null;
        }

        long shares = position.getShares();
        BigDecimal notional = price.multiply(BigDecimal.valueOf(shares));
        TransactionCost cost = costModel.calculate(Trade.TradeType.SELL, price, shares);
        BigDecimal realizedPnl = price.subtract(position.getAvgCost())
                .multiply(BigDecimal.valueOf(shares))
                .subtract(cost.getTotal());

        cash = cash.add(notional).subtract(cost.getTotal());
        position.removeShares(shares);

        Trade trade = record(signal.getTimestamp(), signal.getStockCode(), Trade.TradeType.SELL, price, shares,
                notional, cost, realizedPnl, stopLoss);
        log.debug("{} SELL {} x {} pnl {}", signal.getTimestamp(), shares, price, realizedPnl);
        return trade;
    }

    private Trade record(LocalDate date, String stockCode, Trade.TradeType type, BigDecimal price, long shares,
            BigDecimal notional, TransactionCost cost, BigDecimal realizedPnl, boolean stopLoss) {
        Trade trade = Trade.builder()
                .date(date)
                .stockCode(stockCode)
                .type(type)
                .price(price)
                .shares(shares)
                .notional(notional)
                .commission(cost.getCommission())
                .stampTax(cost.getStampTax())
                .transferFee(cost.getTransferFee())
                .slippage(cost.getSlippage())
                .totalCost(cost.getTotal())
                .realizedPnl(realizedPnl)
                .stopLoss(stopLoss)
                .build();
        trades.add(trade);
        return trade;
    }

    public BigDecimal getNetAssetValue() {
        BigDecimal holdings = positions.values().stream()
                .map(PortfolioPosition::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return cash.add(holdings);
    }

    /**
     * Performance figures over the NAV series recorded so far.
     */
    public PerformanceReport buildReport() {
        List<BigDecimal> values = navSeries.stream()
                .map(NavPoint::getNetAssetValue)
                .toList();
        BigDecimal finalValue = values.get(values.size() - 1);
        int tradingDays = values.size() - 1;
        int daysPerYear = metricsSettings.getTradingDaysPerYear();
        double riskFreeRate = metricsSettings.getRiskFreeRate();

        double[] dailyReturns = PerformanceMetrics.calculateDailyReturns(values);
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(initialCapital, finalValue);
        BigDecimal annualReturn = PerformanceMetrics.calculateAnnualReturn(totalReturn, tradingDays, daysPerYear);
        BigDecimal volatility = PerformanceMetrics.calculateVolatility(dailyReturns, daysPerYear);
        PerformanceMetrics.TradeStats tradeStats = PerformanceMetrics.calculateTradeStats(trades);

        return PerformanceReport.builder()
                .totalReturn(totalReturn)
                .annualReturn(annualReturn)
                .maxDrawdown(PerformanceMetrics.calculateMaxDrawdown(values))
                .volatility(volatility)
                .sharpeRatio(PerformanceMetrics.calculateSharpeRatio(annualReturn, volatility, riskFreeRate))
                .sortinoRatio(PerformanceMetrics.calculateSortinoRatio(dailyReturns, annualReturn,
                        riskFreeRate, daysPerYear))
                .winRate(tradeStats.getWinRate())
                .avgWin(tradeStats.getAvgWin())
                .avgLoss(tradeStats.getAvgLoss())
                .profitLossRatio(tradeStats.getProfitLossRatio())
                .tradeCount(trades.size())
                .var95(PerformanceMetrics.calculateValueAtRisk(dailyReturns, metricsSettings.getVarConfidence()))
                .build();
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public Optional<PortfolioPosition> getPosition(String stockCode) {
        return Optional.ofNullable(positions.get(stockCode));
    }

    public List<NavPoint> getNavSeries() {
        return Collections.unmodifiableList(navSeries);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }
}
