package com.quantbacktest.factorbacktester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Represents a trade execution in the simulation ledger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trade {

    private LocalDate date;
    private String stockCode;
    private TradeType type;
    private BigDecimal price;
    private long shares;
    private BigDecimal notional;
    private BigDecimal commission;
    private BigDecimal stampTax;
    private BigDecimal transferFee;
    private BigDecimal slippage;
    private BigDecimal totalCost;

    // Set on sells only
    private BigDecimal realizedPnl;

    private boolean stopLoss;

    public enum TradeType {
        BUY, SELL
    }
}
