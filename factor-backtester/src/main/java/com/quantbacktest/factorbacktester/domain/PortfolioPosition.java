package com.quantbacktest.factorbacktester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Holding of a single stock during a simulation run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioPosition {

    private String stockCode;

    @Builder.Default
    private long shares = 0;

    @Builder.Default
    private BigDecimal avgCost = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal currentPrice = BigDecimal.ZERO;

    public BigDecimal getMarketValue() {
        return currentPrice.multiply(BigDecimal.valueOf(shares));
    }

    public BigDecimal getUnrealizedPnl() {
        return currentPrice.subtract(avgCost).multiply(BigDecimal.valueOf(shares));
    }

    /**
     * Adds shares bought at {@code price}; average cost is weighted by share count.
     */
    public void addShares(long quantity, BigDecimal price) {
        BigDecimal heldCost = avgCost.multiply(BigDecimal.valueOf(shares));
        BigDecimal boughtCost = price.multiply(BigDecimal.valueOf(quantity));
        shares += quantity;
        avgCost = heldCost.add(boughtCost).divide(BigDecimal.valueOf(shares), 6, RoundingMode.HALF_UP);
    }

    public void removeShares(long quantity) {
        shares -= quantity;
    }
}
