package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily OHLCV bar as returned by the price provider.
 */
@Value
@Builder
@Jacksonized
public class PriceBar {

    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
    BigDecimal amount;

    /**
     * All four prices positive and low <= open, close <= high.
     */
    public boolean isConsistent() {
        if (!isPositive(open) || !isPositive(high) || !isPositive(low) || !isPositive(close)) {
            return false;
        }
        return low.compareTo(open) <= 0 && low.compareTo(close) <= 0
                && open.compareTo(high) <= 0 && close.compareTo(high) <= 0;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
