package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.domain.BacktestMode;
import lombok.Value;

import java.time.LocalDate;

/**
 * Cache key of one snapshot: stock, trading day and backtest mode.
 */
@Value
public class SnapshotKey {

    String stockCode;
    LocalDate date;
    BacktestMode mode;

    /**
     * {@code {stock}:{yyyy-MM-dd}:{mode}}
     */
    public String asString() {
        return stockCode + ":" + date + ":" + mode.name();
    }
}
