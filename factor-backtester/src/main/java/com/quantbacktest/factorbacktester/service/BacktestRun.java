package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.domain.NavPoint;
import com.quantbacktest.factorbacktester.domain.PerformanceReport;
import com.quantbacktest.factorbacktester.domain.Trade;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output of one pipeline run, before it is persisted.
 */
@Value
@Builder
public class BacktestRun {

    PerformanceReport report;
    BigDecimal finalValue;
    List<NavPoint> navSeries;
    List<Trade> trades;
    int dataPointCount;
}
