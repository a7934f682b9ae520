package com.quantbacktest.factorbacktester.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.factorbacktester.domain.BacktestMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Response DTO for a completed task's performance report and ledgers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResultResponse {

    private Long resultId;
    private String taskId;
    private String stockCode;
    private LocalDate startDate;
    private LocalDate endDate;
    private BacktestMode backtestMode;
    private BigDecimal initialCapital;
    private BigDecimal finalValue;

    private BigDecimal totalReturn;
    private BigDecimal annualReturn;
    private BigDecimal maxDrawdown;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal sortinoRatio;
    private BigDecimal winRate;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal profitLossRatio;
    private Integer tradeCount;
    private BigDecimal var95;

    private Long executionTimeMs;
    private Integer dataPointCount;

    private JsonNode factorCombination;
    private JsonNode navSeries;
    private JsonNode trades;
}
