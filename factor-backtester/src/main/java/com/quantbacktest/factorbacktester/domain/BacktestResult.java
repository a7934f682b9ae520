package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing the outcome of a completed backtest task.
 * Holds the performance report plus the NAV series, trade ledger and factor combination as JSON.
 */
@Entity
@Table(name = "backtest_results", indexes = {
        @Index(name = "idx_result_task_id", columnList = "task_id", unique = true)
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, length = 64)
    private String taskId;

    @Column(name = "stock_code", nullable = false, length = 20)
    private String stockCode;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "backtest_mode", nullable = false, length = 32)
    private BacktestMode backtestMode;

    @Column(name = "initial_capital", nullable = false, precision = 18, scale = 2)
    private BigDecimal initialCapital;

    @Column(name = "final_value", precision = 18, scale = 2)
    private BigDecimal finalValue;

    @Column(name = "total_return", precision = 12, scale = 6)
    private BigDecimal totalReturn;

    @Column(name = "annual_return", precision = 12, scale = 6)
    private BigDecimal annualReturn;

    @Column(name = "max_drawdown", precision = 12, scale = 6)
    private BigDecimal maxDrawdown;

    @Column(name = "volatility", precision = 12, scale = 6)
    private BigDecimal volatility;

    @Column(name = "sharpe_ratio", precision = 12, scale = 6)
    private BigDecimal sharpeRatio;

    @Column(name = "sortino_ratio", precision = 12, scale = 6)
    private BigDecimal sortinoRatio;

    @Column(name = "win_rate", precision = 12, scale = 6)
    private BigDecimal winRate;

    @Column(name = "avg_win", precision = 18, scale = 6)
    private BigDecimal avgWin;

    @Column(name = "avg_loss", precision = 18, scale = 6)
    private BigDecimal avgLoss;

    @Column(name = "profit_loss_ratio", precision = 12, scale = 6)
    private BigDecimal profitLossRatio;

    @Column(name = "trade_count")
    private Integer tradeCount;

    @Column(name = "var_95", precision = 12, scale = 6)
    private BigDecimal var95;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "data_point_count")
    private Integer dataPointCount;

    @Column(name = "factor_combination_json", columnDefinition = "TEXT")
    private String factorCombinationJson;

    @Column(name = "nav_series_json", columnDefinition = "TEXT")
    private String navSeriesJson;

    @Column(name = "trades_json", columnDefinition = "TEXT")
    private String tradesJson;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
