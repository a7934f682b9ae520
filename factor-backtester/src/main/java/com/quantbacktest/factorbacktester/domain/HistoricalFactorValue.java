package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Stored factor value for a stock on a trade date.
 * {@code publishedDate} is when the value became knowable; fundamentals are often published after the period they describe.
 */
@Entity
@Table(name = "historical_factor_values", uniqueConstraints = {
        @UniqueConstraint(name = "uk_factor_stock_date", columnNames = { "stock_code", "trade_date", "factor_name" })
}, indexes = {
        @Index(name = "idx_factor_stock_date", columnList = "stock_code, trade_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalFactorValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stock_code", nullable = false, length = 20)
    private String stockCode;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "factor_name", nullable = false, length = 100)
    private String factorName;

    @Column(name = "factor_value")
    private Double factorValue;

    @Column(name = "published_date", nullable = false)
    private LocalDate publishedDate;
}
