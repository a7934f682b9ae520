package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Entity representing a stored daily price bar.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_stock_trade_date", columnNames = { "stock_code", "trade_date" })
}, indexes = {
        @Index(name = "idx_stock_trade_date", columnList = "stock_code, trade_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stock_code", nullable = false, length = 20)
    private String stockCode;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "open_price", nullable = false, precision = 12, scale = 4)
    private BigDecimal open;

    @Column(name = "high_price", nullable = false, precision = 12, scale = 4)
    private BigDecimal high;

    @Column(name = "low_price", nullable = false, precision = 12, scale = 4)
    private BigDecimal low;

    @Column(name = "close_price", nullable = false, precision = 12, scale = 4)
    private BigDecimal close;

    @Column(name = "volume", nullable = false)
    private Long volume;

    @Column(name = "amount", precision = 20, scale = 4)
    private BigDecimal amount;

    /**
     * Convert entity to a domain price bar.
     */
    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(this.tradeDate)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume == null ? 0L : this.volume)
                .amount(this.amount)
                .build();
    }
}
