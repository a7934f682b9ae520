package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "trading_calendar", uniqueConstraints = {
        @UniqueConstraint(name = "uk_exchange_cal_date", columnNames = { "exchange", "cal_date" })
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradingCalendarDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "exchange", nullable = false, length = 10)
    private String exchange;

    @Column(name = "cal_date", nullable = false)
    private LocalDate calDate;

    @Column(name = "is_open", nullable = false)
    private boolean open;
}
