package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.TradingCalendarDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface TradingCalendarRepository extends JpaRepository<TradingCalendarDay, Long> {

    boolean existsByExchange(String exchange);

    List<TradingCalendarDay> findByExchangeAndOpenTrueAndCalDateBetweenOrderByCalDateAsc(
            String exchange, LocalDate start, LocalDate end);
}
